package com.sentiment_retraining.service.data;

import com.sentiment_retraining.dto.data.CsvTable;
import com.sentiment_retraining.dto.data.DataSplit;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.data.SentimentRecord;
import com.sentiment_retraining.exception.DataIngestionException;
import com.sentiment_retraining.exception.DataSourceNotFoundException;
import com.sentiment_retraining.exception.FileProcessingException;
import com.sentiment_retraining.util.DatasetUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Service
@Slf4j
public class DataService {

    public SentimentDataset loadRawData(String rawDataPath) {
        log.info("📥 Loading raw data from: {}", rawDataPath);
        SentimentDataset dataset = load("raw", rawDataPath);
        if (dataset.isEmpty()) {
            log.warn("⚠️ Raw data file is empty.");
        }
        log.info("Loaded {} raw rows", dataset.size());
        return dataset;
    }

    public SentimentDataset loadReferenceData(String referenceDataPath) {
        log.info("📥 Loading reference data from: {}", referenceDataPath);
        SentimentDataset dataset = load("reference", referenceDataPath);
        log.info("Loaded {} reference rows", dataset.size());
        return dataset;
    }

    /**
     * Keeps the id, text and sentiment columns, drops rows missing text or sentiment
     * and writes the result to {@code processedDataPath}.
     */
    public SentimentDataset preprocess(SentimentDataset raw, String processedDataPath) {
        log.info("🧹 Starting data preprocessing...");
        List<SentimentRecord> kept = raw.getRecords().stream()
                .filter(r -> r.text() != null && r.sentiment() != null)
                .map(r -> new SentimentRecord(r.id(), r.text(), r.sentiment(), null))
                .toList();
        int dropped = raw.size() - kept.size();
        if (dropped > 0) {
            log.warn("⚠️ Dropped {} rows due to missing values.", dropped);
        }

        SentimentDataset processed = new SentimentDataset("processed", kept);
        try {
            DatasetUtil.writeCsv(processed, Path.of(processedDataPath), false);
        } catch (IOException e) {
            throw new FileProcessingException("Failed to save processed data to " + processedDataPath, e);
        }
        log.info("Processed data ({} rows) saved to: {}", processed.size(), processedDataPath);
        return processed;
    }

    public DataSplit split(SentimentDataset processed, double testSize, int randomState) {
        log.info("✂️ Splitting data into training and testing sets...");
        DataSplit split = DatasetUtil.stratifiedSplit(processed.texts(), processed.labels(), testSize, randomState);
        log.info("Training set size: {}, test set size: {}", split.trainFeatures().size(), split.testFeatures().size());
        return split;
    }

    private SentimentDataset load(String name, String location) {
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new DataSourceNotFoundException("Data file not found at: " + location);
        }
        try {
            CsvTable table = DatasetUtil.readCsvTable(path);
            return DatasetUtil.toDataset(name, table);
        } catch (IOException | RuntimeException e) {
            throw new DataIngestionException("Error loading " + name + " data from " + location, e);
        }
    }
}
