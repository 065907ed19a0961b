package com.sentiment_retraining.service.validation;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.CsvTable;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.validation.ValidationReport;
import com.sentiment_retraining.exception.ConfigurationException;
import com.sentiment_retraining.exception.DataIngestionException;
import com.sentiment_retraining.exception.DataSourceNotFoundException;
import com.sentiment_retraining.util.DatasetUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class RuleSuiteValidationEngine implements DataValidationEngine {

    private final Map<String, List<Expectation>> suites;

    public RuleSuiteValidationEngine(PipelineSettings settings) {
        this.suites = Map.of(settings.getValidationSuiteName(), dataQualitySuite(settings));
    }

    static List<Expectation> dataQualitySuite(PipelineSettings settings) {
        return List.of(
                Expectation.columnsExist(List.of(SentimentDataset.ID_COLUMN, SentimentDataset.TEXT_COLUMN, SentimentDataset.LABEL_COLUMN)),
                Expectation.rowCountAtLeast(settings.getMinRows()),
                Expectation.valuesNotNull(SentimentDataset.TEXT_COLUMN),
                Expectation.valuesNotNull(SentimentDataset.LABEL_COLUMN),
                Expectation.valuesInSet(SentimentDataset.LABEL_COLUMN, settings.getAllowedLabels()),
                Expectation.valuesUnique(SentimentDataset.ID_COLUMN),
                Expectation.valueLengthAtMost(SentimentDataset.TEXT_COLUMN, settings.getMaxTextLength()));
    }

    @Override
    public ValidationReport validate(String dataPath, String suiteName) {
        List<Expectation> suite = suites.get(suiteName);
        if (suite == null) {
            throw new ConfigurationException("Unknown expectation suite '" + suiteName + "'");
        }
        log.info("🔎 Running data validation suite '{}' on {}", suiteName, dataPath);

        Path path = Path.of(dataPath);
        if (!Files.isRegularFile(path)) {
            throw new DataSourceNotFoundException("Data file not found at: " + dataPath);
        }
        CsvTable table;
        try {
            table = DatasetUtil.readCsvTable(path);
        } catch (IOException | RuntimeException e) {
            throw new DataIngestionException("Could not read " + dataPath + " for validation", e);
        }

        List<String> failures = new ArrayList<>();
        for (Expectation expectation : suite) {
            List<String> details = expectation.evaluate(table);
            details.forEach(detail -> failures.add(expectation.name() + ": " + detail));
        }

        boolean success = failures.isEmpty();
        if (success) {
            log.info("✅ Data validation successful ({} expectations).", suite.size());
        } else {
            failures.forEach(failure -> log.warn("⚠️ Validation failure: {}", failure));
        }
        return new ValidationReport(suiteName, success, suite.size(), failures);
    }
}
