package com.sentiment_retraining.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.sentiment_retraining.dto.data.CsvTable;
import com.sentiment_retraining.dto.data.DataSplit;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.data.SentimentRecord;
import org.apache.commons.lang3.StringUtils;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

public final class DatasetUtil {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private DatasetUtil() {
    }

    public static CsvTable readCsvTable(Path path) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = CSV_MAPPER
                .readerFor(new TypeReference<Map<String, String>>() { })
                .with(schema)
                .readValues(path.toFile())) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (iterator.hasNextValue()) {
                Map<String, String> row = new LinkedHashMap<>();
                iterator.nextValue().forEach((key, value) -> row.put(key, StringUtils.isBlank(value) ? null : value));
                rows.add(row);
            }
            return new CsvTable(headerOf(iterator, rows), rows);
        }
    }

    private static List<String> headerOf(MappingIterator<Map<String, String>> iterator, List<Map<String, String>> rows) {
        List<String> header = new ArrayList<>();
        if (iterator.getParserSchema() instanceof CsvSchema parsed) {
            parsed.forEach(column -> header.add(column.getName()));
        }
        if (header.isEmpty() && !rows.isEmpty()) {
            header.addAll(rows.get(0).keySet());
        }
        return header;
    }

    /**
     * Maps a raw table onto sentiment records. Unknown columns are ignored.
     */
    public static SentimentDataset toDataset(String name, CsvTable table) {
        List<SentimentRecord> records = table.rows().stream()
                .map(row -> new SentimentRecord(
                        row.get(SentimentDataset.ID_COLUMN),
                        row.get(SentimentDataset.TEXT_COLUMN),
                        row.get(SentimentDataset.LABEL_COLUMN),
                        row.get(SentimentDataset.PREDICTION_COLUMN)))
                .toList();
        return new SentimentDataset(name, records);
    }

    public static void writeCsv(SentimentDataset dataset, Path path, boolean includePredictions) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder()
                .addColumn(SentimentDataset.ID_COLUMN)
                .addColumn(SentimentDataset.TEXT_COLUMN)
                .addColumn(SentimentDataset.LABEL_COLUMN);
        if (includePredictions) {
            builder.addColumn(SentimentDataset.PREDICTION_COLUMN);
        }
        CsvSchema schema = builder.build().withHeader();

        List<Map<String, String>> rows = new ArrayList<>(dataset.size());
        for (SentimentRecord record : dataset.getRecords()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(SentimentDataset.ID_COLUMN, StringUtils.defaultString(record.id()));
            row.put(SentimentDataset.TEXT_COLUMN, StringUtils.defaultString(record.text()));
            row.put(SentimentDataset.LABEL_COLUMN, StringUtils.defaultString(record.sentiment()));
            if (includePredictions) {
                row.put(SentimentDataset.PREDICTION_COLUMN, StringUtils.defaultString(record.prediction()));
            }
            rows.add(row);
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CSV_MAPPER.writer(schema).writeValue(path.toFile(), rows);
    }

    /**
     * Shuffles each label group with a seeded generator and carves off the test share per label,
     * so class proportions are preserved and the same seed always yields the same split.
     * Labels with a single example stay in the training set.
     */
    public static DataSplit stratifiedSplit(List<String> features, List<String> labels, double testSize, int seed) {
        if (features.size() != labels.size()) {
            throw new IllegalArgumentException("Features and labels differ in length");
        }
        if (testSize <= 0.0 || testSize >= 1.0) {
            throw new IllegalArgumentException("Test size must be between 0 and 1: " + testSize);
        }

        Map<String, List<Integer>> byLabel = new TreeMap<>();
        for (int i = 0; i < labels.size(); i++) {
            byLabel.computeIfAbsent(labels.get(i), k -> new ArrayList<>()).add(i);
        }

        Random random = new Random(seed);
        boolean[] inTest = new boolean[labels.size()];
        for (List<Integer> indices : byLabel.values()) {
            Collections.shuffle(indices, random);
            int testCount = 0;
            if (indices.size() > 1) {
                testCount = (int) Math.round(indices.size() * testSize);
                testCount = Math.max(1, Math.min(testCount, indices.size() - 1));
            }
            for (int k = 0; k < testCount; k++) {
                inTest[indices.get(k)] = true;
            }
        }

        List<String> trainFeatures = new ArrayList<>();
        List<String> testFeatures = new ArrayList<>();
        List<String> trainLabels = new ArrayList<>();
        List<String> testLabels = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            if (inTest[i]) {
                testFeatures.add(features.get(i));
                testLabels.add(labels.get(i));
            } else {
                trainFeatures.add(features.get(i));
                trainLabels.add(labels.get(i));
            }
        }
        return new DataSplit(trainFeatures, testFeatures, trainLabels, testLabels);
    }

    /**
     * Builds a two-attribute Weka dataset: a string attribute holding the text and a nominal class.
     * {@code labels} may be null to build an unlabeled structure.
     */
    public static Instances toInstances(String relationName, String textAttribute, String classAttribute,
                                        List<String> classValues, List<String> texts, List<String> labels) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute(textAttribute, (List<String>) null));
        attributes.add(new Attribute(classAttribute, new ArrayList<>(classValues)));

        Instances data = new Instances(relationName, attributes, texts.size());
        data.setClassIndex(1);

        for (int i = 0; i < texts.size(); i++) {
            DenseInstance instance = new DenseInstance(2);
            instance.setDataset(data);
            instance.setValue(data.attribute(0), StringUtils.defaultString(texts.get(i)));
            if (labels != null) {
                instance.setValue(data.attribute(1), labels.get(i));
            } else {
                instance.setClassMissing();
            }
            data.add(instance);
        }
        return data;
    }
}
