package com.sentiment_retraining.dto.data;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Getter
public final class SentimentDataset {

    public static final String ID_COLUMN = "id";
    public static final String TEXT_COLUMN = "text";
    public static final String LABEL_COLUMN = "sentiment";
    public static final String PREDICTION_COLUMN = "prediction";

    private final String name;
    private final List<SentimentRecord> records;

    public SentimentDataset(String name, List<SentimentRecord> records) {
        this.name = name;
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<String> texts() {
        return values(TEXT_COLUMN);
    }

    public List<String> labels() {
        return values(LABEL_COLUMN);
    }

    public List<String> predictions() {
        return values(PREDICTION_COLUMN);
    }

    public boolean hasPredictions() {
        return !records.isEmpty() && records.stream().allMatch(r -> r.prediction() != null);
    }

    public List<String> values(String column) {
        return switch (column) {
            case ID_COLUMN -> records.stream().map(SentimentRecord::id).toList();
            case TEXT_COLUMN -> records.stream().map(SentimentRecord::text).toList();
            case LABEL_COLUMN -> records.stream().map(SentimentRecord::sentiment).toList();
            case PREDICTION_COLUMN -> records.stream().map(SentimentRecord::prediction).toList();
            default -> throw new IllegalArgumentException("Unknown column: " + column);
        };
    }

    /**
     * Returns a copy with one prediction per record, in record order.
     */
    public SentimentDataset withPredictions(String newName, List<String> predictions) {
        if (predictions.size() != records.size()) {
            throw new IllegalArgumentException("Expected " + records.size() + " predictions but got " + predictions.size());
        }
        List<SentimentRecord> scored = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            scored.add(records.get(i).withPrediction(predictions.get(i)));
        }
        return new SentimentDataset(newName, scored);
    }

    public SentimentDataset withGroundTruthAsPrediction() {
        return withPredictions(name, labels());
    }

    /**
     * Fraction of records whose prediction equals the ground-truth label, or NaN when there is nothing to compare.
     */
    public double predictionAccuracy() {
        if (!hasPredictions()) {
            return Double.NaN;
        }
        long correct = records.stream().filter(r -> Objects.equals(r.sentiment(), r.prediction())).count();
        return (double) correct / records.size();
    }
}
