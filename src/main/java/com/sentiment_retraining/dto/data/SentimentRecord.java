package com.sentiment_retraining.dto.data;

/**
 * One feedback row. {@code prediction} is only present once a model has scored the row.
 */
public record SentimentRecord(String id, String text, String sentiment, String prediction) {

    public SentimentRecord withPrediction(String label) {
        return new SentimentRecord(id, text, sentiment, label);
    }
}
