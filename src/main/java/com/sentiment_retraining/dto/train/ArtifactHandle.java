package com.sentiment_retraining.dto.train;

import com.sentiment_retraining.service.training.TrainedSentimentModel;

/**
 * Where a fitted model was stored, plus the in-memory copy for immediate evaluation.
 */
public record ArtifactHandle(String artifactUri, TrainedSentimentModel model) {
}
