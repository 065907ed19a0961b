package com.sentiment_retraining.dto.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictionResponse(String text,
                                 String sentiment,
                                 double confidence,
                                 @JsonProperty("model_version") String modelVersion) {
}
