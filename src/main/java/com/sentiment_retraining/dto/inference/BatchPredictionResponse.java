package com.sentiment_retraining.dto.inference;

import java.util.List;

public record BatchPredictionResponse(List<PredictionResponse> predictions) {
}
