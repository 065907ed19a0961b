package com.sentiment_retraining.dto.train;

import com.sentiment_retraining.config.PipelineSettings;

import java.util.LinkedHashMap;
import java.util.Map;

public record TrainingConfig(int maxFeatures, int ngramMax, double ridge, int randomState) {

    public static TrainingConfig from(PipelineSettings settings) {
        return new TrainingConfig(settings.getMaxFeatures(), settings.getNgramMax(), settings.getRidge(), settings.getRandomState());
    }

    public Map<String, String> asParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("vectorizer", "StringToWordVector");
        params.put("tfidf_max_features", String.valueOf(maxFeatures));
        params.put("tfidf_ngram_range", "(1, " + ngramMax + ")");
        params.put("classifier", "Logistic");
        params.put("logistic_ridge", String.valueOf(ridge));
        params.put("random_state", String.valueOf(randomState));
        return params;
    }
}
