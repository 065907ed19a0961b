package com.sentiment_retraining.dto.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(String status,
                             @JsonProperty("model_loaded") boolean modelLoaded,
                             @JsonProperty("service_name") String serviceName,
                             String version) {

    public static HealthResponse of(boolean modelLoaded, String serviceName, String version) {
        return new HealthResponse(modelLoaded ? "healthy" : "unhealthy", modelLoaded, serviceName, version);
    }
}
