package com.sentiment_retraining.dto.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelInfoResponse(@JsonProperty("model_name") String modelName,
                                String version,
                                @JsonProperty("run_id") String runId,
                                @JsonProperty("model_uri") String modelUri,
                                String stage,
                                @JsonProperty("loaded_at") String loadedAt) {
}
