package com.sentiment_retraining.dto.registry;

import com.sentiment_retraining.enumeration.ModelStageEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersionDTO {
    private String name;
    private int version;
    private ModelStageEnum stage;
    private String runId;
    private Double accuracyTag;
    private String artifactUri;
    private String description;
    private Map<String, String> tags;
    private ZonedDateTime createdAt;
    private ZonedDateTime lastUpdatedAt;
}
