package com.sentiment_retraining.dto.pipeline;

import com.sentiment_retraining.enumeration.DeploymentNotificationStatusEnum;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunDTO {
    private String runId;
    private boolean forceRetrain;
    private PipelineStateEnum state;
    private PipelineOutcomeEnum outcome;
    private String trainingRunId;
    private Integer registeredVersion;
    private Double candidateAccuracy;
    private DeploymentNotificationStatusEnum notificationStatus;
    private String errorCode;
    private ZonedDateTime startedAt;
    private ZonedDateTime finishedAt;
}
