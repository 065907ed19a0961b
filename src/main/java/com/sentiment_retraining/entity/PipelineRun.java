package com.sentiment_retraining.entity;

import com.sentiment_retraining.enumeration.DeploymentNotificationStatusEnum;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Entity
@Table(name = "pipeline_runs")
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PipelineRun {

    @Id
    @Column(length = 36)
    private String runId;

    @Column(nullable = false)
    private boolean forceRetrain;

    @Enumerated(EnumType.STRING)
    private PipelineStateEnum state; // PENDING, INGEST ... DONE, FAILED

    @Enumerated(EnumType.STRING)
    private PipelineOutcomeEnum outcome;

    private String trainingRunId;
    private Integer registeredVersion;
    private Double candidateAccuracy;

    @Enumerated(EnumType.STRING)
    private DeploymentNotificationStatusEnum notificationStatus;

    private String errorCode;

    @Version
    private Integer version;

    private ZonedDateTime startedAt;
    private ZonedDateTime finishedAt;
}
