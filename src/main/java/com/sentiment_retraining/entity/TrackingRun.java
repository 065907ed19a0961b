package com.sentiment_retraining.entity;

import com.sentiment_retraining.enumeration.RunStatusEnum;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * One tracked training attempt: parameters, tags, metrics and the location of its model artifact.
 */
@Entity
@Table(name = "tracking_runs")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingRun {

    @Id
    @Column(length = 36)
    private String runId;

    @Column(nullable = false)
    private String experimentName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatusEnum status;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracking_run_params", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "param_key")
    @Column(name = "param_value", length = 1000)
    private Map<String, String> params = new HashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracking_run_tags", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "tag_key")
    @Column(name = "tag_value", length = 1000)
    private Map<String, String> tags = new HashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracking_run_metrics", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "metric_key")
    @Column(name = "metric_value")
    private Map<String, Double> metrics = new HashMap<>();

    private String artifactUri;

    private ZonedDateTime startedAt;
    private ZonedDateTime finishedAt;

    @Version
    private Integer version;
}
