package com.sentiment_retraining.entity;

import com.sentiment_retraining.enumeration.ModelStageEnum;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "model_versions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"model_name", "version_number"}))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "model_name", nullable = false)
    private String name;

    @Column(name = "version_number", nullable = false)
    private Integer versionNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ModelStageEnum stage;

    @Column(nullable = false, length = 36)
    private String runId;

    // accuracy recorded at registration time; null when the tag was never written
    private Double accuracyTag;

    private String artifactUri;

    @Column(length = 1000)
    private String description;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_tags", joinColumns = @JoinColumn(name = "model_version_id"))
    @MapKeyColumn(name = "tag_key")
    @Column(name = "tag_value", length = 1000)
    private Map<String, String> tags = new HashMap<>();

    private ZonedDateTime createdAt;
    private ZonedDateTime lastUpdatedAt;

    @Version
    private Integer version;
}
