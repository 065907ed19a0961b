package com.sentiment_retraining.service.registry;

import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.enumeration.ModelStageEnum;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Model registry port. Implementations guarantee that a model name has at most one version in
 * {@link ModelStageEnum#PRODUCTION} after every operation.
 */
public interface ModelRegistry {

    /**
     * Registers a new version bound to a tracking run's artifact. The version starts in {@link ModelStageEnum#NONE}.
     */
    ModelVersionDTO registerModel(String name, String runId, String artifactUri, Map<String, String> tags);

    /**
     * Versions of {@code name} currently in {@code stage}, newest first.
     */
    List<ModelVersionDTO> getLatestVersions(String name, ModelStageEnum stage);

    Map<String, Double> getRunMetrics(String runId);

    /**
     * Moves a version to {@code stage}. With {@code archiveExisting} every other version in that stage is archived.
     *
     * @throws com.sentiment_retraining.exception.StageConflictException when the move would leave two Production versions
     */
    ModelVersionDTO transitionStage(String name, int version, ModelStageEnum stage, boolean archiveExisting);

    /**
     * Like {@link #transitionStage} but only applies when the current Production version is still
     * {@code expectedProductionVersion} (null meaning "no Production version").
     *
     * @throws com.sentiment_retraining.exception.StageConflictException when another writer changed Production first
     */
    ModelVersionDTO compareAndSetStage(String name, int version, ModelStageEnum stage, boolean archiveExisting,
                                       Integer expectedProductionVersion);

    ModelVersionDTO updateDescription(String name, int version, String description);

    Optional<ModelVersionDTO> getVersion(String name, int version);

    List<ModelVersionDTO> listVersions(String name);
}
