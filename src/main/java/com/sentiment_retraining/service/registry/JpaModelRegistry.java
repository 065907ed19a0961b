package com.sentiment_retraining.service.registry;

import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.entity.ModelVersion;
import com.sentiment_retraining.entity.TrackingRun;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import com.sentiment_retraining.exception.StageConflictException;
import com.sentiment_retraining.repository.ModelVersionRepository;
import com.sentiment_retraining.repository.TrackingRunRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry backed by the application database. Writers for one model name are serialized by a
 * pessimistic lock on its versions; {@code @Version} on each row catches anything that slips past.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaModelRegistry implements ModelRegistry {

    public static final String TAG_ACCURACY = "accuracy";

    private final ModelVersionRepository modelVersionRepository;
    private final TrackingRunRepository trackingRunRepository;

    @Override
    @Transactional
    public ModelVersionDTO registerModel(String name, String runId, String artifactUri, Map<String, String> tags) {
        List<ModelVersion> existing = modelVersionRepository.lockAllByName(name);
        int nextVersion = existing.stream().mapToInt(ModelVersion::getVersionNumber).max().orElse(0) + 1;

        Map<String, String> safeTags = tags == null ? new HashMap<>() : new HashMap<>(tags);
        String accuracy = safeTags.get(TAG_ACCURACY);
        ZonedDateTime now = ZonedDateTime.now();
        ModelVersion saved = modelVersionRepository.save(ModelVersion.builder()
                .name(name)
                .versionNumber(nextVersion)
                .stage(ModelStageEnum.NONE)
                .runId(runId)
                .artifactUri(artifactUri)
                .accuracyTag(NumberUtils.isCreatable(accuracy) ? Double.valueOf(accuracy) : null)
                .tags(safeTags)
                .createdAt(now)
                .lastUpdatedAt(now)
                .build());
        log.info("🗂️ Registered {} version {} from run {}", name, nextVersion, runId);
        return toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModelVersionDTO> getLatestVersions(String name, ModelStageEnum stage) {
        return modelVersionRepository.findByNameAndStageOrderByVersionNumberDesc(name, stage).stream()
                .map(JpaModelRegistry::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Double> getRunMetrics(String runId) {
        TrackingRun run = trackingRunRepository.findById(runId)
                .orElseThrow(() -> new EntityNotFoundException("Tracking run " + runId + " not found"));
        return new HashMap<>(run.getMetrics());
    }

    @Override
    @Transactional
    public ModelVersionDTO transitionStage(String name, int version, ModelStageEnum stage, boolean archiveExisting) {
        return applyTransition(name, version, stage, archiveExisting, false, null);
    }

    @Override
    @Transactional
    public ModelVersionDTO compareAndSetStage(String name, int version, ModelStageEnum stage, boolean archiveExisting,
                                              Integer expectedProductionVersion) {
        return applyTransition(name, version, stage, archiveExisting, true, expectedProductionVersion);
    }

    @Override
    @Transactional
    public ModelVersionDTO updateDescription(String name, int version, String description) {
        ModelVersion target = modelVersionRepository.findByNameAndVersionNumber(name, version)
                .orElseThrow(() -> versionNotFound(name, version));
        target.setDescription(description);
        target.setLastUpdatedAt(ZonedDateTime.now());
        return toDto(modelVersionRepository.save(target));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ModelVersionDTO> getVersion(String name, int version) {
        return modelVersionRepository.findByNameAndVersionNumber(name, version).map(JpaModelRegistry::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModelVersionDTO> listVersions(String name) {
        return modelVersionRepository.findByNameOrderByVersionNumberDesc(name).stream()
                .map(JpaModelRegistry::toDto)
                .toList();
    }

    private ModelVersionDTO applyTransition(String name, int version, ModelStageEnum stage, boolean archiveExisting,
                                            boolean checkExpectation, Integer expectedProductionVersion) {
        List<ModelVersion> versions = modelVersionRepository.lockAllByName(name);
        ModelVersion target = versions.stream()
                .filter(v -> v.getVersionNumber() == version)
                .findFirst()
                .orElseThrow(() -> versionNotFound(name, version));

        List<ModelVersion> otherProduction = versions.stream()
                .filter(v -> v != target && v.getStage() == ModelStageEnum.PRODUCTION)
                .toList();

        if (checkExpectation) {
            Integer actual = otherProduction.isEmpty() ? null : otherProduction.get(0).getVersionNumber();
            if (target.getStage() == ModelStageEnum.PRODUCTION) {
                actual = target.getVersionNumber();
            }
            if (!Objects.equals(expectedProductionVersion, actual)) {
                throw new StageConflictException("Production of '" + name + "' is v" + actual
                        + " but v" + expectedProductionVersion + " was expected");
            }
        }
        if (stage == ModelStageEnum.PRODUCTION && !otherProduction.isEmpty() && !archiveExisting) {
            throw new StageConflictException("'" + name + "' already has Production version v"
                    + otherProduction.get(0).getVersionNumber());
        }

        ZonedDateTime now = ZonedDateTime.now();
        if (archiveExisting) {
            versions.stream()
                    .filter(v -> v != target && v.getStage() == stage)
                    .forEach(v -> {
                        log.info("📦 Archiving {} v{} (was {})", name, v.getVersionNumber(), v.getStage());
                        v.setStage(ModelStageEnum.ARCHIVED);
                        v.setLastUpdatedAt(now);
                    });
        }
        ModelStageEnum previous = target.getStage();
        target.setStage(stage);
        target.setLastUpdatedAt(now);
        modelVersionRepository.saveAll(versions);
        log.info("🔀 {} v{} moved {} -> {}", name, version, previous, stage);
        return toDto(target);
    }

    private static EntityNotFoundException versionNotFound(String name, int version) {
        return new EntityNotFoundException("Model version " + name + " v" + version + " not found");
    }

    private static ModelVersionDTO toDto(ModelVersion entity) {
        return ModelVersionDTO.builder()
                .name(entity.getName())
                .version(entity.getVersionNumber())
                .stage(entity.getStage())
                .runId(entity.getRunId())
                .accuracyTag(entity.getAccuracyTag())
                .artifactUri(entity.getArtifactUri())
                .description(entity.getDescription())
                .tags(new HashMap<>(entity.getTags()))
                .createdAt(entity.getCreatedAt())
                .lastUpdatedAt(entity.getLastUpdatedAt())
                .build();
    }
}
