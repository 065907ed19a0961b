package com.sentiment_retraining.service.registry;

import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import com.sentiment_retraining.service.training.TrackingService;
import com.sentiment_retraining.service.training.TrainedSentimentModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the current Production version of a registered model and loads its artifact.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProductionModelLoader {

    private final ModelRegistry modelRegistry;
    private final TrackingService trackingService;

    public Optional<LoadedModel> loadProduction(String modelName) {
        List<ModelVersionDTO> production = modelRegistry.getLatestVersions(modelName, ModelStageEnum.PRODUCTION);
        if (production.isEmpty()) {
            log.info("No Production version registered for '{}'", modelName);
            return Optional.empty();
        }
        ModelVersionDTO version = production.get(0);
        log.info("Loading Production model {} v{} from {}", modelName, version.getVersion(), version.getArtifactUri());
        TrainedSentimentModel model = trackingService.loadModelArtifact(version.getArtifactUri());
        return Optional.of(new LoadedModel(model, version, ZonedDateTime.now()));
    }

    public record LoadedModel(TrainedSentimentModel model, ModelVersionDTO version, ZonedDateTime loadedAt) {
    }
}
