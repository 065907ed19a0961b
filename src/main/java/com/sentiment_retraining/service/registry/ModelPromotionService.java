package com.sentiment_retraining.service.registry;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.registry.AccuracyLookup;
import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.dto.registry.RegistrationResult;
import com.sentiment_retraining.dto.train.TrainingRun;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import com.sentiment_retraining.enumeration.PromotionVerdictEnum;
import com.sentiment_retraining.exception.PromotionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registers evaluated runs and decides whether the new version replaces the Production version.
 * A candidate only reaches Production when there is none yet or when it is strictly more accurate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelPromotionService {

    private final ModelRegistry modelRegistry;
    private final PipelineSettings settings;

    /**
     * @return empty when the run is not eligible; nothing is written to the registry in that case
     * @throws PromotionFailedException when the description update or the promotion failed; the version is left in Staging
     */
    public Optional<RegistrationResult> register(TrainingRun run, boolean promote) {
        if (!run.eligible()) {
            log.warn("⚠️ Model from run {} is not eligible for registration. Skipping.", run.runId());
            return Optional.empty();
        }

        String modelName = settings.getModelName();
        double newAccuracy = run.accuracy();

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("run_id", run.runId());
        tags.put(JpaModelRegistry.TAG_ACCURACY, String.valueOf(newAccuracy));

        ModelVersionDTO registered = modelRegistry.registerModel(modelName, run.runId(),
                run.artifactHandle().artifactUri(), tags);
        log.info("🗂️ Model registered as version {}", registered.getVersion());

        try {
            modelRegistry.updateDescription(modelName, registered.getVersion(), String.format(Locale.ROOT,
                    "Model trained in run %s with test accuracy: %.4f.", run.runId(), newAccuracy));
        } catch (RuntimeException e) {
            log.error("❌ Could not describe {} v{}: {}", modelName, registered.getVersion(), e.getMessage(), e);
            throw stageAfterFailure(modelName, registered.getVersion(), e);
        }

        if (!promote) {
            log.info("Transitioning new model version to Staging...");
            ModelVersionDTO staged = modelRegistry.transitionStage(modelName, registered.getVersion(), ModelStageEnum.STAGING, true);
            return Optional.of(new RegistrationResult(staged, PromotionVerdictEnum.STAGED_DIRECT, null));
        }
        return Optional.of(promote(registered, newAccuracy));
    }

    RegistrationResult promote(ModelVersionDTO candidate, double newAccuracy) {
        String modelName = candidate.getName();
        int newVersion = candidate.getVersion();
        try {
            List<ModelVersionDTO> production = modelRegistry.getLatestVersions(modelName, ModelStageEnum.PRODUCTION);
            if (production.isEmpty()) {
                log.info("🚀 No model currently in Production. Promoting v{}...", newVersion);
                ModelVersionDTO promoted = modelRegistry.compareAndSetStage(modelName, newVersion,
                        ModelStageEnum.PRODUCTION, false, null);
                return new RegistrationResult(promoted, PromotionVerdictEnum.BOOTSTRAP_PROMOTED, null);
            }

            ModelVersionDTO current = production.get(0);
            AccuracyLookup currentAccuracy = resolveProductionAccuracy(current);
            log.info("Comparing models: New (v{}, Acc: {}) vs. Production (v{}, Acc: {}, source {})",
                    newVersion, format(newAccuracy), current.getVersion(), format(currentAccuracy.value()), currentAccuracy.source());

            if (newAccuracy > currentAccuracy.value()) {
                log.info("🚀 New model is better. Promoting to Production and archiving v{}.", current.getVersion());
                ModelVersionDTO promoted = modelRegistry.compareAndSetStage(modelName, newVersion,
                        ModelStageEnum.PRODUCTION, true, current.getVersion());
                return new RegistrationResult(promoted, PromotionVerdictEnum.PROMOTED, currentAccuracy);
            }

            log.warn("⚠️ New model is not better than the current Production model. Transitioning to Staging instead.");
            ModelVersionDTO staged = modelRegistry.transitionStage(modelName, newVersion, ModelStageEnum.STAGING, false);
            return new RegistrationResult(staged, PromotionVerdictEnum.STAGED_NOT_BETTER, currentAccuracy);
        } catch (RuntimeException e) {
            log.error("❌ Error during promotion of {} v{}: {}", modelName, newVersion, e.getMessage(), e);
            throw stageAfterFailure(modelName, newVersion, e);
        }
    }

    private PromotionFailedException stageAfterFailure(String modelName, int version, RuntimeException cause) {
        try {
            modelRegistry.transitionStage(modelName, version, ModelStageEnum.STAGING, false);
            log.warn("{} v{} left in Staging after failed promotion", modelName, version);
        } catch (RuntimeException stagingError) {
            log.error("Could not move {} v{} to Staging: {}", modelName, version, stagingError.getMessage());
            cause.addSuppressed(stagingError);
        }
        return new PromotionFailedException("Promotion of " + modelName + " v" + version + " failed", cause);
    }

    /**
     * Accuracy recorded on the version's tag, then the producing run's metrics, then 0.0.
     */
    AccuracyLookup resolveProductionAccuracy(ModelVersionDTO production) {
        Double tagged = production.getAccuracyTag();
        if (tagged != null && tagged != 0.0) {
            return AccuracyLookup.fromTag(tagged);
        }
        try {
            Double metric = modelRegistry.getRunMetrics(production.getRunId()).get("accuracy");
            if (metric != null) {
                return AccuracyLookup.fromMetric(metric);
            }
        } catch (RuntimeException e) {
            log.warn("Could not read run metrics for Production version {}: {}", production.getVersion(), e.getMessage());
        }
        log.warn("⚠️ Could not retrieve accuracy for Production version {}. Defaulting to 0.0.", production.getVersion());
        return AccuracyLookup.defaulted();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
