package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.DataSplit;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.deployment.DeploymentNotificationResult;
import com.sentiment_retraining.dto.drift.AnalysisResult;
import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import com.sentiment_retraining.dto.registry.RegistrationResult;
import com.sentiment_retraining.dto.train.TrainingConfig;
import com.sentiment_retraining.dto.train.TrainingRun;
import com.sentiment_retraining.dto.validation.ValidationReport;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import com.sentiment_retraining.exception.ConfigurationException;
import com.sentiment_retraining.exception.DataSourceNotFoundException;
import com.sentiment_retraining.exception.DataValidationException;
import com.sentiment_retraining.exception.ModelIneligibleException;
import com.sentiment_retraining.exception.PipelineException;
import com.sentiment_retraining.service.data.CurrentDataService;
import com.sentiment_retraining.service.data.DataService;
import com.sentiment_retraining.service.deployment.DeploymentTriggerService;
import com.sentiment_retraining.service.drift.DriftCheckService;
import com.sentiment_retraining.service.registry.ModelPromotionService;
import com.sentiment_retraining.service.registry.ProductionModelLoader.LoadedModel;
import com.sentiment_retraining.service.task.RetryPolicy;
import com.sentiment_retraining.service.task.TaskRunner;
import com.sentiment_retraining.service.training.ModelTrainingService;
import com.sentiment_retraining.service.validation.DataValidationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Drives one retraining cycle:
 * INGEST, VALIDATE, DECIDE, then either SKIP or PREPROCESS, SPLIT, TRAIN, EVALUATE, REGISTER, NOTIFY,
 * ending in DONE or FAILED. Every transition is recorded through {@link PipelineRunService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrainingOrchestrator {

    private final PipelineSettings settings;
    private final PipelineRunService pipelineRunService;
    private final TaskRunner taskRunner;
    private final DataService dataService;
    private final DataValidationEngine dataValidationEngine;
    private final CurrentDataService currentDataService;
    private final DriftCheckService driftCheckService;
    private final RetrainDecisionEngine retrainDecisionEngine;
    private final ModelTrainingService modelTrainingService;
    private final ModelPromotionService modelPromotionService;
    private final DeploymentTriggerService deploymentTriggerService;

    public PipelineRunDTO run(boolean forceRetrain) {
        String runId = pipelineRunService.initRun(forceRetrain);
        return execute(runId, forceRetrain);
    }

    public PipelineRunDTO execute(String runId, boolean forceRetrain) {
        log.info("🚀 Retraining pipeline {} started for project '{}' (forceRetrain={})",
                runId, settings.getProjectName(), forceRetrain);
        try {
            pipelineRunService.moveTo(runId, PipelineStateEnum.INGEST);
            SentimentDataset raw = taskRunner.execute("Load Raw Data", ingestRetryPolicy(),
                    settings.getRawDataPath(), dataService::loadRawData);

            pipelineRunService.moveTo(runId, PipelineStateEnum.VALIDATE);
            ValidationReport report = taskRunner.execute("Validate Data Quality", validationRetryPolicy(),
                    settings.getRawDataPath(), path -> dataValidationEngine.validate(path, settings.getValidationSuiteName()));
            if (!report.success()) {
                throw new DataValidationException("Data validation failed! Halting pipeline.");
            }

            pipelineRunService.moveTo(runId, PipelineStateEnum.DECIDE);
            if (!shouldRetrain(raw, forceRetrain)) {
                pipelineRunService.moveTo(runId, PipelineStateEnum.SKIP);
                return pipelineRunService.complete(runId, PipelineOutcomeEnum.SKIPPED, null, null);
            }

            return retrain(runId, raw);
        } catch (DataValidationException | ModelIneligibleException e) {
            log.warn("⚠️ Pipeline {} halted by quality gate: {}", runId, e.getMessage());
            return pipelineRunService.fail(runId, e.getErrorCode(), null);
        } catch (PipelineException e) {
            log.error("❌ Pipeline {} failed: {}", runId, e.getMessage(), e);
            return pipelineRunService.fail(runId, e.getErrorCode(), null);
        } catch (RuntimeException e) {
            log.error("❌ Pipeline {} failed unexpectedly: {}", runId, e.getMessage(), e);
            return pipelineRunService.fail(runId, "INTERNAL_ERROR", null);
        }
    }

    private boolean shouldRetrain(SentimentDataset raw, boolean forceRetrain) {
        if (forceRetrain) {
            return retrainDecisionEngine.decideRetrain(null, true);
        }
        SentimentDataset reference = taskRunner.execute("Load Reference Data", RetryPolicy.none(),
                settings.getReferenceDataPath(), dataService::loadReferenceData);
        AnalysisResult analysis;
        try {
            Optional<LoadedModel> production = currentDataService.resolveProduction();
            SentimentDataset scoredReference = currentDataService.prepareReference(reference, production);
            SentimentDataset current = currentDataService.simulateCurrentData(scoredReference, raw, production);
            analysis = driftCheckService.analyzeOrAssumeDrift(scoredReference, current);
        } catch (RuntimeException e) {
            log.error("❌ Could not prepare data for drift analysis, assuming drift: {}", e.getMessage(), e);
            analysis = AnalysisResult.assumedDrift();
        }
        log.info("Drift analysis: drift={}, degraded={}, current accuracy={}, reference accuracy={}, report={}",
                analysis.driftDetected(), analysis.performanceDegraded(), analysis.currentAccuracy(),
                analysis.referenceAccuracy(), analysis.reportLocation());
        return retrainDecisionEngine.decideRetrain(analysis, false);
    }

    private PipelineRunDTO retrain(String runId, SentimentDataset raw) {
        pipelineRunService.moveTo(runId, PipelineStateEnum.PREPROCESS);
        SentimentDataset processed = taskRunner.execute("Preprocess and Save Data", RetryPolicy.none(),
                raw, data -> dataService.preprocess(data, settings.getProcessedDataPath()));

        pipelineRunService.moveTo(runId, PipelineStateEnum.SPLIT);
        DataSplit split = taskRunner.execute("Split Data", RetryPolicy.none(), processed,
                data -> dataService.split(data, settings.getTestSplitSize(), settings.getRandomState()));

        pipelineRunService.moveTo(runId, PipelineStateEnum.TRAIN);
        TrainingRun trained = taskRunner.execute("Train Model", RetryPolicy.none(), split,
                data -> modelTrainingService.train(data.trainFeatures(), data.trainLabels(), TrainingConfig.from(settings)));

        pipelineRunService.moveTo(runId, PipelineStateEnum.EVALUATE);
        TrainingRun evaluated = taskRunner.execute("Evaluate Model", RetryPolicy.none(), trained,
                run -> modelTrainingService.completeEvaluation(run, split.testFeatures(), split.testLabels()));
        pipelineRunService.recordTraining(runId, evaluated.runId(), evaluated.accuracy());

        pipelineRunService.moveTo(runId, PipelineStateEnum.REGISTER);
        Optional<RegistrationResult> registration = modelPromotionService.register(evaluated, true);
        if (registration.isEmpty()) {
            throw new ModelIneligibleException("Model from run " + evaluated.runId() + " is below the accuracy threshold");
        }
        RegistrationResult result = registration.get();
        if (!result.isPromoted()) {
            log.info("Version {} staged ({}); no deployment triggered", result.version(), result.verdict());
            return pipelineRunService.complete(runId, PipelineOutcomeEnum.RETRAINED_AND_STAGED, result.version(), null);
        }

        pipelineRunService.moveTo(runId, PipelineStateEnum.NOTIFY);
        DeploymentNotificationResult notification = deploymentTriggerService.notifyDeployment(result.version(), evaluated.accuracy());
        if (!notification.isSent()) {
            log.info("Deployment notification for v{} not sent: {} ({})", result.version(), notification.status(), notification.reason());
        }
        return pipelineRunService.complete(runId, PipelineOutcomeEnum.RETRAINED_AND_PROMOTED, result.version(), notification.status());
    }

    private RetryPolicy ingestRetryPolicy() {
        return RetryPolicy.fixed(settings.getIngestMaxRetries(), Duration.ofMillis(settings.getIngestRetryDelayMs()),
                DataSourceNotFoundException.class, ConfigurationException.class);
    }

    private RetryPolicy validationRetryPolicy() {
        return RetryPolicy.fixed(1, Duration.ZERO, DataSourceNotFoundException.class, ConfigurationException.class);
    }
}
