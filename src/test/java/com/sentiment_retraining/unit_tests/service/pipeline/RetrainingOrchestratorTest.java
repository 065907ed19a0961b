package com.sentiment_retraining.unit_tests.service.pipeline;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.DataSplit;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.deployment.DeploymentNotificationResult;
import com.sentiment_retraining.dto.drift.AnalysisResult;
import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.dto.registry.RegistrationResult;
import com.sentiment_retraining.dto.train.ArtifactHandle;
import com.sentiment_retraining.dto.train.TrainingRun;
import com.sentiment_retraining.dto.validation.ValidationReport;
import com.sentiment_retraining.enumeration.DeploymentNotificationStatusEnum;
import com.sentiment_retraining.enumeration.ModelStageEnum;
import com.sentiment_retraining.enumeration.PipelineOutcomeEnum;
import com.sentiment_retraining.enumeration.PipelineStateEnum;
import com.sentiment_retraining.enumeration.PromotionVerdictEnum;
import com.sentiment_retraining.exception.DataIngestionException;
import com.sentiment_retraining.exception.DataSourceNotFoundException;
import com.sentiment_retraining.exception.FileProcessingException;
import com.sentiment_retraining.exception.TrainingFailedException;
import com.sentiment_retraining.service.data.CurrentDataService;
import com.sentiment_retraining.service.data.DataService;
import com.sentiment_retraining.service.deployment.DeploymentTriggerService;
import com.sentiment_retraining.service.drift.DriftCheckService;
import com.sentiment_retraining.service.pipeline.PipelineRunService;
import com.sentiment_retraining.service.pipeline.RetrainDecisionEngine;
import com.sentiment_retraining.service.pipeline.RetrainingOrchestrator;
import com.sentiment_retraining.service.registry.ModelPromotionService;
import com.sentiment_retraining.service.task.TaskRunner;
import com.sentiment_retraining.service.training.ModelTrainingService;
import com.sentiment_retraining.service.validation.DataValidationEngine;
import com.sentiment_retraining.util.SampleData;
import com.sentiment_retraining.util.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrainingOrchestratorTest {

    private static final String RUN_ID = "pipeline-1";

    @Mock
    private PipelineRunService pipelineRunService;
    @Mock
    private DataService dataService;
    @Mock
    private DataValidationEngine dataValidationEngine;
    @Mock
    private CurrentDataService currentDataService;
    @Mock
    private DriftCheckService driftCheckService;
    @Mock
    private ModelTrainingService modelTrainingService;
    @Mock
    private ModelPromotionService modelPromotionService;
    @Mock
    private DeploymentTriggerService deploymentTriggerService;

    private final PipelineSettings settings = TestSettings.defaults();

    private RetrainingOrchestrator orchestrator;

    private final SentimentDataset raw = SampleData.feedback("raw", 2);
    private final DataSplit split = new DataSplit(List.of("a", "b"), List.of("c"), List.of("positive", "negative"), List.of("positive"));
    private final TrainingRun trained = TrainingRun.trained("train-1", new ArtifactHandle("test-models/train-1/model/model.weka", null));
    private final TrainingRun evaluated = trained.evaluated(Map.of(TrainingRun.ACCURACY, 0.9), true);

    @BeforeEach
    void setUp() {
        orchestrator = new RetrainingOrchestrator(settings, pipelineRunService, new TaskRunner(), dataService,
                dataValidationEngine, currentDataService, driftCheckService, new RetrainDecisionEngine(),
                modelTrainingService, modelPromotionService, deploymentTriggerService);

        when(pipelineRunService.initRun(anyBoolean())).thenReturn(RUN_ID);
        when(pipelineRunService.complete(anyString(), any(), any(), any())).thenAnswer(inv -> PipelineRunDTO.builder()
                .runId(inv.getArgument(0))
                .state(PipelineStateEnum.DONE)
                .outcome(inv.getArgument(1))
                .registeredVersion(inv.getArgument(2))
                .notificationStatus(inv.getArgument(3))
                .build());
        when(pipelineRunService.fail(anyString(), anyString(), any())).thenAnswer(inv -> PipelineRunDTO.builder()
                .runId(inv.getArgument(0))
                .state(PipelineStateEnum.FAILED)
                .outcome(PipelineOutcomeEnum.FAILED)
                .errorCode(inv.getArgument(1))
                .build());

        when(dataService.loadRawData(settings.getRawDataPath())).thenReturn(raw);
        when(dataValidationEngine.validate(settings.getRawDataPath(), settings.getValidationSuiteName()))
                .thenReturn(new ValidationReport("data_quality_suite", true, 5, List.of()));
        when(dataService.preprocess(raw, settings.getProcessedDataPath())).thenReturn(raw);
        when(dataService.split(raw, settings.getTestSplitSize(), settings.getRandomState())).thenReturn(split);
        when(modelTrainingService.train(eq(split.trainFeatures()), eq(split.trainLabels()), any())).thenReturn(trained);
        when(modelTrainingService.completeEvaluation(trained, split.testFeatures(), split.testLabels())).thenReturn(evaluated);
    }

    @Nested
    @DisplayName("Decision")
    class DecisionTests {

        @Test
        @DisplayName("No drift and no degradation skips retraining")
        void stableDataSkips() {
            SentimentDataset reference = SampleData.feedback("reference", 1);
            when(dataService.loadReferenceData(settings.getReferenceDataPath())).thenReturn(reference);
            when(currentDataService.resolveProduction()).thenReturn(Optional.empty());
            when(currentDataService.prepareReference(reference, Optional.empty())).thenReturn(reference);
            when(currentDataService.simulateCurrentData(reference, raw, Optional.empty())).thenReturn(raw);
            when(driftCheckService.analyzeOrAssumeDrift(reference, raw))
                    .thenReturn(AnalysisResult.of(false, false, 0.9, 0.9, "reports/drift/r.html"));

            PipelineRunDTO result = orchestrator.run(false);

            assertEquals(PipelineOutcomeEnum.SKIPPED, result.getOutcome());
            verify(pipelineRunService).moveTo(RUN_ID, PipelineStateEnum.SKIP);
            verifyNoInteractions(modelTrainingService, modelPromotionService, deploymentTriggerService);
        }

        @Test
        @DisplayName("Unloadable Production model assumes drift and retrains")
        void unloadableProductionRetrains() {
            // Given
            when(dataService.loadReferenceData(settings.getReferenceDataPath())).thenReturn(SampleData.feedback("reference", 1));
            when(currentDataService.resolveProduction()).thenThrow(new FileProcessingException("minio down"));
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(staged()));

            // When
            PipelineRunDTO result = orchestrator.run(false);

            // Then
            assertEquals(PipelineOutcomeEnum.RETRAINED_AND_STAGED, result.getOutcome());
            verify(pipelineRunService).moveTo(RUN_ID, PipelineStateEnum.PREPROCESS);
            verify(pipelineRunService, never()).fail(anyString(), anyString(), any());
            verifyNoInteractions(driftCheckService);
        }

        @Test
        @DisplayName("Scoring failure on the current window assumes drift and retrains")
        void scoringFailureRetrains() {
            // Given
            SentimentDataset reference = SampleData.feedback("reference", 1);
            when(dataService.loadReferenceData(settings.getReferenceDataPath())).thenReturn(reference);
            when(currentDataService.resolveProduction()).thenReturn(Optional.empty());
            when(currentDataService.prepareReference(reference, Optional.empty())).thenReturn(reference);
            when(currentDataService.simulateCurrentData(reference, raw, Optional.empty()))
                    .thenThrow(new FileProcessingException("corrupt artifact"));
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(staged()));

            // When
            orchestrator.run(false);

            // Then
            verify(pipelineRunService).moveTo(RUN_ID, PipelineStateEnum.PREPROCESS);
            verify(modelTrainingService).train(eq(split.trainFeatures()), eq(split.trainLabels()), any());
        }

        @Test
        @DisplayName("Forced run never consults drift analysis")
        void forceBypassesAnalysis() {
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(staged()));

            orchestrator.run(true);

            verifyNoInteractions(driftCheckService, currentDataService);
            verify(dataService, never()).loadReferenceData(anyString());
        }
    }

    @Nested
    @DisplayName("Retraining")
    class RetrainTests {

        @Test
        @DisplayName("Promoted model triggers deployment and walks every state in order")
        void promotedNotifies() {
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(promoted()));
            when(deploymentTriggerService.notifyDeployment(4, 0.9)).thenReturn(DeploymentNotificationResult.sent());

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals(PipelineOutcomeEnum.RETRAINED_AND_PROMOTED, result.getOutcome());
            assertEquals(4, result.getRegisteredVersion());
            assertEquals(DeploymentNotificationStatusEnum.SENT, result.getNotificationStatus());

            InOrder order = inOrder(pipelineRunService);
            for (PipelineStateEnum state : List.of(PipelineStateEnum.INGEST, PipelineStateEnum.VALIDATE,
                    PipelineStateEnum.DECIDE, PipelineStateEnum.PREPROCESS, PipelineStateEnum.SPLIT,
                    PipelineStateEnum.TRAIN, PipelineStateEnum.EVALUATE, PipelineStateEnum.REGISTER,
                    PipelineStateEnum.NOTIFY)) {
                order.verify(pipelineRunService).moveTo(RUN_ID, state);
            }
            verify(pipelineRunService).recordTraining(RUN_ID, "train-1", 0.9);
        }

        @Test
        @DisplayName("Failed notification does not fail the run")
        void failedNotificationStillDone() {
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(promoted()));
            when(deploymentTriggerService.notifyDeployment(4, 0.9))
                    .thenReturn(DeploymentNotificationResult.failed("Endpoint unreachable"));

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals(PipelineStateEnum.DONE, result.getState());
            assertEquals(DeploymentNotificationStatusEnum.FAILED, result.getNotificationStatus());
        }

        @Test
        @DisplayName("Staged model is not deployed")
        void stagedSkipsNotify() {
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.of(staged()));

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals(PipelineOutcomeEnum.RETRAINED_AND_STAGED, result.getOutcome());
            verifyNoInteractions(deploymentTriggerService);
            verify(pipelineRunService, never()).moveTo(RUN_ID, PipelineStateEnum.NOTIFY);
        }

        @Test
        @DisplayName("Ineligible model fails the run without registering")
        void ineligibleFails() {
            when(modelPromotionService.register(evaluated, true)).thenReturn(Optional.empty());

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals(PipelineOutcomeEnum.FAILED, result.getOutcome());
            assertEquals("MODEL_INELIGIBLE", result.getErrorCode());
            verifyNoInteractions(deploymentTriggerService);
        }

        @Test
        void trainingFailureFailsRun() {
            when(modelTrainingService.train(anyList(), anyList(), any()))
                    .thenThrow(new TrainingFailedException("not enough classes"));

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals("TRAINING_FAILED", result.getErrorCode());
            verifyNoInteractions(modelPromotionService);
        }
    }

    @Nested
    @DisplayName("Gates and ingestion")
    class GateTests {

        @Test
        @DisplayName("Failed validation halts before the decision")
        void validationFailureHalts() {
            when(dataValidationEngine.validate(anyString(), anyString()))
                    .thenReturn(new ValidationReport("data_quality_suite", false, 5, List.of("sentiment not in set")));

            PipelineRunDTO result = orchestrator.run(false);

            assertEquals("DATA_VALIDATION_FAILED", result.getErrorCode());
            verify(pipelineRunService, never()).moveTo(RUN_ID, PipelineStateEnum.DECIDE);
            verifyNoInteractions(modelTrainingService);
        }

        @Test
        @DisplayName("Missing raw data is not retried")
        void missingSourceNotRetried() {
            when(dataService.loadRawData(anyString())).thenThrow(new DataSourceNotFoundException("no file"));

            PipelineRunDTO result = orchestrator.run(false);

            assertEquals("DATA_SOURCE_NOT_FOUND", result.getErrorCode());
            verify(dataService, times(1)).loadRawData(anyString());
        }

        @Test
        @DisplayName("Transient read errors are retried before failing")
        void transientErrorsRetried() {
            when(dataService.loadRawData(anyString())).thenThrow(new DataIngestionException("locked"));

            PipelineRunDTO result = orchestrator.run(false);

            assertEquals("DATA_INGESTION_ERROR", result.getErrorCode());
            verify(dataService, times(settings.getIngestMaxRetries() + 1)).loadRawData(anyString());
        }

        @Test
        @DisplayName("Unexpected errors are recorded as internal")
        void unexpectedError() {
            when(dataService.preprocess(any(), anyString())).thenThrow(new IllegalStateException("boom"));

            PipelineRunDTO result = orchestrator.run(true);

            assertEquals("INTERNAL_ERROR", result.getErrorCode());
        }
    }

    private static RegistrationResult promoted() {
        return new RegistrationResult(version(ModelStageEnum.PRODUCTION), PromotionVerdictEnum.PROMOTED, null);
    }

    private static RegistrationResult staged() {
        return new RegistrationResult(version(ModelStageEnum.STAGING), PromotionVerdictEnum.STAGED_NOT_BETTER, null);
    }

    private static ModelVersionDTO version(ModelStageEnum stage) {
        return ModelVersionDTO.builder().name(TestSettings.MODEL_NAME).version(4).stage(stage).build();
    }
}
