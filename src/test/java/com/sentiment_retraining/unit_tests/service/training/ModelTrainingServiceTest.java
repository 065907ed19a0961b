package com.sentiment_retraining.unit_tests.service.training;

import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.train.TrainingConfig;
import com.sentiment_retraining.dto.train.TrainingRun;
import com.sentiment_retraining.enumeration.RunStatusEnum;
import com.sentiment_retraining.exception.TrainingFailedException;
import com.sentiment_retraining.service.training.ModelTrainingService;
import com.sentiment_retraining.service.training.TrackingService;
import com.sentiment_retraining.util.SampleData;
import com.sentiment_retraining.util.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelTrainingServiceTest {

    private static final String RUN_ID = "run-1";

    @Mock
    private TrackingService trackingService;

    private ModelTrainingService trainingService;

    private final SentimentDataset feedback = SampleData.feedback("train", 3);
    private final TrainingConfig config = TrainingConfig.from(TestSettings.defaults());

    @BeforeEach
    void setUp() {
        trainingService = new ModelTrainingService(trackingService, TestSettings.defaults());
        when(trackingService.startRun(anyString())).thenReturn(RUN_ID);
        when(trackingService.logModelArtifact(eq(RUN_ID), any())).thenReturn("test-models/run-1/model/model.weka");
    }

    @Test
    @DisplayName("Training logs parameters and stores the artifact under the run")
    void trainProducesArtifact() {
        TrainingRun run = trainingService.train(feedback.texts(), feedback.labels(), config);

        assertEquals(RUN_ID, run.runId());
        assertEquals("test-models/run-1/model/model.weka", run.artifactHandle().artifactUri());
        assertFalse(run.isEvaluated());
        assertEquals(List.of("negative", "positive"), run.artifactHandle().model().getClassLabels());
        verify(trackingService).startRun("SentimentModelRetraining");
        verify(trackingService).logParams(eq(RUN_ID), argThat(params -> "Logistic".equals(params.get("classifier"))));
        verify(trackingService, never()).endRun(anyString(), any());
    }

    @Test
    @DisplayName("Evaluation on familiar text marks the run eligible and closes it")
    void evaluationEligible() {
        TrainingRun run = trainingService.train(feedback.texts(), feedback.labels(), config);

        TrainingRun evaluated = trainingService.completeEvaluation(run, SampleData.POSITIVE.subList(0, 5), List.of(
                "positive", "positive", "positive", "positive", "positive"));

        assertTrue(evaluated.isEvaluated());
        assertTrue(evaluated.eligible());
        assertTrue(evaluated.accuracy() >= 0.75);
        assertTrue(evaluated.metrics().containsKey(TrainingRun.F1_WEIGHTED));
        verify(trackingService).logMetrics(eq(RUN_ID), anyMap());
        verify(trackingService).setTag(RUN_ID, TrackingService.TAG_EVALUATION_STATUS, "success");
        verify(trackingService).endRun(RUN_ID, RunStatusEnum.FINISHED);
        verify(trackingService, never()).setTag(RUN_ID, TrackingService.TAG_ELIGIBILITY, TrackingService.INELIGIBLE_LOW_ACCURACY);
    }

    @Test
    @DisplayName("Low accuracy is tagged and the run is ineligible")
    void evaluationIneligible() {
        TrainingRun run = trainingService.train(feedback.texts(), feedback.labels(), config);

        TrainingRun evaluated = trainingService.completeEvaluation(run, SampleData.POSITIVE.subList(0, 4), List.of(
                "negative", "negative", "negative", "negative"));

        assertFalse(evaluated.eligible());
        assertTrue(evaluated.accuracy() < 0.75);
        verify(trackingService).setTag(RUN_ID, TrackingService.TAG_ELIGIBILITY, TrackingService.INELIGIBLE_LOW_ACCURACY);
        verify(trackingService).endRun(RUN_ID, RunStatusEnum.FINISHED);
    }

    @Test
    void evaluateReturnsMetricsWithoutTracking() {
        TrainingRun run = trainingService.train(feedback.texts(), feedback.labels(), config);
        clearInvocations(trackingService);

        Map<String, Double> metrics = trainingService.evaluate(run.artifactHandle(), feedback.texts(), feedback.labels());

        assertTrue(metrics.get(TrainingRun.ACCURACY) > 0.9);
        verifyNoInteractions(trackingService);
    }

    @Test
    @DisplayName("Single-label data fails the run")
    void singleLabelFails() {
        assertThrows(TrainingFailedException.class, () -> trainingService.train(
                SampleData.POSITIVE, SampleData.POSITIVE.stream().map(t -> "positive").toList(), config));

        verify(trackingService).endRun(RUN_ID, RunStatusEnum.FAILED);
        verify(trackingService, never()).logModelArtifact(anyString(), any());
    }

    @Test
    void emptyTestSetFailsEvaluation() {
        TrainingRun run = trainingService.train(feedback.texts(), feedback.labels(), config);

        assertThrows(TrainingFailedException.class, () -> trainingService.completeEvaluation(run, List.of(), List.of()));
        verify(trackingService).setTag(RUN_ID, TrackingService.TAG_EVALUATION_STATUS, "failed");
        verify(trackingService).endRun(RUN_ID, RunStatusEnum.FAILED);
    }
}
