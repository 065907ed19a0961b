package com.sentiment_retraining.unit_tests.service.training;

import com.sentiment_retraining.entity.TrackingRun;
import com.sentiment_retraining.enumeration.BucketTypeEnum;
import com.sentiment_retraining.enumeration.RunStatusEnum;
import com.sentiment_retraining.repository.TrackingRunRepository;
import com.sentiment_retraining.service.MinioService;
import com.sentiment_retraining.service.training.TrackingService;
import com.sentiment_retraining.service.training.TrainedSentimentModel;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import weka.classifiers.rules.ZeroR;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TrackingServiceTest {

    @Mock
    private TrackingRunRepository trackingRunRepository;
    @Mock
    private MinioService minioService;

    private TrackingService trackingService;

    private TrackingRun run;

    @BeforeEach
    void setUp() {
        trackingService = new TrackingService(trackingRunRepository, minioService);
        run = TrackingRun.builder()
                .runId("run-1")
                .experimentName("SentimentModelRetraining")
                .status(RunStatusEnum.RUNNING)
                .startedAt(ZonedDateTime.now())
                .build();
        when(trackingRunRepository.findById("run-1")).thenReturn(Optional.of(run));
        when(trackingRunRepository.save(any(TrackingRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void startRunCreatesRunningRun() {
        String runId = trackingService.startRun("SentimentModelRetraining");

        ArgumentCaptor<TrackingRun> saved = ArgumentCaptor.forClass(TrackingRun.class);
        verify(trackingRunRepository).save(saved.capture());
        assertEquals(runId, saved.getValue().getRunId());
        assertEquals(RunStatusEnum.RUNNING, saved.getValue().getStatus());
    }

    @Test
    void recordsParamsTagsMetricsAndEnd() {
        trackingService.logParams("run-1", Map.of("classifier", "Logistic"));
        trackingService.setTag("run-1", TrackingService.TAG_EVALUATION_STATUS, "success");
        trackingService.logMetrics("run-1", Map.of("accuracy", 0.88));
        trackingService.endRun("run-1", RunStatusEnum.FINISHED);

        assertEquals("Logistic", run.getParams().get("classifier"));
        assertEquals("success", run.getTags().get(TrackingService.TAG_EVALUATION_STATUS));
        assertEquals(0.88, trackingService.getRunMetrics("run-1").get("accuracy"));
        assertEquals(RunStatusEnum.FINISHED, run.getStatus());
        assertNotNull(run.getFinishedAt());
    }

    @Test
    void unknownRunIsNotFound() {
        when(trackingRunRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class, () -> trackingService.setTag("missing", "k", "v"));
    }

    @Test
    @DisplayName("Model artifact uploaded by a run can be loaded back")
    void modelArtifactRoundTrip() {
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        when(minioService.uploadBytes(eq(BucketTypeEnum.MODEL), eq("run-1/model/model.weka"), bytes.capture(), anyString()))
                .thenReturn("models/run-1/model/model.weka");

        String uri = trackingService.logModelArtifact("run-1", new TrainedSentimentModel(new ZeroR(), List.of("negative", "positive")));
        when(minioService.downloadBytes(uri)).thenReturn(bytes.getValue());
        TrainedSentimentModel loaded = trackingService.loadModelArtifact(uri);

        assertEquals("models/run-1/model/model.weka", run.getArtifactUri());
        assertEquals(List.of("negative", "positive"), loaded.getClassLabels());
        assertInstanceOf(ZeroR.class, loaded.getClassifier());
    }
}
