package com.sentiment_retraining.service.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sentiment_retraining.entity.TrackingRun;
import com.sentiment_retraining.enumeration.BucketTypeEnum;
import com.sentiment_retraining.enumeration.RunStatusEnum;
import com.sentiment_retraining.exception.FileProcessingException;
import com.sentiment_retraining.repository.TrackingRunRepository;
import com.sentiment_retraining.service.MinioService;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import weka.core.SerializationHelper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Experiment tracking: every training attempt gets a run id before any work starts, and
 * parameters, tags, metrics and artifacts are recorded against it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    public static final String TAG_EVALUATION_STATUS = "evaluation_status";
    public static final String TAG_ELIGIBILITY = "eligibility";
    public static final String INELIGIBLE_LOW_ACCURACY = "ineligible_low_accuracy";

    private final TrackingRunRepository trackingRunRepository;
    private final MinioService minioService;

    @Transactional
    public String startRun(String experimentName) {
        String runId = UUID.randomUUID().toString();
        trackingRunRepository.save(TrackingRun.builder()
                .runId(runId)
                .experimentName(experimentName)
                .status(RunStatusEnum.RUNNING)
                .startedAt(ZonedDateTime.now())
                .build());
        log.info("🧪 Tracking run {} started in experiment '{}'", runId, experimentName);
        return runId;
    }

    @Transactional
    public void logParams(String runId, Map<String, String> params) {
        TrackingRun run = getRunOrThrow(runId);
        run.getParams().putAll(params);
        trackingRunRepository.save(run);
    }

    @Transactional
    public void setTag(String runId, String key, String value) {
        TrackingRun run = getRunOrThrow(runId);
        run.getTags().put(key, value);
        trackingRunRepository.save(run);
    }

    @Transactional
    public void logMetrics(String runId, Map<String, Double> metrics) {
        TrackingRun run = getRunOrThrow(runId);
        run.getMetrics().putAll(metrics);
        trackingRunRepository.save(run);
    }

    @Transactional
    public void endRun(String runId, RunStatusEnum status) {
        TrackingRun run = getRunOrThrow(runId);
        run.setStatus(status);
        run.setFinishedAt(ZonedDateTime.now());
        trackingRunRepository.save(run);
        log.info("🧪 Tracking run {} ended with status {}", runId, status);
    }

    @Transactional(readOnly = true)
    public Map<String, Double> getRunMetrics(String runId) {
        return new HashMap<>(getRunOrThrow(runId).getMetrics());
    }

    /**
     * Serializes the model and uploads it under {@code <runId>/model/model.weka}.
     */
    @Transactional
    public String logModelArtifact(String runId, TrainedSentimentModel model) {
        byte[] bytes;
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            SerializationHelper.write(out, model);
            bytes = out.toByteArray();
        } catch (Exception e) {
            throw new FileProcessingException("Failed to serialize model for run " + runId, e);
        }
        String artifactUri = minioService.uploadBytes(BucketTypeEnum.MODEL, runId + "/model/model.weka", bytes, "application/octet-stream");

        TrackingRun run = getRunOrThrow(runId);
        run.setArtifactUri(artifactUri);
        trackingRunRepository.save(run);
        return artifactUri;
    }

    public String logJsonArtifact(String runId, String fileName, Object document) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            byte[] json = mapper.writeValueAsBytes(document);
            return minioService.uploadBytes(BucketTypeEnum.METRICS, runId + "/" + fileName, json, "application/json");
        } catch (JsonProcessingException e) {
            throw new FileProcessingException("Failed to write " + fileName + " for run " + runId, e);
        }
    }

    public TrainedSentimentModel loadModelArtifact(String artifactUri) {
        byte[] bytes = minioService.downloadBytes(artifactUri);
        try (ByteArrayInputStream in = new ByteArrayInputStream(bytes)) {
            return (TrainedSentimentModel) SerializationHelper.read(in);
        } catch (Exception e) {
            throw new FileProcessingException("Failed to deserialize model artifact " + artifactUri, e);
        }
    }

    private TrackingRun getRunOrThrow(String runId) {
        return trackingRunRepository.findById(runId)
                .orElseThrow(() -> new EntityNotFoundException("Tracking run " + runId + " not found"));
    }
}
