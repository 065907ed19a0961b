package com.sentiment_retraining.service.inference;

import com.sentiment_retraining.dto.inference.BatchPredictionResponse;
import com.sentiment_retraining.dto.inference.HealthResponse;
import com.sentiment_retraining.dto.inference.ModelInfoResponse;
import com.sentiment_retraining.dto.inference.PredictionResponse;
import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.exception.BadRequestException;
import com.sentiment_retraining.exception.ModelNotLoadedException;
import com.sentiment_retraining.service.registry.ProductionModelLoader.LoadedModel;
import com.sentiment_retraining.service.training.TrainedSentimentModel.LabelScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class InferenceService {

    private final ModelHandle modelHandle;
    private final int maxBatchSize;
    private final String serviceName;
    private final String serviceVersion;

    public InferenceService(ModelHandle modelHandle,
                            @Value("${inference.max-batch-size:100}") int maxBatchSize,
                            @Value("${inference.service-name:sentiment-inference}") String serviceName,
                            @Value("${inference.version:1.0.0}") String serviceVersion) {
        this.modelHandle = modelHandle;
        this.maxBatchSize = maxBatchSize;
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    /**
     * Warm-up at startup. The service still starts without a model and reports itself unhealthy.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            LoadedModel loaded = modelHandle.get();
            log.info("✅ Inference model v{} loaded at startup", loaded.version().getVersion());
        } catch (ModelNotLoadedException e) {
            log.warn("⚠️ Inference service started without a model: {}", e.getMessage());
        }
    }

    public HealthResponse health() {
        return HealthResponse.of(modelHandle.isLoaded(), serviceName, serviceVersion);
    }

    public ModelInfoResponse modelInfo() {
        return toInfo(modelHandle.peek().orElseThrow(ModelNotLoadedException::new));
    }

    public ModelInfoResponse reload() {
        return toInfo(modelHandle.reload());
    }

    public PredictionResponse predict(String text) {
        LoadedModel loaded = modelHandle.get();
        LabelScore score = loaded.model().predict(text);
        return new PredictionResponse(text, score.label(), score.confidence(), versionOf(loaded));
    }

    public BatchPredictionResponse predictBatch(List<String> texts) {
        if (texts.size() > maxBatchSize) {
            throw new BadRequestException("Batch size exceeds maximum of " + maxBatchSize);
        }
        LoadedModel loaded = modelHandle.get();
        List<LabelScore> scores = loaded.model().predictAll(texts);
        List<PredictionResponse> predictions = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            predictions.add(new PredictionResponse(texts.get(i), scores.get(i).label(), scores.get(i).confidence(), versionOf(loaded)));
        }
        log.info("Batch of {} predictions served by v{}", texts.size(), versionOf(loaded));
        return new BatchPredictionResponse(predictions);
    }

    private static ModelInfoResponse toInfo(LoadedModel loaded) {
        ModelVersionDTO version = loaded.version();
        return new ModelInfoResponse(version.getName(), String.valueOf(version.getVersion()), version.getRunId(),
                version.getArtifactUri(), String.valueOf(version.getStage()), loaded.loadedAt().toString());
    }

    private static String versionOf(LoadedModel loaded) {
        return String.valueOf(loaded.version().getVersion());
    }
}
