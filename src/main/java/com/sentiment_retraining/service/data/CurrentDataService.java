package com.sentiment_retraining.service.data;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.service.registry.ProductionModelLoader;
import com.sentiment_retraining.service.registry.ProductionModelLoader.LoadedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds the datasets compared during drift analysis. The current window is the newest raw
 * feedback scored by the Production model; the reference carries predictions of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrentDataService {

    private final ProductionModelLoader productionModelLoader;
    private final PipelineSettings settings;

    /**
     * The Production model both drift windows are scored with, resolved once per decision.
     */
    public Optional<LoadedModel> resolveProduction() {
        return productionModelLoader.loadProduction(settings.getModelName());
    }

    /**
     * Scores the reference data with the Production model, or copies the ground truth into the
     * prediction column when no Production model exists yet. Already scored data is returned as is.
     */
    public SentimentDataset prepareReference(SentimentDataset reference, Optional<LoadedModel> production) {
        if (reference.hasPredictions()) {
            return reference;
        }
        if (production.isEmpty()) {
            log.info("No Production model; using reference ground truth as its predictions");
            return reference.withGroundTruthAsPrediction();
        }
        return reference.withPredictions(reference.getName(), production.get().model().predictLabels(reference.texts()));
    }

    /**
     * On the very first run there is no Production model, so the reference itself stands in for
     * the current window and no drift can be observed.
     */
    public SentimentDataset simulateCurrentData(SentimentDataset scoredReference, SentimentDataset newRaw,
                                                Optional<LoadedModel> production) {
        log.info("🛰️ Simulating current data window from {} new rows", newRaw.size());
        if (production.isEmpty()) {
            log.warn("⚠️ No Production model found; comparing the reference data with itself");
            return new SentimentDataset("current", scoredReference.getRecords());
        }
        LoadedModel loaded = production.get();
        log.info("Scoring new data with Production model v{}", loaded.version().getVersion());
        SentimentDataset labeled = new SentimentDataset("current", newRaw.getRecords().stream()
                .filter(r -> r.text() != null && r.sentiment() != null)
                .toList());
        return labeled.withPredictions("current", loaded.model().predictLabels(labeled.texts()));
    }
}
