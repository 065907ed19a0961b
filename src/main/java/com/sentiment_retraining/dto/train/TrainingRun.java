package com.sentiment_retraining.dto.train;

import java.util.Map;

/**
 * A tracked training attempt. Metrics and eligibility are empty until evaluation has completed,
 * after which the run is never mutated again.
 */
public record TrainingRun(String runId, Map<String, Double> metrics, ArtifactHandle artifactHandle, boolean eligible) {

    public static final String ACCURACY = "accuracy";
    public static final String F1_WEIGHTED = "f1_weighted";
    public static final String PRECISION_WEIGHTED = "precision_weighted";
    public static final String RECALL_WEIGHTED = "recall_weighted";

    public TrainingRun {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static TrainingRun trained(String runId, ArtifactHandle artifactHandle) {
        return new TrainingRun(runId, Map.of(), artifactHandle, false);
    }

    public TrainingRun evaluated(Map<String, Double> evaluationMetrics, boolean isEligible) {
        return new TrainingRun(runId, evaluationMetrics, artifactHandle, isEligible);
    }

    public boolean isEvaluated() {
        return metrics.containsKey(ACCURACY);
    }

    public double accuracy() {
        return metrics.getOrDefault(ACCURACY, 0.0);
    }
}
