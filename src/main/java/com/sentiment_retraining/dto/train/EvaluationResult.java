package com.sentiment_retraining.dto.train;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResult {
    private String runId;
    private double accuracy;
    private double f1Weighted;
    private double precisionWeighted;
    private double recallWeighted;
    private int testSize;
    private List<String> classLabels;
    private List<List<Integer>> confusionMatrix;
    private String summary;

    public Map<String, Double> toMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(TrainingRun.ACCURACY, accuracy);
        metrics.put(TrainingRun.F1_WEIGHTED, f1Weighted);
        metrics.put(TrainingRun.PRECISION_WEIGHTED, precisionWeighted);
        metrics.put(TrainingRun.RECALL_WEIGHTED, recallWeighted);
        return metrics;
    }
}
