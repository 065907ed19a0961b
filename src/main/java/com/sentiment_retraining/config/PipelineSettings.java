package com.sentiment_retraining.config;

import com.sentiment_retraining.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Immutable view of the thresholds, paths and hyper-parameters that drive one retraining cycle.
 * Values are checked once at startup; an out-of-range value stops the application context.
 */
@Component
@Getter
public class PipelineSettings {

    private final String projectName;
    private final String experimentName;
    private final String modelName;

    private final String rawDataPath;
    private final String processedDataPath;
    private final String referenceDataPath;
    private final String reportsPath;

    private final double minTrainingAccuracy;
    private final double performanceDegradationThreshold;
    private final double dataDriftAucThreshold;

    private final double testSplitSize;
    private final int randomState;
    private final int maxFeatures;
    private final int ngramMax;
    private final double ridge;

    private final int ingestMaxRetries;
    private final long ingestRetryDelayMs;

    private final String validationSuiteName;
    private final List<String> allowedLabels;
    private final int minRows;
    private final int maxTextLength;

    @Builder
    public PipelineSettings(
            @Value("${pipeline.project-name:AutomatedModelRetrainingPipeline}") String projectName,
            @Value("${pipeline.tracking.experiment-name:SentimentModelRetraining}") String experimentName,
            @Value("${pipeline.registry.model-name:prod-sentiment-classifier}") String modelName,
            @Value("${pipeline.data.raw-path:data/raw/feedback.csv}") String rawDataPath,
            @Value("${pipeline.data.processed-path:data/processed/sentiment.csv}") String processedDataPath,
            @Value("${pipeline.data.reference-path:data/reference/sentiment_reference.csv}") String referenceDataPath,
            @Value("${pipeline.reports.path:reports/drift}") String reportsPath,
            @Value("${pipeline.thresholds.min-training-accuracy:0.75}") double minTrainingAccuracy,
            @Value("${pipeline.thresholds.performance-degradation:0.05}") double performanceDegradationThreshold,
            @Value("${pipeline.thresholds.data-drift-auc:0.55}") double dataDriftAucThreshold,
            @Value("${pipeline.model.test-split-size:0.2}") double testSplitSize,
            @Value("${pipeline.model.random-state:42}") int randomState,
            @Value("${pipeline.model.max-features:1000}") int maxFeatures,
            @Value("${pipeline.model.ngram-max:2}") int ngramMax,
            @Value("${pipeline.model.ridge:1.0}") double ridge,
            @Value("${pipeline.ingest.max-retries:2}") int ingestMaxRetries,
            @Value("${pipeline.ingest.retry-delay-ms:10000}") long ingestRetryDelayMs,
            @Value("${pipeline.validation.suite-name:data_quality_suite}") String validationSuiteName,
            @Value("${pipeline.validation.allowed-labels:positive,negative,neutral}") List<String> allowedLabels,
            @Value("${pipeline.validation.min-rows:10}") int minRows,
            @Value("${pipeline.validation.max-text-length:5000}") int maxTextLength) {

        requireText("pipeline.registry.model-name", modelName);
        requireText("pipeline.data.raw-path", rawDataPath);
        requireText("pipeline.data.processed-path", processedDataPath);
        requireText("pipeline.data.reference-path", referenceDataPath);
        requireText("pipeline.validation.suite-name", validationSuiteName);
        requireFraction("pipeline.thresholds.min-training-accuracy", minTrainingAccuracy, true);
        requireFraction("pipeline.thresholds.performance-degradation", performanceDegradationThreshold, true);
        requireFraction("pipeline.thresholds.data-drift-auc", dataDriftAucThreshold, true);
        requireFraction("pipeline.model.test-split-size", testSplitSize, false);
        if (maxFeatures < 1 || ngramMax < 1) {
            throw new ConfigurationException("pipeline.model.max-features and pipeline.model.ngram-max must be positive");
        }
        if (ridge < 0) {
            throw new ConfigurationException("pipeline.model.ridge must not be negative");
        }
        if (ingestMaxRetries < 0 || ingestRetryDelayMs < 0) {
            throw new ConfigurationException("pipeline.ingest retry settings must not be negative");
        }
        if (allowedLabels == null || allowedLabels.isEmpty()) {
            throw new ConfigurationException("pipeline.validation.allowed-labels must list at least one label");
        }

        this.projectName = projectName;
        this.experimentName = StringUtils.defaultIfBlank(experimentName, "SentimentModelRetraining");
        this.modelName = modelName;
        this.rawDataPath = rawDataPath;
        this.processedDataPath = processedDataPath;
        this.referenceDataPath = referenceDataPath;
        this.reportsPath = StringUtils.defaultIfBlank(reportsPath, "reports/drift");
        this.minTrainingAccuracy = minTrainingAccuracy;
        this.performanceDegradationThreshold = performanceDegradationThreshold;
        this.dataDriftAucThreshold = dataDriftAucThreshold;
        this.testSplitSize = testSplitSize;
        this.randomState = randomState;
        this.maxFeatures = maxFeatures;
        this.ngramMax = ngramMax;
        this.ridge = ridge;
        this.ingestMaxRetries = ingestMaxRetries;
        this.ingestRetryDelayMs = ingestRetryDelayMs;
        this.validationSuiteName = validationSuiteName;
        this.allowedLabels = allowedLabels.stream().map(String::trim).toList();
        this.minRows = Math.max(minRows, 0);
        this.maxTextLength = maxTextLength;
    }

    private static void requireText(String key, String value) {
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException(key + " must be set");
        }
    }

    private static void requireFraction(String key, double value, boolean inclusive) {
        boolean valid = inclusive ? value >= 0.0 && value <= 1.0 : value > 0.0 && value < 1.0;
        if (Double.isNaN(value) || !valid) {
            throw new ConfigurationException(key + " is out of range: " + value);
        }
    }
}
