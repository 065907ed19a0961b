package com.sentiment_retraining.service.drift;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.drift.AnalysisResult;
import com.sentiment_retraining.exception.DriftAnalysisException;
import com.sentiment_retraining.util.DatasetUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import weka.classifiers.Evaluation;
import weka.classifiers.bayes.NaiveBayesMultinomial;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Instances;
import weka.filters.unsupervised.attribute.StringToWordVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Detects text drift with a domain classifier: a bag-of-words model is cross-validated on the task of
 * telling reference rows from current rows. A ROC AUC above the threshold means the two windows are
 * distinguishable, i.e. the input distribution moved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WekaDriftAnalysisEngine implements DriftAnalysisEngine {

    static final String REFERENCE = "reference";
    static final String CURRENT = "current";
    private static final int MAX_FOLDS = 5;

    private final PipelineSettings settings;
    private final DriftReportWriter reportWriter;

    @Override
    public AnalysisResult analyze(SentimentDataset reference, SentimentDataset current, String textColumn) {
        log.info("🔬 Starting drift analysis. Reference rows: {}, current rows: {}", reference.size(), current.size());
        if (!reference.hasPredictions() || !current.hasPredictions()) {
            throw new IllegalArgumentException("Reference and current data must both carry predictions");
        }

        double auc = domainClassifierAuc(reference.values(textColumn), current.values(textColumn));
        boolean driftDetected;
        if (Double.isNaN(auc)) {
            log.warn("⚠️ Could not extract data drift status; assuming drift");
            driftDetected = true;
        } else {
            driftDetected = auc > settings.getDataDriftAucThreshold();
        }
        log.info("Data drift detected: {} (domain AUC {})", driftDetected, auc);

        double referenceAccuracy = reference.predictionAccuracy();
        double currentAccuracy = current.predictionAccuracy();
        if (Double.isNaN(referenceAccuracy) || Double.isNaN(currentAccuracy)) {
            log.warn("⚠️ Could not extract performance metrics; using defaults");
            currentAccuracy = AnalysisResult.DEFAULT_CURRENT_ACCURACY;
            referenceAccuracy = AnalysisResult.DEFAULT_REFERENCE_ACCURACY;
        }
        double accuracyDrop = referenceAccuracy - currentAccuracy;
        boolean performanceDegraded = accuracyDrop > settings.getPerformanceDegradationThreshold();
        if (performanceDegraded) {
            log.warn("⚠️ Model performance degraded! Drop: {} (threshold: {})", accuracyDrop, settings.getPerformanceDegradationThreshold());
        } else {
            log.info("Model performance is stable. Drop: {}", accuracyDrop);
        }

        String reportLocation = reportWriter.write(new DriftReport(textColumn, reference.size(), current.size(),
                auc, settings.getDataDriftAucThreshold(), driftDetected,
                referenceAccuracy, currentAccuracy, settings.getPerformanceDegradationThreshold(), performanceDegraded));

        return AnalysisResult.of(driftDetected, performanceDegraded, currentAccuracy, referenceAccuracy, reportLocation);
    }

    /**
     * Cross-validated ROC AUC of separating current from reference texts, or NaN when either side is too small.
     */
    double domainClassifierAuc(List<String> referenceTexts, List<String> currentTexts) {
        int folds = Math.min(MAX_FOLDS, Math.min(referenceTexts.size(), currentTexts.size()));
        if (folds < 2) {
            return Double.NaN;
        }

        List<String> texts = new ArrayList<>(referenceTexts);
        texts.addAll(currentTexts);
        List<String> domains = new ArrayList<>(Collections.nCopies(referenceTexts.size(), REFERENCE));
        domains.addAll(Collections.nCopies(currentTexts.size(), CURRENT));

        Instances data = DatasetUtil.toInstances("drift-domain", "text", "domain",
                List.of(REFERENCE, CURRENT), texts, domains);

        StringToWordVector vectorizer = new StringToWordVector();
        vectorizer.setAttributeIndices("first");
        vectorizer.setLowerCaseTokens(true);
        vectorizer.setOutputWordCounts(true);
        vectorizer.setWordsToKeep(settings.getMaxFeatures());
        vectorizer.setDoNotOperateOnPerClassBasis(true);

        FilteredClassifier classifier = new FilteredClassifier();
        classifier.setFilter(vectorizer);
        classifier.setClassifier(new NaiveBayesMultinomial());

        try {
            Evaluation evaluation = new Evaluation(data);
            evaluation.crossValidateModel(classifier, data, folds, new Random(settings.getRandomState()));
            return evaluation.areaUnderROC(data.classAttribute().indexOfValue(CURRENT));
        } catch (Exception e) {
            throw new DriftAnalysisException("Domain classifier evaluation failed", e);
        }
    }
}
