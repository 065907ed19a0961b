package com.sentiment_retraining.service.training;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.train.ArtifactHandle;
import com.sentiment_retraining.dto.train.EvaluationResult;
import com.sentiment_retraining.dto.train.TrainingConfig;
import com.sentiment_retraining.dto.train.TrainingRun;
import com.sentiment_retraining.enumeration.RunStatusEnum;
import com.sentiment_retraining.exception.TrainingFailedException;
import com.sentiment_retraining.util.DatasetUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import weka.classifiers.Classifier;
import weka.classifiers.Evaluation;
import weka.classifiers.functions.Logistic;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Instances;
import weka.core.tokenizers.NGramTokenizer;
import weka.filters.unsupervised.attribute.StringToWordVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Training and evaluation adapter around Weka. Fits a TF-IDF + logistic regression text classifier,
 * scores it on held-out data and records everything in the tracking store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingService {

    private final TrackingService trackingService;
    private final PipelineSettings settings;

    public TrainingRun train(List<String> features, List<String> labels, TrainingConfig config) {
        String runId = trackingService.startRun(settings.getExperimentName());
        log.info("🧠 Starting training in run {} on {} examples", runId, features.size());
        try {
            Map<String, String> params = config.asParams();
            params.put("test_split_size", String.valueOf(settings.getTestSplitSize()));
            trackingService.logParams(runId, params);
            trackingService.setTag(runId, "model_type", "Logistic");
            trackingService.setTag(runId, "features", "StringToWordVector");

            List<String> classLabels = new ArrayList<>(new TreeSet<>(labels));
            if (classLabels.size() < 2) {
                throw new IllegalArgumentException("Training data must contain at least two sentiment labels, found " + classLabels);
            }
            Instances trainData = DatasetUtil.toInstances("sentiment-train", SentimentDataset.TEXT_COLUMN,
                    SentimentDataset.LABEL_COLUMN, classLabels, features, labels);

            Classifier classifier = buildClassifier(config);
            classifier.buildClassifier(trainData);
            log.info("✅ Model fitted in run {}", runId);

            TrainedSentimentModel model = new TrainedSentimentModel(classifier, classLabels);
            String artifactUri = trackingService.logModelArtifact(runId, model);
            return TrainingRun.trained(runId, new ArtifactHandle(artifactUri, model));
        } catch (Exception e) {
            log.error("❌ Training failed in run {}: {}", runId, e.getMessage(), e);
            endRunQuietly(runId, RunStatusEnum.FAILED);
            throw new TrainingFailedException("Training failed in run " + runId, e);
        }
    }

    /**
     * Pure scoring of an artifact on held-out data. Labels the model has never seen count as misclassified.
     */
    public Map<String, Double> evaluate(ArtifactHandle artifactHandle, List<String> testFeatures, List<String> testLabels) {
        return score(artifactHandle, testFeatures, testLabels).toMetrics();
    }

    /**
     * Scores the run on held-out data, records metrics and tags, decides eligibility and closes the run.
     */
    public TrainingRun completeEvaluation(TrainingRun run, List<String> testFeatures, List<String> testLabels) {
        String runId = run.runId();
        log.info("📊 Evaluating model from run {}", runId);
        try {
            EvaluationResult result = score(run.artifactHandle(), testFeatures, testLabels);
            result.setRunId(runId);
            Map<String, Double> metrics = result.toMetrics();
            log.info("📊 Test set metrics for run {}: {}", runId, metrics);

            trackingService.logMetrics(runId, metrics);
            trackingService.setTag(runId, TrackingService.TAG_EVALUATION_STATUS, "success");
            trackingService.logJsonArtifact(runId, "evaluation.json", result);

            boolean eligible = result.getAccuracy() >= settings.getMinTrainingAccuracy();
            if (eligible) {
                log.info("Model accuracy ({}) meets threshold ({}). Model is eligible.",
                        String.format("%.4f", result.getAccuracy()), settings.getMinTrainingAccuracy());
            } else {
                log.warn("⚠️ Model accuracy ({}) is below threshold ({}). Model is NOT eligible.",
                        String.format("%.4f", result.getAccuracy()), settings.getMinTrainingAccuracy());
                trackingService.setTag(runId, TrackingService.TAG_ELIGIBILITY, TrackingService.INELIGIBLE_LOW_ACCURACY);
            }
            trackingService.endRun(runId, RunStatusEnum.FINISHED);
            return run.evaluated(metrics, eligible);
        } catch (Exception e) {
            log.error("❌ Evaluation failed for run {}: {}", runId, e.getMessage(), e);
            try {
                trackingService.setTag(runId, TrackingService.TAG_EVALUATION_STATUS, "failed");
            } catch (RuntimeException tagError) {
                log.error("Failed to tag run {}: {}", runId, tagError.getMessage());
                e.addSuppressed(tagError);
            }
            endRunQuietly(runId, RunStatusEnum.FAILED);
            throw new TrainingFailedException("Evaluation failed for run " + runId, e);
        }
    }

    Classifier buildClassifier(TrainingConfig config) {
        NGramTokenizer tokenizer = new NGramTokenizer();
        tokenizer.setNGramMinSize(1);
        tokenizer.setNGramMaxSize(config.ngramMax());

        StringToWordVector vectorizer = new StringToWordVector();
        vectorizer.setAttributeIndices("first");
        vectorizer.setTokenizer(tokenizer);
        vectorizer.setWordsToKeep(config.maxFeatures());
        vectorizer.setDoNotOperateOnPerClassBasis(true);
        vectorizer.setLowerCaseTokens(true);
        vectorizer.setOutputWordCounts(true);
        vectorizer.setTFTransform(true);
        vectorizer.setIDFTransform(true);

        Logistic logistic = new Logistic();
        logistic.setRidge(config.ridge());

        FilteredClassifier classifier = new FilteredClassifier();
        classifier.setFilter(vectorizer);
        classifier.setClassifier(logistic);
        return classifier;
    }

    private EvaluationResult score(ArtifactHandle artifactHandle, List<String> testFeatures, List<String> testLabels) {
        if (testFeatures.isEmpty()) {
            throw new IllegalArgumentException("Test set is empty");
        }
        TrainedSentimentModel model = artifactHandle.model();
        List<String> predictions = model.predictLabels(testFeatures);

        List<String> classLabels = new ArrayList<>(new TreeSet<>(model.getClassLabels()));
        testLabels.stream().filter(label -> !classLabels.contains(label)).distinct().forEach(classLabels::add);

        try {
            Instances truth = DatasetUtil.toInstances("sentiment-test", SentimentDataset.TEXT_COLUMN,
                    SentimentDataset.LABEL_COLUMN, classLabels, testFeatures, testLabels);
            Evaluation evaluation = new Evaluation(truth);
            for (int i = 0; i < truth.numInstances(); i++) {
                evaluation.evaluateModelOnce((double) classLabels.indexOf(predictions.get(i)), truth.instance(i));
            }

            double[][] matrix = evaluation.confusionMatrix();
            List<List<Integer>> confusion = new ArrayList<>();
            for (double[] row : matrix) {
                List<Integer> counts = new ArrayList<>();
                for (double cell : row) {
                    counts.add((int) cell);
                }
                confusion.add(counts);
            }

            return EvaluationResult.builder()
                    .accuracy(finite(evaluation.pctCorrect() / 100.0))
                    .f1Weighted(finite(evaluation.weightedFMeasure()))
                    .precisionWeighted(finite(evaluation.weightedPrecision()))
                    .recallWeighted(finite(evaluation.weightedRecall()))
                    .testSize(truth.numInstances())
                    .classLabels(classLabels)
                    .confusionMatrix(confusion)
                    .summary(evaluation.toSummaryString())
                    .build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to score model: " + e.getMessage(), e);
        }
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    private void endRunQuietly(String runId, RunStatusEnum status) {
        try {
            trackingService.endRun(runId, status);
        } catch (RuntimeException endError) {
            log.error("Failed to close run {}: {}", runId, endError.getMessage());
        }
    }
}
