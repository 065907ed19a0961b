package com.sentiment_retraining.service.training;

import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.util.DatasetUtil;
import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fitted text classifier together with the dataset structure it was trained on.
 * This is the unit that is serialized to the artifact store and served for inference.
 */
public class TrainedSentimentModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Classifier classifier;
    private final List<String> classLabels;

    public TrainedSentimentModel(Classifier classifier, List<String> classLabels) {
        this.classifier = classifier;
        this.classLabels = new ArrayList<>(classLabels);
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public List<String> getClassLabels() {
        return Collections.unmodifiableList(classLabels);
    }

    public LabelScore predict(String text) {
        return predictAll(List.of(text)).get(0);
    }

    public List<LabelScore> predictAll(List<String> texts) {
        Instances batch = unlabeled(texts);
        List<LabelScore> scores = new ArrayList<>(texts.size());
        try {
            for (int i = 0; i < batch.numInstances(); i++) {
                Instance instance = batch.instance(i);
                double[] distribution = classifier.distributionForInstance(instance);
                int best = 0;
                for (int k = 1; k < distribution.length; k++) {
                    if (distribution[k] > distribution[best]) {
                        best = k;
                    }
                }
                scores.add(new LabelScore(classLabels.get(best), distribution[best]));
            }
        } catch (Exception e) {
            throw new IllegalStateException("Prediction failed: " + e.getMessage(), e);
        }
        return scores;
    }

    public List<String> predictLabels(List<String> texts) {
        return predictAll(texts).stream().map(LabelScore::label).toList();
    }

    Instances unlabeled(List<String> texts) {
        return DatasetUtil.toInstances("sentiment", SentimentDataset.TEXT_COLUMN, SentimentDataset.LABEL_COLUMN,
                classLabels, texts, null);
    }

    public record LabelScore(String label, double confidence) {
    }
}
