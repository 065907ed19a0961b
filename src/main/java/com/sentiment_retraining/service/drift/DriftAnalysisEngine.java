package com.sentiment_retraining.service.drift;

import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.drift.AnalysisResult;

public interface DriftAnalysisEngine {

    /**
     * Compares the current window with the reference. Both datasets must carry ground truth and predictions.
     *
     * @param textColumn the feature column inspected for data drift
     */
    AnalysisResult analyze(SentimentDataset reference, SentimentDataset current, String textColumn);
}
