package com.sentiment_retraining.service.drift;

import com.sentiment_retraining.dto.data.SentimentDataset;
import com.sentiment_retraining.dto.drift.AnalysisResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the drift analysis for the decision step. When the analysis cannot be produced at all the
 * cycle proceeds as if drift was found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriftCheckService {

    private final DriftAnalysisEngine driftAnalysisEngine;

    public AnalysisResult analyzeOrAssumeDrift(SentimentDataset reference, SentimentDataset current) {
        try {
            return driftAnalysisEngine.analyze(reference, current, SentimentDataset.TEXT_COLUMN);
        } catch (RuntimeException e) {
            log.error("❌ Drift analysis failed, assuming drift: {}", e.getMessage(), e);
            return AnalysisResult.assumedDrift();
        }
    }
}
