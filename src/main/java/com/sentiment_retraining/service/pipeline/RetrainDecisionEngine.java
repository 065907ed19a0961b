package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.dto.drift.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retrain when forced, when the input distribution drifted or when accuracy degraded.
 */
@Component
@Slf4j
public class RetrainDecisionEngine {

    public boolean decideRetrain(AnalysisResult analysis, boolean forceRetrain) {
        if (forceRetrain) {
            log.info("Force retrain requested; skipping drift check.");
            return true;
        }
        if (analysis == null) {
            log.warn("⚠️ No analysis available; retraining to be safe.");
            return true;
        }
        boolean retrain = analysis.driftDetected() || analysis.performanceDegraded();
        if (retrain) {
            log.warn("⚠️ Drift or degradation detected (drift={}, degraded={}). Triggering retraining.",
                    analysis.driftDetected(), analysis.performanceDegraded());
        } else {
            log.info("No significant drift or degradation detected. Skipping retraining.");
        }
        return retrain;
    }
}
