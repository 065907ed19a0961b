package com.sentiment_retraining.service.drift;

/**
 * Figures collected during one analysis, rendered into the HTML report.
 */
record DriftReport(String textColumn,
                   int referenceRows,
                   int currentRows,
                   double domainAuc,
                   double aucThreshold,
                   boolean driftDetected,
                   double referenceAccuracy,
                   double currentAccuracy,
                   double degradationThreshold,
                   boolean performanceDegraded) {
}
