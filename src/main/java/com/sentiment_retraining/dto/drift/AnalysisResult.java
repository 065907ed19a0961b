package com.sentiment_retraining.dto.drift;

/**
 * Outcome of comparing the current data window with the reference data.
 *
 * @param failSafe true when no analysis could be produced and drift is assumed
 */
public record AnalysisResult(boolean driftDetected,
                             boolean performanceDegraded,
                             double currentAccuracy,
                             double referenceAccuracy,
                             String reportLocation,
                             boolean failSafe) {

    public static final double DEFAULT_CURRENT_ACCURACY = 0.0;
    public static final double DEFAULT_REFERENCE_ACCURACY = 1.0;

    public static AnalysisResult of(boolean driftDetected, boolean performanceDegraded,
                                    double currentAccuracy, double referenceAccuracy, String reportLocation) {
        return new AnalysisResult(driftDetected, performanceDegraded, currentAccuracy, referenceAccuracy, reportLocation, false);
    }

    public static AnalysisResult assumedDrift() {
        return new AnalysisResult(true, false, DEFAULT_CURRENT_ACCURACY, DEFAULT_REFERENCE_ACCURACY, null, true);
    }
}
