package com.sentiment_retraining.exception;

public class DriftAnalysisException extends PipelineException {

    public DriftAnalysisException(String message) {
        super("DRIFT_ANALYSIS_ERROR", message, null);
    }

    public DriftAnalysisException(String message, Throwable cause) {
        super("DRIFT_ANALYSIS_ERROR", message, cause);
    }
}
