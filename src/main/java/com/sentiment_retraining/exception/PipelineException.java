package com.sentiment_retraining.exception;

/**
 * Root of every failure raised by the retraining cycle. Carries a stable error code
 * that is safe to hand to external callers; the message stays internal.
 */
public class PipelineException extends RuntimeException {

    private final String errorCode;

    public PipelineException(String message) {
        this("PIPELINE_ERROR", message, null);
    }

    public PipelineException(String message, Throwable cause) {
        this("PIPELINE_ERROR", message, cause);
    }

    protected PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
