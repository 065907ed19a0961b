package com.sentiment_retraining.exception;

public class DataValidationException extends PipelineException {

    public DataValidationException(String message) {
        super("DATA_VALIDATION_FAILED", message, null);
    }

    public DataValidationException(String message, Throwable cause) {
        super("DATA_VALIDATION_FAILED", message, cause);
    }
}
