package com.sentiment_retraining.exception;

public class ModelIneligibleException extends PipelineException {

    public ModelIneligibleException(String message) {
        super("MODEL_INELIGIBLE", message, null);
    }

    public ModelIneligibleException(String message, Throwable cause) {
        super("MODEL_INELIGIBLE", message, cause);
    }
}
