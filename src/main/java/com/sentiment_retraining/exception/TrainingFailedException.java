package com.sentiment_retraining.exception;

public class TrainingFailedException extends PipelineException {

    public TrainingFailedException(String message) {
        super("TRAINING_FAILED", message, null);
    }

    public TrainingFailedException(String message, Throwable cause) {
        super("TRAINING_FAILED", message, cause);
    }
}
