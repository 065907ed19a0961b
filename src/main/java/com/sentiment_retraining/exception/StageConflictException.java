package com.sentiment_retraining.exception;

public class StageConflictException extends PipelineException {

    public StageConflictException(String message) {
        super("STAGE_CONFLICT", message, null);
    }

    public StageConflictException(String message, Throwable cause) {
        super("STAGE_CONFLICT", message, cause);
    }
}
