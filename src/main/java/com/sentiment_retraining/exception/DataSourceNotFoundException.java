package com.sentiment_retraining.exception;

public class DataSourceNotFoundException extends PipelineException {

    public DataSourceNotFoundException(String message) {
        super("DATA_SOURCE_NOT_FOUND", message, null);
    }

    public DataSourceNotFoundException(String message, Throwable cause) {
        super("DATA_SOURCE_NOT_FOUND", message, cause);
    }
}
