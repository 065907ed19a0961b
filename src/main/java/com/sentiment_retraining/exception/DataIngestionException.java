package com.sentiment_retraining.exception;

public class DataIngestionException extends PipelineException {

    public DataIngestionException(String message) {
        super("DATA_INGESTION_ERROR", message, null);
    }

    public DataIngestionException(String message, Throwable cause) {
        super("DATA_INGESTION_ERROR", message, cause);
    }
}
