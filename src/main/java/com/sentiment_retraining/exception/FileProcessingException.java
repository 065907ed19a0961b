package com.sentiment_retraining.exception;

public class FileProcessingException extends PipelineException {

    public FileProcessingException(String message) {
        super("FILE_ERROR", message, null);
    }

    public FileProcessingException(String message, Throwable cause) {
        super("FILE_ERROR", message, cause);
    }
}
