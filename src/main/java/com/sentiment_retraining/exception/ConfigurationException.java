package com.sentiment_retraining.exception;

public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }
}
