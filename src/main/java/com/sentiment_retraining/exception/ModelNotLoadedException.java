package com.sentiment_retraining.exception;

public class ModelNotLoadedException extends RuntimeException {

    public ModelNotLoadedException() {
        super("No Production model is loaded.");
    }

    public ModelNotLoadedException(String message) {
        super(message);
    }

    public ModelNotLoadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
