package com.sentiment_retraining.exception;

public class PromotionFailedException extends PipelineException {

    public PromotionFailedException(String message) {
        super("PROMOTION_FAILED", message, null);
    }

    public PromotionFailedException(String message, Throwable cause) {
        super("PROMOTION_FAILED", message, cause);
    }
}
