package com.sentiment_retraining.enumeration;

/**
 * Lifecycle of a tracked training run.
 */
public enum RunStatusEnum {
    RUNNING,
    FINISHED,
    FAILED
}
