package com.sentiment_retraining.enumeration;

public enum PipelineOutcomeEnum {
    SKIPPED,
    RETRAINED_AND_STAGED,
    RETRAINED_AND_PROMOTED,
    FAILED
}
