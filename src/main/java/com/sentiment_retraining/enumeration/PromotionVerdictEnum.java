package com.sentiment_retraining.enumeration;

public enum PromotionVerdictEnum {
    BOOTSTRAP_PROMOTED,
    PROMOTED,
    STAGED_NOT_BETTER,
    STAGED_DIRECT;

    public boolean isPromoted() {
        return this == BOOTSTRAP_PROMOTED || this == PROMOTED;
    }
}
