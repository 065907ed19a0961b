package com.sentiment_retraining.enumeration;

public enum ModelStageEnum {
    NONE,
    STAGING,
    PRODUCTION,
    ARCHIVED
}
