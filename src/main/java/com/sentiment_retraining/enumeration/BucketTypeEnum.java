package com.sentiment_retraining.enumeration;

public enum BucketTypeEnum {
    MODEL,
    METRICS
}
