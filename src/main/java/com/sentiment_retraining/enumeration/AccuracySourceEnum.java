package com.sentiment_retraining.enumeration;

/**
 * Where the accuracy of the current Production version was read from.
 */
public enum AccuracySourceEnum {
    FOUND_TAG,
    FOUND_METRIC,
    DEFAULT
}
