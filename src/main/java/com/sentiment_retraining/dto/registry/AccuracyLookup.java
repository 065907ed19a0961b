package com.sentiment_retraining.dto.registry;

import com.sentiment_retraining.enumeration.AccuracySourceEnum;

public record AccuracyLookup(double value, AccuracySourceEnum source) {

    public static AccuracyLookup fromTag(double value) {
        return new AccuracyLookup(value, AccuracySourceEnum.FOUND_TAG);
    }

    public static AccuracyLookup fromMetric(double value) {
        return new AccuracyLookup(value, AccuracySourceEnum.FOUND_METRIC);
    }

    public static AccuracyLookup defaulted() {
        return new AccuracyLookup(0.0, AccuracySourceEnum.DEFAULT);
    }
}
