package com.sentiment_retraining.dto.data;

import java.util.List;

public record DataSplit(List<String> trainFeatures,
                        List<String> testFeatures,
                        List<String> trainLabels,
                        List<String> testLabels) {
}
