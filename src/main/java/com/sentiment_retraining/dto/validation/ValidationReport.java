package com.sentiment_retraining.dto.validation;

import java.util.List;

public record ValidationReport(String suiteName, boolean success, int evaluatedExpectations, List<String> failures) {

    public ValidationReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
