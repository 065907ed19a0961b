package com.sentiment_retraining.service.validation;

import com.sentiment_retraining.dto.validation.ValidationReport;

public interface DataValidationEngine {

    /**
     * Checks the file at {@code dataPath} against the named expectation suite.
     *
     * @throws com.sentiment_retraining.exception.ConfigurationException for an unknown suite
     * @throws com.sentiment_retraining.exception.DataSourceNotFoundException when the file is missing
     */
    ValidationReport validate(String dataPath, String suiteName);
}
