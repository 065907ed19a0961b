package com.sentiment_retraining.dto.registry;

import com.sentiment_retraining.enumeration.PromotionVerdictEnum;

/**
 * @param productionAccuracy accuracy of the Production version the candidate was compared with;
 *                           null when no comparison took place
 */
public record RegistrationResult(ModelVersionDTO modelVersion,
                                 PromotionVerdictEnum verdict,
                                 AccuracyLookup productionAccuracy) {

    public boolean isPromoted() {
        return verdict.isPromoted();
    }

    public int version() {
        return modelVersion.getVersion();
    }
}
