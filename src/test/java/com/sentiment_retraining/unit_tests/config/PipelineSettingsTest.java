package com.sentiment_retraining.unit_tests.config;

import com.sentiment_retraining.config.CdTriggerSettings;
import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.exception.ConfigurationException;
import com.sentiment_retraining.util.TestSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSettingsTest {

    @Test
    void defaultsAreValid() {
        PipelineSettings settings = TestSettings.defaults();

        assertEquals(0.75, settings.getMinTrainingAccuracy());
        assertEquals(List.of("positive", "negative", "neutral"), settings.getAllowedLabels());
    }

    @Test
    @DisplayName("Out-of-range thresholds are configuration errors")
    void rejectsInvalidThresholds() {
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().minTrainingAccuracy(1.5).build());
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().testSplitSize(0.0).build());
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().dataDriftAucThreshold(Double.NaN).build());
    }

    @Test
    void rejectsMissingIdentifiers() {
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().modelName(" ").build());
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().allowedLabels(List.of()).build());
        assertThrows(ConfigurationException.class, () -> TestSettings.pipeline().ingestMaxRetries(-1).build());
    }

    @Test
    @DisplayName("Dispatch URL is built from the deployment target and never exposes the token")
    void cdSettings() {
        CdTriggerSettings cd = TestSettings.cd().apiUrl("https://github.example.com/api/v3/").build();

        assertEquals("https://github.example.com/api/v3/repos/acme/sentiment-platform/actions/workflows/cd_pipeline.yml/dispatches",
                cd.dispatchUrl());
        assertTrue(cd.missingIdentifiers().isEmpty());
        assertFalse(cd.toString().contains("ghp_test"));
        assertEquals(List.of("repo-name"), TestSettings.cd().repoName("").build().missingIdentifiers());
    }
}
