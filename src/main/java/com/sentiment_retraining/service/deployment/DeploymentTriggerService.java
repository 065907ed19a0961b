package com.sentiment_retraining.service.deployment;

import com.sentiment_retraining.config.CdTriggerSettings;
import com.sentiment_retraining.dto.deployment.DeploymentNotificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Hands a newly promoted version over to continuous delivery by dispatching the CD workflow.
 * Never throws: every outcome is reported through {@link DeploymentNotificationResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentTriggerService {

    static final String TRIGGER_SOURCE = "automated_retraining";

    private final RestTemplate deploymentRestTemplate;
    private final CdTriggerSettings cdTriggerSettings;

    public DeploymentNotificationResult notifyDeployment(int modelVersion, double modelAccuracy) {
        return notifyDeployment(modelVersion, modelAccuracy, cdTriggerSettings);
    }

    public DeploymentNotificationResult notifyDeployment(int modelVersion, double modelAccuracy, CdTriggerSettings config) {
        if (!config.isEnabled()) {
            log.info("CD trigger disabled; not dispatching deployment of v{}", modelVersion);
            return DeploymentNotificationResult.disabled();
        }

        List<String> missing = config.missingIdentifiers();
        if (!missing.isEmpty()) {
            log.warn("⚠️ CD trigger enabled but {} not configured; skipping dispatch", missing);
            return DeploymentNotificationResult.failed("Missing deployment configuration: " + String.join(", ", missing));
        }

        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("model_version", String.valueOf(modelVersion));
        inputs.put("model_accuracy", String.format(Locale.ROOT, "%.4f", modelAccuracy));
        inputs.put("trigger_source", TRIGGER_SOURCE);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ref", config.getRef());
        body.put("inputs", inputs);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));
        headers.setBearerAuth(config.getToken());
        headers.set("X-GitHub-Api-Version", "2022-11-28");

        try {
            log.info("🚚 Dispatching CD workflow '{}' for model v{} ({})", config.getWorkflow(), modelVersion, config);
            ResponseEntity<Void> response = deploymentRestTemplate.exchange(
                    config.dispatchUrl(), HttpMethod.POST, new HttpEntity<>(body, headers), Void.class);

            if (response.getStatusCode().value() == HttpStatus.NO_CONTENT.value()) {
                log.info("✅ CD workflow dispatched for model v{}", modelVersion);
                return DeploymentNotificationResult.sent();
            }
            log.warn("⚠️ CD dispatch answered with unexpected status {}", response.getStatusCode().value());
            return DeploymentNotificationResult.failed("Unexpected status " + response.getStatusCode().value());
        } catch (HttpStatusCodeException e) {
            log.error("❌ CD dispatch rejected with status {}", e.getStatusCode().value());
            return DeploymentNotificationResult.failed("Rejected with status " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.error("❌ CD endpoint unreachable: {}", e.getMessage());
            return DeploymentNotificationResult.failed("Endpoint unreachable");
        } catch (RestClientException e) {
            log.error("❌ CD dispatch failed: {}", e.getMessage());
            return DeploymentNotificationResult.failed("Dispatch failed");
        } catch (RuntimeException e) {
            log.error("❌ Unexpected error while dispatching CD workflow", e);
            return DeploymentNotificationResult.failed("Unexpected error");
        }
    }
}
