package com.sentiment_retraining.config;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deployment-target identifiers for the workflow dispatch that starts the CD pipeline.
 */
@Component
@Getter
public class CdTriggerSettings {

    private final boolean enabled;
    private final String repoOwner;
    private final String repoName;
    private final String token;
    private final String workflow;
    private final String ref;
    private final String apiUrl;
    private final int timeoutMs;

    @Builder
    public CdTriggerSettings(@Value("${pipeline.cd.enabled:false}") boolean enabled,
                             @Value("${pipeline.cd.repo-owner:}") String repoOwner,
                             @Value("${pipeline.cd.repo-name:}") String repoName,
                             @Value("${pipeline.cd.token:}") String token,
                             @Value("${pipeline.cd.workflow:cd_pipeline.yml}") String workflow,
                             @Value("${pipeline.cd.ref:main}") String ref,
                             @Value("${pipeline.cd.api-url:https://api.github.com}") String apiUrl,
                             @Value("${pipeline.cd.timeout-ms:10000}") int timeoutMs) {
        this.enabled = enabled;
        this.repoOwner = repoOwner;
        this.repoName = repoName;
        this.token = token;
        this.workflow = StringUtils.defaultIfBlank(workflow, "cd_pipeline.yml");
        this.ref = StringUtils.defaultIfBlank(ref, "main");
        this.apiUrl = StringUtils.removeEnd(StringUtils.defaultIfBlank(apiUrl, "https://api.github.com"), "/");
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 10000;
    }

    public List<String> missingIdentifiers() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(repoOwner)) {
            missing.add("repo-owner");
        }
        if (StringUtils.isBlank(repoName)) {
            missing.add("repo-name");
        }
        if (StringUtils.isBlank(token)) {
            missing.add("token");
        }
        return missing;
    }

    public String dispatchUrl() {
        return apiUrl + "/repos/" + repoOwner + "/" + repoName + "/actions/workflows/" + workflow + "/dispatches";
    }

    @Override
    public String toString() {
        // token stays out of logs
        return "CdTriggerSettings(enabled=" + enabled + ", repo=" + repoOwner + "/" + repoName
                + ", workflow=" + workflow + ", ref=" + ref + ")";
    }
}
