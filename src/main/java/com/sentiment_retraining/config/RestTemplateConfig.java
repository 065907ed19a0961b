package com.sentiment_retraining.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    /**
     * Client used for the workflow dispatch call. Bounded by the configured timeout so a
     * hanging CI endpoint never stalls the retraining cycle.
     */
    @Bean
    public RestTemplate deploymentRestTemplate(CdTriggerSettings cdTriggerSettings) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(cdTriggerSettings.getTimeoutMs());
        factory.setReadTimeout(cdTriggerSettings.getTimeoutMs());
        return new RestTemplate(factory);
    }
}
