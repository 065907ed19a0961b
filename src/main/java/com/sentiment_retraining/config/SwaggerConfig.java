package com.sentiment_retraining.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI sentimentRetrainingOpenAPI(@Value("${inference.version:1.0.0}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("Sentiment Retraining API")
                        .version(version)
                        .description("Trigger and inspect retraining cycles, browse registered model versions and query the Production sentiment classifier."))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local server")
                ));
    }

    @Bean
    public GroupedOpenApi pipelineApi() {
        return GroupedOpenApi.builder()
                .group("Retraining pipeline")
                .pathsToMatch("/api/**")
                .build();
    }

    @Bean
    public GroupedOpenApi inferenceApi() {
        return GroupedOpenApi.builder()
                .group("Inference")
                .pathsToMatch("/health", "/models/**", "/predict", "/predict_batch")
                .build();
    }
}
