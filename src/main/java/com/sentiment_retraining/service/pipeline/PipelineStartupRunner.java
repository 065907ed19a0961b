package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one forced cycle at startup, used to bootstrap the first Production model.
 */
@Component
@ConditionalOnProperty(name = "pipeline.run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineStartupRunner implements ApplicationRunner {

    private final RetrainingOrchestrator retrainingOrchestrator;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running forced retraining cycle on startup");
        PipelineRunDTO result = retrainingOrchestrator.run(true);
        log.info("Startup cycle {} ended with outcome {}", result.getRunId(), result.getOutcome());
    }
}
