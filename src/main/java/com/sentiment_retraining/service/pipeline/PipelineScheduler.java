package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic drift-driven cycle. Disabled unless {@code pipeline.schedule.cron} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler {

    private final RetrainingOrchestrator retrainingOrchestrator;

    @Scheduled(cron = "${pipeline.schedule.cron:-}")
    public void runScheduledCycle() {
        log.info("⏰ Scheduled retraining cycle triggered");
        PipelineRunDTO result = retrainingOrchestrator.run(false);
        log.info("⏰ Scheduled cycle {} ended with outcome {}", result.getRunId(), result.getOutcome());
    }
}
