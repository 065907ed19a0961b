package com.sentiment_retraining.service.pipeline;

import com.sentiment_retraining.dto.pipeline.PipelineRunDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
@Slf4j
@RequiredArgsConstructor
public class AsyncPipelineLauncher {

    private final RetrainingOrchestrator retrainingOrchestrator;

    @Async
    public CompletableFuture<PipelineRunDTO> launch(String runId, boolean forceRetrain) {
        log.info("🔍 [ASYNC] Retraining pipeline started [runId={}]", runId);
        try {
            return CompletableFuture.completedFuture(retrainingOrchestrator.execute(runId, forceRetrain));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
