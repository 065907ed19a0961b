package com.sentiment_retraining.service.task;

import com.sentiment_retraining.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs pipeline tasks with their retry policy, logging every attempt.
 */
@Component
@Slf4j
public class TaskRunner {

    public <I, O> O execute(String taskName, RetryPolicy policy, I input, PipelineTask<I, O> task) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                log.info("▶️ Task '{}' started (attempt {}/{})", taskName, attempt, policy.getMaxRetries() + 1);
                O result = task.run(input);
                log.info("✅ Task '{}' finished", taskName);
                return result;
            } catch (Exception e) {
                boolean retriesLeft = attempt <= policy.getMaxRetries();
                if (!retriesLeft || !policy.isRetryable(e)) {
                    log.error("❌ Task '{}' failed after {} attempt(s): {}", taskName, attempt, e.getMessage());
                    throw propagate(taskName, e);
                }
                log.warn("🔁 Task '{}' failed (attempt {}), retrying in {} ms: {}",
                        taskName, attempt, policy.getDelay().toMillis(), e.getMessage());
                pause(taskName, policy.getDelay());
            }
        }
    }

    protected void sleep(Duration delay) throws InterruptedException {
        Thread.sleep(delay.toMillis());
    }

    private void pause(String taskName, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Task '" + taskName + "' interrupted while waiting to retry", ie);
        }
    }

    private RuntimeException propagate(String taskName, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new PipelineException("Task '" + taskName + "' failed", e);
    }
}
