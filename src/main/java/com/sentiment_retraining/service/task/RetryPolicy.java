package com.sentiment_retraining.service.task;

import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-delay retry rule. Exceptions assignable to one of the non-retryable types fail immediately.
 */
@Getter
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO, List.of());

    private final int maxRetries;
    private final Duration delay;
    private final List<Class<? extends Throwable>> nonRetryable;

    private RetryPolicy(int maxRetries, Duration delay, List<Class<? extends Throwable>> nonRetryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.delay = delay == null ? Duration.ZERO : delay;
        this.nonRetryable = List.copyOf(nonRetryable);
    }

    public static RetryPolicy none() {
        return NONE;
    }

    @SafeVarargs
    public static RetryPolicy fixed(int maxRetries, Duration delay, Class<? extends Throwable>... nonRetryable) {
        return new RetryPolicy(maxRetries, delay, List.of(nonRetryable));
    }

    public boolean isRetryable(Throwable error) {
        return nonRetryable.stream().noneMatch(type -> type.isInstance(error));
    }
}
