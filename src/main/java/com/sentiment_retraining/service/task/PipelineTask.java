package com.sentiment_retraining.service.task;

/**
 * A single unit of work inside the retraining cycle.
 */
@FunctionalInterface
public interface PipelineTask<I, O> {

    O run(I input) throws Exception;
}
