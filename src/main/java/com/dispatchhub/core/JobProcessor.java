package com.dispatchhub.core;

/**
 * Processor invoked by the scheduler for every job of the type it is registered for.
 *
 * <p>Processors run on a worker thread. Returning normally completes the job;
 * throwing marks the attempt as failed and may trigger a retry based on the
 * queue's retry policy. Implementations should be idempotent when possible,
 * because a failed job is handed to the same processor again.</p>
 *
 * @see com.dispatchhub.engine.ProcessorRegistry
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * Execute the business logic for one attempt of a job.
     *
     * @param job a snapshot of the job being processed (status PROCESSING, attempts already incremented)
     * @throws Exception if the attempt fails. The message is recorded on the job.
     */
    void process(Job job) throws Exception;
}
