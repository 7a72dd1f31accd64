package com.dispatchhub.engine;

import com.dispatchhub.core.Job;
import com.dispatchhub.core.JobProcessor;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one attempt of a single job on the worker pool.
 *
 * <p>The Worker is created by the scheduler after the job has been moved to the active set
 * and marked PROCESSING. It hands a snapshot of the job to the processor and reports the
 * outcome back to the scheduler, which owns every state transition.</p>
 *
 * <p><b>Error Handling Strategy:</b></p>
 * <ul>
 *   <li>Processor returns normally → {@code JobQueueScheduler#onSuccess}</li>
 *   <li>Processor throws anything → {@code JobQueueScheduler#onFailure} with the error message</li>
 *   <li>Nothing is rethrown: a failing processor never kills the pool thread</li>
 * </ul>
 *
 * <p><b>Design Decision:</b> Why does the processor get a snapshot? The live job is
 * mutated under the scheduler's monitor by other threads (status queries, stats,
 * retry timers). A processor holding a copy can read it freely without locking and
 * cannot corrupt the scheduler's bookkeeping.</p>
 *
 * @author Dispatch Hub Team
 * @see JobQueueScheduler
 */
class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final Job job;
    private final JobProcessor processor;
    private final JobQueueScheduler scheduler;

    /**
     * @param job the live job instance owned by the scheduler
     * @param processor the processor registered for the job's type
     * @param scheduler the scheduler to report the outcome to
     */
    Worker(Job job, JobProcessor processor, JobQueueScheduler scheduler) {
        this.job = job;
        this.processor = processor;
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        Job view = scheduler.snapshotOf(job);
        logger.fine("Worker starting job " + view.getId() + " (type: " + view.getType()
                + ", attempt " + view.getAttempts() + "/" + view.getMaxAttempts() + ")");

        long startTime = System.currentTimeMillis();
        try {
            processor.process(view);
        } catch (Throwable e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.log(Level.SEVERE, "Job " + view.getId() + " failed after " + duration + "ms", e);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            scheduler.onFailure(job, describe(e));
            return;
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.fine("Job " + view.getId() + " completed in " + duration + "ms");
        scheduler.onSuccess(job);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
