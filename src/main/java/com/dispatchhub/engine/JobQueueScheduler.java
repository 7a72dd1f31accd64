package com.dispatchhub.engine;

import com.dispatchhub.core.Job;
import com.dispatchhub.core.JobEvent;
import com.dispatchhub.core.JobPriority;
import com.dispatchhub.core.JobProcessor;
import com.dispatchhub.core.ListenerRegistry;
import com.dispatchhub.core.QueueConfig;
import com.dispatchhub.core.QueueStats;
import com.dispatchhub.core.Subscription;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Priority multi-queue scheduler with bounded concurrency and linear retry backoff.
 *
 * <p>The scheduler keeps one queue per job type, sorted by priority (highest first).
 * A fixed-rate tick selects at most one job per tick and hands it to a worker pool.</p>
 *
 * <p><b>Selection Rules (each tick):</b></p>
 * <ul>
 *   <li>Do nothing if {@code maxConcurrent} jobs are already in flight</li>
 *   <li>Scan types in first-use order; a type is eligible if its queue is non-empty and it has no job in flight</li>
 *   <li>Pick the eligible head with strictly the greatest priority; the first one found wins ties</li>
 *   <li>If no processor is registered for the chosen type, drop the job without retry or event</li>
 * </ul>
 *
 * <p><b>Retry Mechanism:</b></p>
 * <ul>
 *   <li>Linear backoff: delay = retryDelay × attempts</li>
 *   <li>During backoff the job stays in the active set and its type keeps the in-flight slot,
 *       so no other job of that type is dispatched until the job is re-queued</li>
 *   <li>After maxAttempts failed attempts the job is FAILED and its slot is released at once</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>Ticks and retry timers run on one scheduling thread</li>
 *   <li>Processors run on a fixed pool of {@code maxConcurrent} worker threads</li>
 *   <li>Queues, the active set, in-flight types and history share one monitor</li>
 *   <li>Lifecycle events are published outside the monitor with a job snapshot</li>
 *   <li>A new job is not selectable until its job:added event has been published,
 *       so job:added is always the first event observers see for a job</li>
 *   <li>Loop ticks re-check the running flag under the monitor; nothing is dispatched
 *       by the loop once {@link #stop()} has returned</li>
 * </ul>
 *
 * <p><b>Design Decision:</b> Why hold the type slot during backoff? A failing job usually
 * fails because of something its type depends on (a mail server, a webhook endpoint).
 * Keeping the slot means the next job of that type waits for the retry instead of
 * hitting the same broken dependency straight away, while other types keep flowing.</p>
 *
 * <p><b>Design Decision:</b> Why one scheduling thread? Ticks, wake-ups and retry timers
 * all run on it, so at most one dispatch decision is made at a time and the
 * one-job-per-tick rule holds without extra coordination.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ProcessorRegistry processors = new ProcessorRegistry();
 * JobQueueScheduler scheduler = new JobQueueScheduler(QueueConfig.defaults(), processors);
 * scheduler.registerProcessor("email", job -> mailer.send(job.payloadAs(Mail.class)));
 * scheduler.start();
 *
 * String id = scheduler.addJob("email", payload, JobPriority.HIGH);
 * scheduler.getJobStatus(id).ifPresent(job -> log(job.getStatus()));
 *
 * scheduler.shutdown();
 * }</pre>
 *
 * @author Dispatch Hub Team
 * @see Worker
 * @see ProcessorRegistry
 */
public class JobQueueScheduler {
    private static final Logger logger = Logger.getLogger(JobQueueScheduler.class.getName());
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

    private static final Comparator<Job> BY_PRIORITY_DESC =
            Comparator.comparingInt(Job::getPriority).reversed();

    private final QueueConfig config;
    private final ProcessorRegistry processors;
    private final Clock clock;
    private final ScheduledExecutorService loop;
    private final ExecutorService workers;

    private final Object lock = new Object();
    private final Map<String, List<Job>> queues = new LinkedHashMap<>();
    private final Map<String, Job> activeJobs = new LinkedHashMap<>();
    private final Set<String> inFlightTypes = new HashSet<>();
    // Queued jobs whose job:added event has not been published yet; not selectable
    private final Set<String> announcing = new HashSet<>();
    private final Map<String, Job> history;
    private final Map<JobEvent, ListenerRegistry<Job>> listeners = new EnumMap<>(JobEvent.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private ScheduledFuture<?> tickTask;

    public JobQueueScheduler(ProcessorRegistry processors) {
        this(QueueConfig.defaults(), processors);
    }

    public JobQueueScheduler(QueueConfig config, ProcessorRegistry processors) {
        this(config, processors, Clock.systemUTC());
    }

    /**
     * Create a scheduler. It does not dispatch anything until {@link #start()} is called.
     *
     * @param config queue settings
     * @param processors registry consulted for every dispatched job
     * @param clock time source for job timestamps
     */
    public JobQueueScheduler(QueueConfig config, ProcessorRegistry processors, Clock clock) {
        this.config = config;
        this.processors = processors;
        this.clock = clock;
        this.loop = Executors.newSingleThreadScheduledExecutor(daemonThreads("job-scheduler"));
        this.workers = Executors.newFixedThreadPool(config.getMaxConcurrent(), daemonThreads("job-worker"));

        int historyLimit = config.getHistoryLimit();
        this.history = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Job> eldest) {
                return size() > historyLimit;
            }
        };
        for (JobEvent event : JobEvent.values()) {
            listeners.put(event, new ListenerRegistry<>(event.getEventName()));
        }

        logger.info("Scheduler initialized with " + config);
    }

    /**
     * Register (or replace) the processor for a job type.
     */
    public void registerProcessor(String type, JobProcessor processor) {
        processors.register(type, processor);
    }

    public String addJob(String type, String payload) {
        return addJob(type, payload, JobPriority.NORMAL);
    }

    public String addJob(String type, String payload, JobPriority priority) {
        if (priority == null) {
            throw new NullPointerException("priority");
        }
        return addJob(type, payload, priority.getValue());
    }

    /**
     * Queue a new PENDING job and return its id immediately.
     *
     * <p>The job is appended to its type's queue, which is then re-sorted by priority
     * (highest first). Execution outcome is observable only through
     * {@link #getJobStatus(String)} and lifecycle events.</p>
     *
     * @param type job type, routed to the processor registered for it
     * @param payload JSON payload, may be null
     * @param priority integer priority, higher = more urgent
     * @return the generated job id
     * @throws IllegalArgumentException if type is blank
     */
    public String addJob(String type, String payload, int priority) {
        Job job = new Job(UUID.randomUUID().toString(), type, payload, priority,
                config.getRetryAttempts(), clock.instant());

        Job snapshot;
        int queueSize;
        synchronized (lock) {
            List<Job> queue = queues.computeIfAbsent(type, key -> new ArrayList<>());
            queue.add(job);
            queue.sort(BY_PRIORITY_DESC);
            announcing.add(job.getId());
            queueSize = queue.size();
            snapshot = job.snapshot();
        }

        logger.fine("Job added: " + job.getId() + " (type: " + type + ", priority: " + priority
                + ", queue size: " + queueSize + ")");
        try {
            publish(JobEvent.ADDED, snapshot);
        } finally {
            synchronized (lock) {
                announcing.remove(job.getId());
            }
        }
        wake();
        return job.getId();
    }

    /**
     * Look up a job by id: active jobs first, then the pending queues, then finished jobs.
     *
     * @return a snapshot of the job, or empty if the id is unknown (or was dropped or evicted)
     */
    public Optional<Job> getJobStatus(String jobId) {
        synchronized (lock) {
            Job active = activeJobs.get(jobId);
            if (active != null) {
                return Optional.of(active.snapshot());
            }
            for (List<Job> queue : queues.values()) {
                for (Job job : queue) {
                    if (job.getId().equals(jobId)) {
                        return Optional.of(job.snapshot());
                    }
                }
            }
            Job finished = history.get(jobId);
            return finished != null ? Optional.of(finished.snapshot()) : Optional.empty();
        }
    }

    /**
     * Start the dispatch loop. Calling start on a running scheduler is a no-op.
     *
     * @throws IllegalStateException if the scheduler has been shut down
     */
    public void start() {
        synchronized (lock) {
            if (shutdown.get()) {
                throw new IllegalStateException("Scheduler has been shut down");
            }
            if (tickTask != null) {
                logger.warning("Scheduler is already running");
                return;
            }
            long intervalMillis = config.getProcessInterval().toMillis();
            tickTask = loop.scheduleAtFixedRate(this::loopTick, 0, intervalMillis, TimeUnit.MILLISECONDS);
            running.set(true);
        }
        logger.info("Queue processing started (maxConcurrent: " + config.getMaxConcurrent() + ")");
    }

    /**
     * Stop dispatching new jobs. In-flight jobs finish and pending retry timers still fire.
     * Calling stop on a stopped scheduler is a no-op.
     */
    public void stop() {
        synchronized (lock) {
            if (tickTask == null) {
                return;
            }
            tickTask.cancel(false);
            tickTask = null;
            running.set(false);
        }
        logger.info("Queue processing stopped");
    }

    /**
     * Stop the loop and wait up to 60 seconds for in-flight processors to finish.
     */
    public void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Stop the loop, wait for in-flight processors, then release all threads.
     *
     * <p>Retry timers that have not fired yet are discarded; their jobs remain RETRYING.
     * The scheduler cannot be restarted afterwards.</p>
     *
     * @param timeout how long to wait for running processors before interrupting them
     */
    public void shutdown(Duration timeout) {
        stop();
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Initiating graceful shutdown...");

        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Forcing shutdown of remaining jobs");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        loop.shutdownNow();

        logger.info("Scheduler shutdown complete");
    }

    /**
     * Snapshot of per-type pending counts, in-flight count, total pending and configuration.
     */
    public QueueStats getStats() {
        synchronized (lock) {
            List<QueueStats.TypeStats> typeStats = new ArrayList<>();
            int totalPending = 0;
            for (Map.Entry<String, List<Job>> entry : queues.entrySet()) {
                int pending = entry.getValue().size();
                totalPending += pending;
                typeStats.add(new QueueStats.TypeStats(entry.getKey(), pending,
                        inFlightTypes.contains(entry.getKey()) ? 1 : 0));
            }
            return new QueueStats(typeStats, activeJobs.size(), totalPending, running.get(), config);
        }
    }

    /**
     * Empty every pending queue. Jobs that are processing or waiting out a retry backoff are kept.
     */
    public void clearQueues() {
        int cleared = 0;
        synchronized (lock) {
            for (List<Job> queue : queues.values()) {
                cleared += queue.size();
                queue.clear();
            }
        }
        logger.info("All queues cleared (" + cleared + " pending jobs removed)");
    }

    /**
     * Listen for one lifecycle event. Listeners run synchronously on the thread that caused
     * the transition and must not block.
     */
    public Subscription on(JobEvent event, Consumer<? super Job> listener) {
        return listeners.get(event).subscribe(listener);
    }

    public boolean isRunning() {
        return running.get();
    }

    public QueueConfig getConfig() {
        return config;
    }

    /**
     * One dispatch step: claim at most one eligible job and hand it to a worker.
     * Runs whether or not the loop is started.
     */
    void tick() {
        dispatchOnce(false);
    }

    // Fixed-rate and wake-up ticks; a no-op once stop() has returned
    private void loopTick() {
        dispatchOnce(true);
    }

    private void dispatchOnce(boolean requireRunning) {
        Dispatch dispatch;
        try {
            dispatch = claimNextJob(requireRunning);
        } catch (RuntimeException e) {
            // Keep the fixed-rate task alive; a thrown exception would cancel it
            logger.log(Level.SEVERE, "Unexpected error in dispatch loop", e);
            return;
        }
        if (dispatch == null) {
            return;
        }

        publish(JobEvent.PROCESSING, dispatch.snapshot);
        try {
            workers.execute(new Worker(dispatch.job, dispatch.processor, this));
        } catch (RejectedExecutionException e) {
            logger.log(Level.SEVERE, "Worker pool rejected job " + dispatch.job.getId(), e);
            onFailure(dispatch.job, "Worker pool rejected job");
        }
    }

    private Dispatch claimNextJob(boolean requireRunning) {
        synchronized (lock) {
            if (shutdown.get() || (requireRunning && !running.get())) {
                return null;
            }
            if (activeJobs.size() >= config.getMaxConcurrent()) {
                return null;
            }

            Job next = selectNextJob();
            if (next == null) {
                return null;
            }

            removeFromQueue(next);
            JobProcessor processor = processors.get(next.getType());
            if (processor == null) {
                logger.warning("No processor for job type " + next.getType() + ", dropping job " + next.getId());
                return null;
            }

            inFlightTypes.add(next.getType());
            activeJobs.put(next.getId(), next);
            next.markProcessing(clock.instant());

            logger.fine("Processing job " + next.getId() + " (type: " + next.getType()
                    + ", attempt " + next.getAttempts() + ")");
            return new Dispatch(next, processor, next.snapshot());
        }
    }

    // Highest-priority head among types with a non-empty queue and a free in-flight slot
    private Job selectNextJob() {
        Job best = null;
        for (Map.Entry<String, List<Job>> entry : queues.entrySet()) {
            List<Job> queue = entry.getValue();
            if (queue.isEmpty() || inFlightTypes.contains(entry.getKey())) {
                continue;
            }
            Job head = queue.get(0);
            if (announcing.contains(head.getId())) {
                continue;
            }
            if (best == null || head.getPriority() > best.getPriority()) {
                best = head;
            }
        }
        return best;
    }

    private void removeFromQueue(Job job) {
        List<Job> queue = queues.get(job.getType());
        if (queue == null) {
            return;
        }
        Iterator<Job> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().getId().equals(job.getId())) {
                it.remove();
                return;
            }
        }
    }

    Job snapshotOf(Job job) {
        synchronized (lock) {
            return job.snapshot();
        }
    }

    void onSuccess(Job job) {
        Job snapshot;
        synchronized (lock) {
            job.markCompleted(clock.instant());
            release(job);
            snapshot = job.snapshot();
        }
        logger.fine("Job completed: " + job.getId() + " (type: " + job.getType() + ")");
        publish(JobEvent.COMPLETED, snapshot);
        wake();
    }

    void onFailure(Job job, String errorMessage) {
        JobEvent event;
        Job snapshot;
        Duration delay = null;
        synchronized (lock) {
            if (job.hasAttemptsLeft()) {
                job.markRetrying(errorMessage, clock.instant());
                delay = config.backoffFor(job.getAttempts());
                logger.info("Job " + job.getId() + " will retry in " + delay.toMillis() + "ms (attempt "
                        + job.getAttempts() + "/" + job.getMaxAttempts() + ")");
                event = JobEvent.RETRYING;
            } else {
                job.markFailed(errorMessage, clock.instant());
                release(job);
                logger.warning("Job " + job.getId() + " permanently failed after " + job.getAttempts()
                        + " attempts: " + errorMessage);
                event = JobEvent.FAILED;
            }
            snapshot = job.snapshot();
        }
        publish(event, snapshot);
        if (delay != null) {
            scheduleRequeue(job, delay);
        } else {
            wake();
        }
    }

    private void scheduleRequeue(Job job, Duration delay) {
        try {
            loop.schedule(() -> requeue(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warning("Retry timer rejected for job " + job.getId() + ", re-queueing immediately");
            requeue(job);
        }
    }

    // Backoff elapsed: back into the type queue and give up the in-flight slot
    private void requeue(Job job) {
        synchronized (lock) {
            List<Job> queue = queues.computeIfAbsent(job.getType(), key -> new ArrayList<>());
            queue.add(job);
            queue.sort(BY_PRIORITY_DESC);
            activeJobs.remove(job.getId());
            inFlightTypes.remove(job.getType());
        }
        logger.fine("Job re-queued after backoff: " + job.getId());
        wake();
    }

    private void release(Job job) {
        activeJobs.remove(job.getId());
        inFlightTypes.remove(job.getType());
        if (config.getHistoryLimit() > 0) {
            history.put(job.getId(), job);
        }
    }

    private void publish(JobEvent event, Job snapshot) {
        listeners.get(event).publish(snapshot);
    }

    // Extra tick so new work or a freed slot does not wait for the next interval
    private void wake() {
        if (!running.get() || shutdown.get()) {
            return;
        }
        try {
            loop.execute(this::loopTick);
        } catch (RejectedExecutionException e) {
            logger.fine("Wake-up skipped, scheduling thread is shutting down");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Dispatch {
        private final Job job;
        private final JobProcessor processor;
        private final Job snapshot;

        private Dispatch(Job job, JobProcessor processor, Job snapshot) {
            this.job = job;
            this.processor = processor;
            this.snapshot = snapshot;
        }
    }
}
