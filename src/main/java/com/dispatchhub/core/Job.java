package com.dispatchhub.core;

import com.google.gson.Gson;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work owned by the scheduler.
 *
 * <p>This class handles:</p>
 * <ul>
 *   <li>Identity, type and JSON payload of the work item</li>
 *   <li>Priority and the attempt budget (maxAttempts)</li>
 *   <li>Lifecycle state with validated transitions</li>
 *   <li>Gson decoding of the payload for processors</li>
 * </ul>
 *
 * <p><b>Invariants:</b> {@code attempts <= maxAttempts} at all times, and a FAILED
 * job always has {@code attempts == maxAttempts}. Once COMPLETED or FAILED the job
 * accepts no further transitions.</p>
 *
 * <p><b>Thread Safety:</b> Instances held by the scheduler are mutated only under the
 * scheduler's monitor. Everything handed outside the scheduler (processor arguments,
 * event payloads, status queries) is a {@link #snapshot()} copy.</p>
 *
 * @see JobStatus#canTransitionTo(JobStatus)
 */
public class Job {
    // Shared Gson instance for payload decoding - thread-safe
    private static final Gson gson = new Gson();

    private final String id;
    private final String type;
    private final String payload;
    private final int priority;
    private final int maxAttempts;
    private final Instant createdAt;

    private JobStatus status;
    private int attempts;
    private Instant updatedAt;
    private Instant processedAt;
    private String error;

    /**
     * Create a new PENDING job.
     *
     * @param id unique job identifier
     * @param type job type, used to route the job to its processor
     * @param payload JSON payload, may be null
     * @param priority integer priority, higher = more urgent
     * @param maxAttempts total attempts allowed before the job fails permanently
     * @param createdAt creation timestamp
     * @throws IllegalArgumentException if type is blank or maxAttempts &lt; 1
     */
    public Job(String id, String type, String payload, int priority, int maxAttempts, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.type = type;
        this.payload = payload;
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = JobStatus.PENDING;
        this.attempts = 0;
        this.updatedAt = createdAt;
    }

    private Job(Job source) {
        this.id = source.id;
        this.type = source.type;
        this.payload = source.payload;
        this.priority = source.priority;
        this.maxAttempts = source.maxAttempts;
        this.createdAt = source.createdAt;
        this.status = source.status;
        this.attempts = source.attempts;
        this.updatedAt = source.updatedAt;
        this.processedAt = source.processedAt;
        this.error = source.error;
    }

    /**
     * Copy the job's current state. Used for everything that leaves the scheduler.
     */
    public Job snapshot() {
        return new Job(this);
    }

    /**
     * Start a new attempt: PENDING/RETRYING → PROCESSING and increment attempts.
     */
    public void markProcessing(Instant now) {
        transitionTo(JobStatus.PROCESSING, now);
        attempts++;
    }

    /**
     * Record a successful attempt: PROCESSING → COMPLETED and stamp processedAt.
     */
    public void markCompleted(Instant now) {
        transitionTo(JobStatus.COMPLETED, now);
        processedAt = now;
    }

    /**
     * Record a failed attempt that will be retried.
     */
    public void markRetrying(String errorMessage, Instant now) {
        if (attempts >= maxAttempts) {
            throw new IllegalStateException("Job " + id + " has no attempts left (" + attempts + "/" + maxAttempts + ")");
        }
        transitionTo(JobStatus.RETRYING, now);
        error = errorMessage;
    }

    /**
     * Record the final failed attempt: PROCESSING → FAILED.
     */
    public void markFailed(String errorMessage, Instant now) {
        if (attempts != maxAttempts) {
            throw new IllegalStateException("Job " + id + " cannot fail after " + attempts + "/" + maxAttempts + " attempts");
        }
        transitionTo(JobStatus.FAILED, now);
        error = errorMessage;
    }

    private void transitionTo(JobStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for job " + id + ": " + status + " -> " + next);
        }
        status = next;
        updatedAt = now;
    }

    /**
     * Check whether another attempt is allowed after the current one.
     */
    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    /**
     * Deserialize the JSON payload to a domain object.
     *
     * <pre>{@code
     * EmailData data = job.payloadAs(EmailData.class);
     * }</pre>
     *
     * @param clazz the class of the target object
     * @param <T> the type of the object
     * @return the deserialized object, or null if payload is null/empty
     */
    public <T> T payloadAs(Class<T> clazz) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        return gson.fromJson(payload, clazz);
    }

    /**
     * Serialize a domain object into a JSON payload string.
     */
    public static String toPayload(Object data) {
        return gson.toJson(data);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getPayload() {
        return payload;
    }

    public int getPriority() {
        return priority;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * @return completion time, or null unless the job is COMPLETED
     */
    public Instant getProcessedAt() {
        return processedAt;
    }

    /**
     * @return the last failure message, or null if no attempt has failed
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", type=" + type + ", priority=" + priority + ", status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
