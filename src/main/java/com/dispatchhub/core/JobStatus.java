package com.dispatchhub.core;

/**
 * Enum representing the states a job passes through while owned by the scheduler.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → PROCESSING: Job selected by the dispatch loop and handed to its processor</li>
 *   <li>PROCESSING → COMPLETED: Processor returned normally</li>
 *   <li>PROCESSING → RETRYING: Processor failed with attempts remaining</li>
 *   <li>RETRYING → PROCESSING: Backoff elapsed, job re-queued and selected again</li>
 *   <li>PROCESSING → FAILED: Processor failed on the last allowed attempt</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending"),
    PROCESSING("Processing"),
    RETRYING("Retrying"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Check if this status represents a terminal state.
     * Jobs in a terminal state are retained for status queries but never reprocessed.
     *
     * @return true if the job has reached COMPLETED or FAILED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: Once a job reaches a terminal state it cannot transition
     * to any other state.</p>
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed, false if it violates state machine rules
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING, RETRYING -> newStatus == PROCESSING;
            case PROCESSING -> newStatus == COMPLETED || newStatus == RETRYING || newStatus == FAILED;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
