package com.dispatchhub.core;

/**
 * Lifecycle events emitted by the scheduler. Each event carries a snapshot of the job
 * taken at emission time.
 */
public enum JobEvent {
    ADDED("job:added"),
    PROCESSING("job:processing"),
    COMPLETED("job:completed"),
    RETRYING("job:retrying"),
    FAILED("job:failed");

    private final String eventName;

    JobEvent(String eventName) {
        this.eventName = eventName;
    }

    /**
     * @return the wire name of the event, e.g. {@code job:completed}
     */
    public String getEventName() {
        return eventName;
    }

    @Override
    public String toString() {
        return eventName;
    }
}
