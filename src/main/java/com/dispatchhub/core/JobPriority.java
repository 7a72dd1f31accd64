package com.dispatchhub.core;

/**
 * Named priority levels for jobs. Higher values are dispatched first.
 */
public enum JobPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int value;

    JobPriority(int value) {
        this.value = value;
    }

    /**
     * @return the integer priority stored on the job
     */
    public int getValue() {
        return value;
    }
}
