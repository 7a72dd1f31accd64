package com.dispatchhub.core;

import java.time.Duration;

import org.json.JSONObject;

/**
 * Scheduler settings.
 *
 * <p><b>Defaults:</b></p>
 * <ul>
 *   <li>maxConcurrent = 5 jobs in flight process-wide</li>
 *   <li>retryAttempts = 3 total attempts per job</li>
 *   <li>retryDelay = 1 second, multiplied by the attempt count (linear backoff)</li>
 *   <li>processInterval = 100 ms between dispatch ticks</li>
 *   <li>historyLimit = 1000 finished jobs kept for status queries</li>
 * </ul>
 */
public final class QueueConfig {
    public static final int DEFAULT_MAX_CONCURRENT = 5;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_PROCESS_INTERVAL = Duration.ofMillis(100);
    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final int maxConcurrent;
    private final int retryAttempts;
    private final Duration retryDelay;
    private final Duration processInterval;
    private final int historyLimit;

    public QueueConfig(int maxConcurrent, int retryAttempts, Duration retryDelay,
                       Duration processInterval, int historyLimit) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1, got " + retryAttempts);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be zero or positive");
        }
        if (processInterval == null || processInterval.isZero() || processInterval.isNegative()) {
            throw new IllegalArgumentException("processInterval must be positive");
        }
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must not be negative, got " + historyLimit);
        }
        this.maxConcurrent = maxConcurrent;
        this.retryAttempts = retryAttempts;
        this.retryDelay = retryDelay;
        this.processInterval = processInterval;
        this.historyLimit = historyLimit;
    }

    public static QueueConfig defaults() {
        return new QueueConfig(DEFAULT_MAX_CONCURRENT, DEFAULT_RETRY_ATTEMPTS, DEFAULT_RETRY_DELAY,
                DEFAULT_PROCESS_INTERVAL, DEFAULT_HISTORY_LIMIT);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getProcessInterval() {
        return processInterval;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    /**
     * Backoff before the next attempt after {@code attempts} failed attempts.
     */
    public Duration backoffFor(int attempts) {
        return retryDelay.multipliedBy(attempts);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("maxConcurrent", maxConcurrent);
        json.put("retryAttempts", retryAttempts);
        json.put("retryDelayMs", retryDelay.toMillis());
        json.put("processIntervalMs", processInterval.toMillis());
        json.put("historyLimit", historyLimit);
        return json;
    }

    @Override
    public String toString() {
        return "QueueConfig{maxConcurrent=" + maxConcurrent + ", retryAttempts=" + retryAttempts
                + ", retryDelay=" + retryDelay.toMillis() + "ms, processInterval=" + processInterval.toMillis()
                + "ms, historyLimit=" + historyLimit + "}";
    }
}
