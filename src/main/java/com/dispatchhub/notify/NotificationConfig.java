package com.dispatchhub.notify;

import java.time.Duration;

/**
 * Dispatcher settings.
 *
 * <p><b>Defaults:</b> no webhook URL, 10 second webhook timeout (applied to both connect
 * and read), 4 delivery threads for channel fan-out.</p>
 */
public final class NotificationConfig {
    public static final Duration DEFAULT_WEBHOOK_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_DELIVERY_THREADS = 4;

    private final String webhookUrl;
    private final Duration webhookTimeout;
    private final int deliveryThreads;

    /**
     * @param webhookUrl endpoint of the default webhook channel, or null for none
     * @param webhookTimeout per-call connect and read timeout for webhook delivery
     * @param deliveryThreads size of the fan-out pool
     */
    public NotificationConfig(String webhookUrl, Duration webhookTimeout, int deliveryThreads) {
        if (webhookTimeout == null || webhookTimeout.isZero() || webhookTimeout.isNegative()) {
            throw new IllegalArgumentException("webhookTimeout must be positive");
        }
        if (deliveryThreads < 1) {
            throw new IllegalArgumentException("deliveryThreads must be at least 1, got " + deliveryThreads);
        }
        this.webhookUrl = webhookUrl == null || webhookUrl.isBlank() ? null : webhookUrl;
        this.webhookTimeout = webhookTimeout;
        this.deliveryThreads = deliveryThreads;
    }

    public static NotificationConfig defaults() {
        return new NotificationConfig(null, DEFAULT_WEBHOOK_TIMEOUT, DEFAULT_DELIVERY_THREADS);
    }

    /**
     * @return the default webhook URL, or null if none is configured
     */
    public String getWebhookUrl() {
        return webhookUrl;
    }

    public Duration getWebhookTimeout() {
        return webhookTimeout;
    }

    public int getDeliveryThreads() {
        return deliveryThreads;
    }
}
