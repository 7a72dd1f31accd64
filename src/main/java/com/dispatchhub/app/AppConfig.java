package com.dispatchhub.app;

import com.dispatchhub.core.QueueConfig;
import com.dispatchhub.notify.NotificationConfig;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Application settings.
 *
 * <p>Resolution order, later sources winning:</p>
 * <ol>
 *   <li>Built-in defaults of {@link QueueConfig} and {@link NotificationConfig}</li>
 *   <li>{@code dispatchhub.properties} on the classpath</li>
 *   <li>System properties with the same keys</li>
 *   <li>Environment variables {@code WEBHOOK_URL} and {@code PORT}</li>
 * </ol>
 */
public final class AppConfig {
    private static final Logger logger = Logger.getLogger(AppConfig.class.getName());

    public static final String RESOURCE = "dispatchhub.properties";
    public static final int DEFAULT_HTTP_PORT = 8080;

    private final QueueConfig queueConfig;
    private final NotificationConfig notificationConfig;
    private final int httpPort;

    public AppConfig(QueueConfig queueConfig, NotificationConfig notificationConfig, int httpPort) {
        this.queueConfig = queueConfig;
        this.notificationConfig = notificationConfig;
        this.httpPort = httpPort;
    }

    /**
     * Load from the classpath resource, system properties and environment.
     */
    public static AppConfig load() {
        Properties fileProperties = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                fileProperties.load(in);
            } else {
                logger.info(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return fromSources(fileProperties, System.getProperties(), System.getenv());
    }

    /**
     * Merge explicit sources. Unknown keys are ignored; malformed numbers fail fast.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static AppConfig fromSources(Properties fileProperties, Properties overrides, Map<String, String> env) {
        Properties merged = new Properties();
        merged.putAll(fileProperties);
        for (String key : overrides.stringPropertyNames()) {
            if (key.startsWith("queue.") || key.startsWith("notify.") || key.startsWith("http.")) {
                merged.setProperty(key, overrides.getProperty(key));
            }
        }
        if (env.get("WEBHOOK_URL") != null) {
            merged.setProperty("notify.webhookUrl", env.get("WEBHOOK_URL"));
        }
        if (env.get("PORT") != null) {
            merged.setProperty("http.port", env.get("PORT"));
        }

        QueueConfig queue = new QueueConfig(
                intValue(merged, "queue.maxConcurrent", QueueConfig.DEFAULT_MAX_CONCURRENT),
                intValue(merged, "queue.retryAttempts", QueueConfig.DEFAULT_RETRY_ATTEMPTS),
                millisValue(merged, "queue.retryDelayMs", QueueConfig.DEFAULT_RETRY_DELAY),
                millisValue(merged, "queue.processIntervalMs", QueueConfig.DEFAULT_PROCESS_INTERVAL),
                intValue(merged, "queue.historyLimit", QueueConfig.DEFAULT_HISTORY_LIMIT));

        NotificationConfig notify = new NotificationConfig(
                merged.getProperty("notify.webhookUrl"),
                millisValue(merged, "notify.webhookTimeoutMs", NotificationConfig.DEFAULT_WEBHOOK_TIMEOUT),
                intValue(merged, "notify.deliveryThreads", NotificationConfig.DEFAULT_DELIVERY_THREADS));

        return new AppConfig(queue, notify, intValue(merged, "http.port", DEFAULT_HTTP_PORT));
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static Duration millisValue(Properties properties, String key, Duration defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + raw, e);
        }
    }

    public QueueConfig getQueueConfig() {
        return queueConfig;
    }

    public NotificationConfig getNotificationConfig() {
        return notificationConfig;
    }

    public int getHttpPort() {
        return httpPort;
    }
}
