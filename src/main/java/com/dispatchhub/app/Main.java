package com.dispatchhub.app;

import com.dispatchhub.core.Job;
import com.dispatchhub.core.JobEvent;
import com.dispatchhub.engine.JobQueueScheduler;
import com.dispatchhub.engine.ProcessorRegistry;
import com.dispatchhub.notify.ChannelRegistry;
import com.dispatchhub.notify.NotificationDispatcher;
import com.dispatchhub.notify.NotificationPayload;
import com.dispatchhub.notify.NotificationType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main application entry point.
 * Wires the scheduler, the notification dispatcher and the HTTP API, then waits for shutdown.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    /** Job type whose payload is a notification to deliver with retries. */
    public static final String NOTIFICATION_JOB = "notification";

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Dispatch Hub Starting ===");

        try {
            AppConfig config = AppConfig.load();

            // 1. Notification dispatcher with default channels
            NotificationDispatcher dispatcher = new NotificationDispatcher(new ChannelRegistry(),
                    config.getNotificationConfig());
            dispatcher.installDefaultChannels();

            // 2. Scheduler and processors
            JobQueueScheduler scheduler = new JobQueueScheduler(config.getQueueConfig(), new ProcessorRegistry());
            registerProcessors(scheduler, dispatcher);
            scheduler.on(JobEvent.FAILED, job ->
                    logger.warning("Job " + job.getId() + " (" + job.getType() + ") failed: " + job.getError()));
            scheduler.start();

            // 3. HTTP API
            HttpApiServer httpServer = new HttpApiServer(scheduler, dispatcher,
                    new SessionEventRelay(dispatcher), config.getHttpPort());
            httpServer.start();

            // 4. Shutdown hook for graceful shutdown
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("=== Shutdown signal received ===");
                httpServer.stop();
                scheduler.shutdown();
                dispatcher.shutdown();
                stopped.countDown();
            }, "Shutdown-Hook"));

            logger.info("=== Dispatch Hub is running on port " + httpServer.getPort() + " ===");
            stopped.await();

        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    /**
     * Register the built-in job processors.
     *
     * <p>{@value #NOTIFICATION_JOB} jobs carry a {@link NotificationJobData} payload and hand it
     * to the dispatcher, completing once every matching channel has settled. Channel failures
     * are isolated and counted by the dispatcher and never fail the job, so they are not
     * retried. An attempt fails only when the payload names no known notification type or
     * topic, or when the dispatcher has been shut down.</p>
     */
    static void registerProcessors(JobQueueScheduler scheduler, NotificationDispatcher dispatcher) {
        scheduler.registerProcessor(NOTIFICATION_JOB, job -> {
            NotificationJobData data = job.payloadAs(NotificationJobData.class);
            if (data == null || data.type == null || data.topic == null) {
                throw new IllegalArgumentException("Notification job " + job.getId() + " has no type or topic");
            }
            NotificationType type = NotificationType.fromWireName(data.type);
            if (type == null) {
                throw new IllegalArgumentException("Unknown notification type: " + data.type);
            }
            dispatcher.sendNotification(NotificationPayload.of(type, data.topic, data.data)).join();
        });
    }

    /**
     * Payload of a {@value #NOTIFICATION_JOB} job, encoded with {@link Job#toPayload(Object)}.
     */
    public static class NotificationJobData {
        public String type;
        public String topic;
        public Map<String, Object> data;

        public NotificationJobData() {}

        public NotificationJobData(String type, String topic, Map<String, Object> data) {
            this.type = type;
            this.topic = topic;
            this.data = data;
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load logging.properties, using JVM defaults", e);
        }
    }
}
