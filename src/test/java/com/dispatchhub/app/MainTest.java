package com.dispatchhub.app;

import com.dispatchhub.core.Job;
import com.dispatchhub.core.JobEvent;
import com.dispatchhub.core.JobStatus;
import com.dispatchhub.core.QueueConfig;
import com.dispatchhub.engine.JobQueueScheduler;
import com.dispatchhub.engine.ProcessorRegistry;
import com.dispatchhub.notify.ChannelDeliveryException;
import com.dispatchhub.notify.ChannelKind;
import com.dispatchhub.notify.ChannelRegistry;
import com.dispatchhub.notify.NotificationConfig;
import com.dispatchhub.notify.NotificationDispatcher;
import com.dispatchhub.notify.NotificationPayload;
import com.dispatchhub.notify.NotificationType;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: notification jobs flow from the scheduler through the dispatcher.
 */
public class MainTest {

    private JobQueueScheduler scheduler;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        dispatcher = new NotificationDispatcher(new ChannelRegistry(), NotificationConfig.defaults());
        dispatcher.installDefaultChannels();
        scheduler = new JobQueueScheduler(
                new QueueConfig(2, 2, Duration.ofMillis(20), Duration.ofMillis(10), 100),
                new ProcessorRegistry());
        Main.registerProcessors(scheduler, dispatcher);
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdown(Duration.ofSeconds(5));
        dispatcher.shutdown();
    }

    @Test
    public void testNotificationJobIsDeliveredToWebSocket() throws Exception {
        List<NotificationPayload> pushed = Collections.synchronizedList(new ArrayList<>());
        dispatcher.onWebSocket(pushed::add);
        CountDownLatch completed = new CountDownLatch(1);
        scheduler.on(JobEvent.COMPLETED, job -> completed.countDown());

        String payload = Job.toPayload(new Main.NotificationJobData("session_update", "topic-7",
                Map.of("accounts", List.of("0xabc"))));
        scheduler.addJob(Main.NOTIFICATION_JOB, payload);
        scheduler.start();

        assertTrue(completed.await(5, TimeUnit.SECONDS), "Notification job should complete");
        assertEquals(1, pushed.size(), "Job completes only after delivery settled");
        assertEquals(NotificationType.SESSION_UPDATE, pushed.get(0).getType());
        assertEquals("topic-7", pushed.get(0).getTopic());
        assertEquals(List.of("0xabc"), pushed.get(0).getData().get("accounts"));
    }

    @Test
    public void testChannelFailuresDoNotFailNotificationJob() throws Exception {
        dispatcher.registerStrategy(ChannelKind.WEBSOCKET, (channel, notification) -> {
            throw new ChannelDeliveryException(channel.getId(), "socket closed", -1);
        });
        List<Job> retries = Collections.synchronizedList(new ArrayList<>());
        scheduler.on(JobEvent.RETRYING, retries::add);

        String id = scheduler.addJob(Main.NOTIFICATION_JOB,
                Job.toPayload(new Main.NotificationJobData("session_delete", "topic-3", null)));
        scheduler.start();

        assertTrue(waitForStatus(id, JobStatus.COMPLETED), "Delivery failures are isolated by the dispatcher");
        Job job = scheduler.getJobStatus(id).orElseThrow();
        assertEquals(1, job.getAttempts());
        assertTrue(retries.isEmpty());
        assertEquals(1, dispatcher.getStats().getFailedCount());
    }

    @Test
    public void testNotificationJobFailsOnceDispatcherIsShutDown() throws Exception {
        dispatcher.shutdown();

        String id = scheduler.addJob(Main.NOTIFICATION_JOB,
                Job.toPayload(new Main.NotificationJobData("session_update", "topic-4", null)));
        scheduler.start();

        assertTrue(waitForStatus(id, JobStatus.FAILED));
        assertEquals("Notification dispatcher has been shut down", scheduler.getJobStatus(id).orElseThrow().getError());
    }

    @Test
    public void testInvalidNotificationJobFailsAfterRetries() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        List<Job> failures = Collections.synchronizedList(new ArrayList<>());
        scheduler.on(JobEvent.FAILED, job -> {
            failures.add(job);
            failed.countDown();
        });

        String id = scheduler.addJob(Main.NOTIFICATION_JOB,
                Job.toPayload(new Main.NotificationJobData("session_ping", "t", null)));
        scheduler.start();

        assertTrue(failed.await(5, TimeUnit.SECONDS));
        Job job = scheduler.getJobStatus(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(2, job.getAttempts());
        assertEquals("Unknown notification type: session_ping", job.getError());
    }

    private boolean waitForStatus(String id, JobStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (scheduler.getJobStatus(id).map(Job::getStatus).orElse(null) == expected) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }
}
