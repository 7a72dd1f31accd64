package com.dispatchhub.notify;

import com.dispatchhub.core.Subscription;
import com.dispatchhub.notify.channel.ChannelDelivery;
import org.json.JSONObject;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for queueing, fan-out and failure isolation in {@link NotificationDispatcher}.
 */
public class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ChannelRegistry channels;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        channels = new ChannelRegistry();
        dispatcher = new NotificationDispatcher(channels, NotificationConfig.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    public void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    public void testFilteredChannelNeverInvokedForOtherTypes() throws Exception {
        List<NotificationPayload> websocket = Collections.synchronizedList(new ArrayList<>());
        dispatcher.onWebSocket(websocket::add);
        RecordingDelivery audit = new RecordingDelivery();
        dispatcher.registerStrategy(ChannelKind.PUSH, audit);

        dispatcher.addChannel(Channel.websocket("ws"));
        dispatcher.addChannel(Channel.push("audit").withFilters(Set.of(NotificationType.SESSION_DELETE)));

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_REQUEST, "t1", Map.of()))
                .get(5, TimeUnit.SECONDS);

        assertEquals(1, websocket.size());
        assertEquals(NotificationType.SESSION_REQUEST, websocket.get(0).getType());
        assertTrue(audit.received.isEmpty(), "audit channel filters out session_request");

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_DELETE, "t1", Map.of()))
                .get(5, TimeUnit.SECONDS);

        assertEquals(2, websocket.size());
        assertEquals(List.of("audit"), audit.channelIds());
    }

    @Test
    public void testDisabledChannelIsSkipped() throws Exception {
        RecordingDelivery push = new RecordingDelivery();
        dispatcher.registerStrategy(ChannelKind.PUSH, push);
        dispatcher.addChannel(Channel.push("mobile").withEnabled(false));

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.ERROR, "t1", null))
                .get(5, TimeUnit.SECONDS);

        assertTrue(push.received.isEmpty());
        assertEquals(0, dispatcher.getStats().getDeliveredCount());
    }

    @Test
    public void testChannelFailureDoesNotAffectOtherChannels() throws Exception {
        RecordingDelivery push = new RecordingDelivery();
        dispatcher.registerStrategy(ChannelKind.PUSH, push);
        dispatcher.registerStrategy(ChannelKind.EMAIL, (channel, notification) -> {
            throw new ChannelDeliveryException(channel.getId(), "SMTP down", 503);
        });
        dispatcher.registerStrategy(ChannelKind.WEBSOCKET, (channel, notification) -> {
            throw new IllegalStateException("socket closed");
        });

        dispatcher.addChannel(Channel.email("mail"));
        dispatcher.addChannel(Channel.websocket("ws"));
        dispatcher.addChannel(Channel.push("mobile"));

        CompletableFuture<Void> done = dispatcher.sendNotification(
                NotificationPayload.of(NotificationType.SESSION_PROPOSAL, "t1", Map.of("id", 1)));

        assertDoesNotThrow(() -> done.get(5, TimeUnit.SECONDS));
        assertFalse(done.isCompletedExceptionally());
        assertEquals(List.of("mobile"), push.channelIds());

        NotificationStats stats = dispatcher.getStats();
        assertEquals(1, stats.getDeliveredCount());
        assertEquals(2, stats.getFailedCount());
    }

    @Test
    public void testCompletionWaitsForSlowestChannel() throws Exception {
        AtomicBoolean slowFinished = new AtomicBoolean();
        dispatcher.registerStrategy(ChannelKind.PUSH, (channel, notification) -> {
            sleep(200);
            slowFinished.set(true);
        });
        dispatcher.addChannel(Channel.websocket("ws"));
        dispatcher.addChannel(Channel.push("slow"));

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_UPDATE, "t1", null))
                .get(5, TimeUnit.SECONDS);

        assertTrue(slowFinished.get(), "Completion must wait for every channel to settle");
    }

    @Test
    public void testChannelsOfOneNotificationAreDeliveredConcurrently() throws Exception {
        // Each delivery waits for the other one; serial fan-out would time out both
        CountDownLatch bothInFlight = new CountDownLatch(2);
        dispatcher.registerStrategy(ChannelKind.PUSH, (channel, notification) -> {
            bothInFlight.countDown();
            try {
                if (!bothInFlight.await(2, TimeUnit.SECONDS)) {
                    throw new ChannelDeliveryException(channel.getId(), "other channel never started", -1);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChannelDeliveryException(channel.getId(), "interrupted", e);
            }
        });
        dispatcher.addChannel(Channel.push("mobile-a"));
        dispatcher.addChannel(Channel.push("mobile-b"));

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_REQUEST, "t1", null))
                .get(5, TimeUnit.SECONDS);

        NotificationStats stats = dispatcher.getStats();
        assertEquals(2, stats.getDeliveredCount(), "Both channels must be in flight at the same time");
        assertEquals(0, stats.getFailedCount());
    }

    @Test
    public void testNotificationsAreDeliveredOneAtATimeInOrder() throws Exception {
        List<String> trace = Collections.synchronizedList(new ArrayList<>());
        dispatcher.registerStrategy(ChannelKind.PUSH, (channel, notification) -> {
            trace.add("start:" + notification.getTopic());
            sleep(30);
            trace.add("end:" + notification.getTopic());
        });
        dispatcher.addChannel(Channel.push("mobile"));

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (String topic : List.of("a", "b", "c")) {
            futures.add(dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_REQUEST, topic, null)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("start:a", "end:a", "start:b", "end:b", "start:c", "end:c"), trace);
    }

    @Test
    public void testDefaultsAreStampedBeforeSubscribersSeeNotification() {
        List<NotificationPayload> seen = new ArrayList<>();
        dispatcher.subscribe(EnumSet.allOf(NotificationType.class), seen::add);

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.CONNECTION_UPDATE, "t1", null));

        assertEquals(1, seen.size(), "Subscribers run synchronously at enqueue");
        assertEquals(NOW, seen.get(0).getTimestamp());
        assertEquals(NotificationPriority.NORMAL, seen.get(0).getPriority());
    }

    @Test
    public void testSubscribeFiltersByTypeAndUnsubscribes() {
        List<NotificationType> seen = new ArrayList<>();
        Subscription subscription = dispatcher.subscribe(Set.of(NotificationType.SESSION_DELETE),
                notification -> seen.add(notification.getType()));

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_REQUEST, "t1", null));
        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_DELETE, "t1", null));
        subscription.unsubscribe();
        dispatcher.sendNotification(NotificationPayload.of(NotificationType.SESSION_DELETE, "t2", null));

        assertEquals(List.of(NotificationType.SESSION_DELETE), seen);
    }

    @Test
    public void testSubscribersNotifiedEvenWithoutChannels() throws Exception {
        List<NotificationPayload> seen = new ArrayList<>();
        dispatcher.subscribe(Set.of(NotificationType.ERROR), seen::add);

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.ERROR, "t1", Map.of("reason", "x")))
                .get(5, TimeUnit.SECONDS);

        assertEquals(1, seen.size());
    }

    @Test
    public void testClearQueueDiscardsPendingNotifications() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        dispatcher.registerStrategy(ChannelKind.PUSH, (channel, notification) -> {
            firstStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.add(notification.getTopic());
        });
        dispatcher.addChannel(Channel.push("mobile"));

        CompletableFuture<Void> first = dispatcher.sendNotification(
                NotificationPayload.of(NotificationType.SESSION_REQUEST, "first", null));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        CompletableFuture<Void> second = dispatcher.sendNotification(
                NotificationPayload.of(NotificationType.SESSION_REQUEST, "second", null));
        CompletableFuture<Void> third = dispatcher.sendNotification(
                NotificationPayload.of(NotificationType.SESSION_REQUEST, "third", null));
        assertEquals(2, dispatcher.getStats().getQueueSize());

        dispatcher.clearQueue();

        assertEquals(0, dispatcher.getStats().getQueueSize());
        assertTrue(second.isDone() && !second.isCompletedExceptionally());
        assertTrue(third.isDone() && !third.isCompletedExceptionally());

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("first"), delivered, "In-flight delivery finishes, cleared ones never start");
    }

    @Test
    public void testInstallDefaultChannels() {
        dispatcher.installDefaultChannels();
        List<Channel> installed = channels.all();
        assertEquals(1, installed.size());
        assertEquals("websocket", installed.get(0).getId());
        assertEquals(ChannelKind.WEBSOCKET, installed.get(0).getKind());

        NotificationDispatcher withWebhook = new NotificationDispatcher(new ChannelRegistry(),
                new NotificationConfig("http://localhost:9/hook", Duration.ofSeconds(1), 1));
        try {
            withWebhook.installDefaultChannels();
            NotificationStats stats = withWebhook.getStats();
            assertEquals(2, stats.getChannels().size());
            assertEquals("http://localhost:9/hook", stats.getChannels().get(1).getEndpoint());
        } finally {
            withWebhook.shutdown();
        }
    }

    @Test
    public void testRemoveChannelStopsDelivery() throws Exception {
        RecordingDelivery push = new RecordingDelivery();
        dispatcher.registerStrategy(ChannelKind.PUSH, push);
        dispatcher.addChannel(Channel.push("mobile"));
        dispatcher.removeChannel("mobile");

        dispatcher.sendNotification(NotificationPayload.of(NotificationType.ERROR, "t1", null))
                .get(5, TimeUnit.SECONDS);

        assertTrue(push.received.isEmpty());
    }

    @Test
    public void testStatsJson() {
        dispatcher.addChannel(Channel.websocket("ws"));
        JSONObject json = dispatcher.getStats().toJson();
        assertEquals("ws", json.getJSONArray("channels").getJSONObject(0).getString("id"));
        assertEquals("websocket", json.getJSONArray("channels").getJSONObject(0).getString("type"));
        assertTrue(json.has("queueSize"));
    }

    @Test
    public void testNotificationRacingWithShutdownStillSettles() throws Exception {
        CountDownLatch stamping = new CountDownLatch(1);
        CountDownLatch shutdownDone = new CountDownLatch(1);
        Clock blockingClock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                stamping.countDown();
                try {
                    shutdownDone.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return NOW;
            }
        };
        NotificationDispatcher racing = new NotificationDispatcher(new ChannelRegistry(),
                NotificationConfig.defaults(), blockingClock);
        racing.addChannel(Channel.websocket("ws"));

        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            // The producer passes the shutdown check, then stalls while stamping the timestamp
            Future<CompletableFuture<Void>> sent = producer.submit(() -> racing.sendNotification(
                    NotificationPayload.of(NotificationType.SESSION_UPDATE, "t1", null)));
            assertTrue(stamping.await(5, TimeUnit.SECONDS));

            racing.shutdown();
            shutdownDone.countDown();

            CompletableFuture<Void> completion = sent.get(5, TimeUnit.SECONDS);
            assertDoesNotThrow(() -> completion.get(5, TimeUnit.SECONDS));
            assertEquals(0, racing.getStats().getQueueSize(), "Nothing may be left behind in the queue");
        } finally {
            shutdownDone.countDown();
            producer.shutdownNow();
            racing.shutdown();
        }
    }

    @Test
    public void testRejectsNullAndPostShutdownSends() {
        assertThrows(NullPointerException.class, () -> dispatcher.sendNotification(null));

        dispatcher.shutdown();
        assertThrows(IllegalStateException.class, () -> dispatcher.sendNotification(
                NotificationPayload.of(NotificationType.ERROR, "t1", null)));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class RecordingDelivery implements ChannelDelivery {
        final List<Channel> received = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void deliver(Channel channel, NotificationPayload notification) {
            received.add(channel);
        }

        List<String> channelIds() {
            List<String> ids = new ArrayList<>();
            synchronized (received) {
                for (Channel channel : received) {
                    ids.add(channel.getId());
                }
            }
            return ids;
        }
    }
}
