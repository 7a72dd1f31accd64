package com.dispatchhub.notify;

import com.dispatchhub.core.ListenerRegistry;
import com.dispatchhub.core.Subscription;
import com.dispatchhub.notify.channel.ChannelDelivery;
import com.dispatchhub.notify.channel.UnimplementedDelivery;
import com.dispatchhub.notify.channel.WebSocketDelivery;
import com.dispatchhub.notify.channel.WebhookDelivery;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queues notifications and fans each one out to every matching channel.
 *
 * <p><b>Drain Algorithm:</b></p>
 * <ul>
 *   <li>Single-flight: one drain task runs at a time, guarded by an atomic flag</li>
 *   <li>Notifications leave the FIFO queue one by one; each is fully delivered before the next is taken</li>
 *   <li>Delivery of one notification runs concurrently on every enabled channel whose filters accept its type</li>
 *   <li>Settle-all: a channel failure is logged and counted, never aborts the other channels,
 *       and the notification completes only when every attempted channel has settled</li>
 * </ul>
 *
 * <p><b>Events:</b> subscribers registered with {@link #subscribe(Set, Consumer)} are told about
 * every accepted notification at enqueue time, regardless of delivery outcome. Listeners
 * registered with {@link #onWebSocket(Consumer)} receive notifications routed to websocket channels.</p>
 *
 * <p><b>Thread Safety:</b> producers may call {@link #sendNotification} from any thread. The drain
 * runs on its own thread; channel deliveries run on a fixed delivery pool.</p>
 *
 * <p><b>Shutdown:</b> every future returned by {@link #sendNotification} settles, including
 * those of notifications that race with {@link #shutdown()}; undelivered ones complete
 * normally without any channel being attempted.</p>
 *
 * @author Dispatch Hub Team
 * @see ChannelDelivery
 * @see ChannelRegistry
 */
public class NotificationDispatcher {
    private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final ChannelRegistry channels;
    private final NotificationConfig config;
    private final Clock clock;
    private final Map<ChannelKind, ChannelDelivery> strategies = new ConcurrentHashMap<>();
    private final ExecutorService drainExecutor;
    private final ExecutorService deliveryPool;

    private final Queue<QueuedNotification> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private final ListenerRegistry<NotificationPayload> notificationListeners = new ListenerRegistry<>("notification");
    private final ListenerRegistry<NotificationPayload> websocketListeners = new ListenerRegistry<>("websocket");

    public NotificationDispatcher(ChannelRegistry channels, NotificationConfig config) {
        this(channels, config, Clock.systemUTC());
    }

    /**
     * Create a dispatcher with the built-in strategy for every channel kind.
     *
     * @param channels registry consulted for every notification
     * @param config webhook timeout and delivery pool size
     * @param clock time source for default timestamps
     */
    public NotificationDispatcher(ChannelRegistry channels, NotificationConfig config, Clock clock) {
        this.channels = channels;
        this.config = config;
        this.clock = clock;
        this.drainExecutor = Executors.newSingleThreadExecutor(daemonThreads("notification-drain"));
        this.deliveryPool = Executors.newFixedThreadPool(config.getDeliveryThreads(),
                daemonThreads("notification-delivery"));

        strategies.put(ChannelKind.WEBSOCKET, new WebSocketDelivery(websocketListeners));
        strategies.put(ChannelKind.WEBHOOK, new WebhookDelivery(config.getWebhookTimeout()));
        strategies.put(ChannelKind.PUSH, new UnimplementedDelivery(ChannelKind.PUSH));
        strategies.put(ChannelKind.EMAIL, new UnimplementedDelivery(ChannelKind.EMAIL));
    }

    /**
     * Register the default channels: {@code websocket} always, {@code webhook} when a
     * webhook URL is configured.
     */
    public void installDefaultChannels() {
        addChannel(Channel.websocket("websocket"));
        if (config.getWebhookUrl() != null) {
            addChannel(Channel.webhook("webhook", config.getWebhookUrl()));
        }
    }

    /**
     * Replace the delivery strategy used for a channel kind.
     */
    public void registerStrategy(ChannelKind kind, ChannelDelivery delivery) {
        if (kind == null || delivery == null) {
            throw new NullPointerException("kind and delivery are required");
        }
        strategies.put(kind, delivery);
    }

    public void addChannel(Channel channel) {
        channels.add(channel);
    }

    public void removeChannel(String channelId) {
        channels.remove(channelId);
    }

    /**
     * Queue a notification for delivery.
     *
     * <p>A missing timestamp is set to now and a missing priority to NORMAL. Subscribers are
     * notified synchronously before this method returns.</p>
     *
     * @param payload the notification
     * @return completes once delivery has been attempted on every matching enabled channel;
     *         channel failures do not complete it exceptionally
     * @throws NullPointerException if payload is null
     * @throws IllegalStateException if the dispatcher has been shut down
     */
    public CompletableFuture<Void> sendNotification(NotificationPayload payload) {
        if (payload == null) {
            throw new NullPointerException("payload");
        }
        if (shutdown.get()) {
            throw new IllegalStateException("Notification dispatcher has been shut down");
        }

        NotificationPayload stamped = payload.withDefaults(clock.instant());
        QueuedNotification entry = new QueuedNotification(stamped);
        queue.add(entry);
        if (shutdown.get()) {
            // shutdown() may already have cleared the queue; nobody else will settle this entry
            if (queue.remove(entry)) {
                logger.warning("Notification " + stamped.getType() + " accepted during shutdown, discarded");
                entry.completion.complete(null);
            }
            return entry.completion;
        }
        logger.fine("Sending notification " + stamped.getType() + " for topic " + stamped.getTopic());

        notificationListeners.publish(stamped);
        scheduleDrain();
        return entry.completion;
    }

    /**
     * Listen for accepted notifications of the given types.
     *
     * @return subscription that removes the listener
     */
    public Subscription subscribe(Set<NotificationType> types, Consumer<NotificationPayload> callback) {
        if (types == null || callback == null) {
            throw new NullPointerException("types and callback are required");
        }
        Set<NotificationType> accepted = types.isEmpty()
                ? EnumSet.noneOf(NotificationType.class)
                : EnumSet.copyOf(types);
        return notificationListeners.subscribe(notification -> {
            if (accepted.contains(notification.getType())) {
                callback.accept(notification);
            }
        });
    }

    /**
     * Listen for notifications delivered through websocket channels.
     */
    public Subscription onWebSocket(Consumer<NotificationPayload> listener) {
        return websocketListeners.subscribe(listener);
    }

    public NotificationStats getStats() {
        return new NotificationStats(queue.size(), channels.all(), draining.get(),
                deliveredCount.get(), failedCount.get());
    }

    /**
     * Discard every queued notification that has not started delivery. Their futures
     * complete normally without any channel being attempted.
     */
    public void clearQueue() {
        int cleared = 0;
        QueuedNotification entry;
        while ((entry = queue.poll()) != null) {
            entry.completion.complete(null);
            cleared++;
        }
        logger.info("Notification queue cleared (" + cleared + " notifications discarded)");
    }

    /**
     * Stop accepting notifications, let the drain finish, then release the delivery threads.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down notification dispatcher...");

        drainExecutor.shutdown();
        try {
            if (!drainExecutor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Notification drain did not finish, forcing shutdown");
                drainExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            drainExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        deliveryPool.shutdownNow();
        clearQueue();

        logger.info("Notification dispatcher shutdown complete");
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            drainExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            logger.log(Level.WARNING, "Drain rejected, dispatcher is shutting down", e);
            clearQueue();
        }
    }

    private void drain() {
        try {
            QueuedNotification next;
            while ((next = queue.poll()) != null) {
                try {
                    deliver(next.payload);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to deliver notification " + next.payload.getType(), e);
                } finally {
                    next.completion.complete(null);
                }
            }
        } finally {
            draining.set(false);
        }
        // A producer may have enqueued between the last poll and clearing the flag
        if (!queue.isEmpty() && !shutdown.get()) {
            scheduleDrain();
        }
    }

    private void deliver(NotificationPayload notification) {
        List<Channel> targets = channels.matching(notification.getType());
        if (targets.isEmpty()) {
            logger.fine("No channel accepts " + notification.getType() + ", nothing to deliver");
            return;
        }

        CompletableFuture<?>[] attempts = new CompletableFuture<?>[targets.size()];
        for (int i = 0; i < targets.size(); i++) {
            Channel channel = targets.get(i);
            try {
                attempts[i] = CompletableFuture.runAsync(() -> deliverToChannel(channel, notification), deliveryPool);
            } catch (RejectedExecutionException e) {
                recordFailure(channel, e);
                attempts[i] = CompletableFuture.completedFuture(null);
            }
        }
        CompletableFuture.allOf(attempts).join();
    }

    // Never throws: every outcome is settled here so allOf waits for all channels
    private void deliverToChannel(Channel channel, NotificationPayload notification) {
        ChannelDelivery delivery = strategies.get(channel.getKind());
        if (delivery == null) {
            logger.warning("Unknown channel type " + channel.getKind() + " for channel " + channel.getId());
            return;
        }
        try {
            delivery.deliver(channel, notification);
            deliveredCount.incrementAndGet();
        } catch (ChannelDeliveryException | RuntimeException e) {
            recordFailure(channel, e);
        }
    }

    private void recordFailure(Channel channel, Exception e) {
        failedCount.incrementAndGet();
        logger.log(Level.SEVERE, "Failed to deliver to channel " + channel.getId(), e);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class QueuedNotification {
        private final NotificationPayload payload;
        private final CompletableFuture<Void> completion = new CompletableFuture<>();

        private QueuedNotification(NotificationPayload payload) {
            this.payload = payload;
        }
    }
}
