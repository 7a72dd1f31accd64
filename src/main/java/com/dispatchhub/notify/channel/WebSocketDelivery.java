package com.dispatchhub.notify.channel;

import com.dispatchhub.core.ListenerRegistry;
import com.dispatchhub.notify.Channel;
import com.dispatchhub.notify.NotificationPayload;

import java.util.logging.Logger;

/**
 * Local real-time fan-out: publishes the notification to in-process websocket listeners.
 * Performs no network I/O and always succeeds.
 */
public class WebSocketDelivery implements ChannelDelivery {
    private static final Logger logger = Logger.getLogger(WebSocketDelivery.class.getName());

    private final ListenerRegistry<NotificationPayload> websocketListeners;

    public WebSocketDelivery(ListenerRegistry<NotificationPayload> websocketListeners) {
        this.websocketListeners = websocketListeners;
    }

    @Override
    public void deliver(Channel channel, NotificationPayload notification) {
        websocketListeners.publish(notification);
        logger.fine("Sent via WebSocket: " + notification.getType() + " (channel: " + channel.getId() + ")");
    }
}
