package com.dispatchhub.notify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Mapping of channel id to channel configuration. Adding a channel with an existing id
 * replaces it (last write wins). Iteration follows first registration order.
 */
public class ChannelRegistry {
    private static final Logger logger = Logger.getLogger(ChannelRegistry.class.getName());

    private final Map<String, Channel> channels = new LinkedHashMap<>();

    public synchronized void add(Channel channel) {
        if (channel == null) {
            throw new NullPointerException("channel");
        }
        channels.put(channel.getId(), channel);
        logger.info("Notification channel added: " + channel.getId() + " (" + channel.getKind() + ")");
    }

    /**
     * @return true if a channel with the id existed
     */
    public synchronized boolean remove(String channelId) {
        boolean removed = channels.remove(channelId) != null;
        logger.info("Notification channel removed: " + channelId);
        return removed;
    }

    /**
     * Channels that are enabled and whose filters accept the type, in registration order.
     */
    public synchronized List<Channel> matching(NotificationType type) {
        List<Channel> result = new ArrayList<>();
        for (Channel channel : channels.values()) {
            if (channel.accepts(type)) {
                result.add(channel);
            }
        }
        return result;
    }

    public synchronized List<Channel> all() {
        return new ArrayList<>(channels.values());
    }
}
