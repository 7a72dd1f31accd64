package com.dispatchhub.notify.channel;

import com.dispatchhub.notify.Channel;
import com.dispatchhub.notify.ChannelKind;
import com.dispatchhub.notify.NotificationPayload;

import java.util.logging.Logger;

/**
 * Placeholder for channel kinds without a provider integration (push, email).
 * Logs the notification and always succeeds.
 */
public class UnimplementedDelivery implements ChannelDelivery {
    private static final Logger logger = Logger.getLogger(UnimplementedDelivery.class.getName());

    private final ChannelKind kind;

    public UnimplementedDelivery(ChannelKind kind) {
        this.kind = kind;
    }

    @Override
    public void deliver(Channel channel, NotificationPayload notification) {
        logger.fine("[" + kind.getWireName().toUpperCase() + "] delivery not implemented, skipping "
                + notification.getType() + " for channel " + channel.getId());
    }
}
