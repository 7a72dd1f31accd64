package com.dispatchhub.notify.channel;

import com.dispatchhub.notify.Channel;
import com.dispatchhub.notify.ChannelDeliveryException;
import com.dispatchhub.notify.NotificationPayload;

/**
 * Pluggable delivery strategy for one channel kind.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance serves every channel of its kind
 *       and is called concurrently during fan-out.</li>
 *   <li>Returning normally means the channel accepted the notification. Any failure is
 *       reported as a {@link ChannelDeliveryException}.</li>
 * </ul>
 */
@FunctionalInterface
public interface ChannelDelivery {

    /**
     * Deliver a notification to one channel.
     *
     * @param channel the target channel
     * @param notification the notification, with timestamp and priority already stamped
     * @throws ChannelDeliveryException if the channel did not accept the notification
     */
    void deliver(Channel channel, NotificationPayload notification) throws ChannelDeliveryException;
}
