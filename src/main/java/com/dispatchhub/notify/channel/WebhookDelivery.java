package com.dispatchhub.notify.channel;

import com.dispatchhub.notify.Channel;
import com.dispatchhub.notify.ChannelDeliveryException;
import com.dispatchhub.notify.NotificationPayload;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Outbound HTTP POST of the notification as JSON to the channel's endpoint.
 *
 * <p><b>Request:</b></p>
 * <ul>
 *   <li>{@code Content-Type: application/json}</li>
 *   <li>{@code X-Notification-Type}: the notification type wire name</li>
 *   <li>{@code X-Notification-Priority}: low, normal or high</li>
 *   <li>Body: {@link NotificationPayload#toJson()}</li>
 * </ul>
 *
 * <p>Any 2xx status is success. Other statuses, malformed endpoints, timeouts and transport
 * errors are reported as {@link ChannelDeliveryException}. Connect and read timeouts are both
 * set to the configured webhook timeout so a hung endpoint cannot stall the drain loop forever.</p>
 */
public class WebhookDelivery implements ChannelDelivery {
    private static final Logger logger = Logger.getLogger(WebhookDelivery.class.getName());

    public static final String TYPE_HEADER = "X-Notification-Type";
    public static final String PRIORITY_HEADER = "X-Notification-Priority";

    private final int timeoutMillis;

    public WebhookDelivery(Duration timeout) {
        this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    }

    @Override
    public void deliver(Channel channel, NotificationPayload notification) throws ChannelDeliveryException {
        String endpoint = channel.getEndpoint();
        byte[] body = notification.toJson().toString().getBytes(StandardCharsets.UTF_8);

        HttpURLConnection connection = null;
        try {
            connection = (HttpURLConnection) URI.create(endpoint).toURL().openConnection();
            connection.setRequestMethod("POST");
            connection.setDoOutput(true);
            connection.setConnectTimeout(timeoutMillis);
            connection.setReadTimeout(timeoutMillis);
            connection.setRequestProperty("Content-Type", "application/json");
            connection.setRequestProperty(TYPE_HEADER, notification.getType().getWireName());
            connection.setRequestProperty(PRIORITY_HEADER, notification.getPriority() != null
                    ? notification.getPriority().getWireName() : "normal");
            connection.setFixedLengthStreamingMode(body.length);

            try (OutputStream os = connection.getOutputStream()) {
                os.write(body);
            }

            int status = connection.getResponseCode();
            consumeResponse(connection, status);
            if (status < 200 || status >= 300) {
                throw new ChannelDeliveryException(channel.getId(), "Webhook returned " + status, status);
            }

            logger.fine("Sent via webhook: " + notification.getType() + " -> " + endpoint);
        } catch (IOException | IllegalArgumentException e) {
            throw new ChannelDeliveryException(channel.getId(),
                    "Webhook delivery to " + endpoint + " failed: " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    // Read the response fully so the connection can be reused
    private static void consumeResponse(HttpURLConnection connection, int status) throws IOException {
        InputStream stream = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
        if (stream == null) {
            return;
        }
        try (InputStream in = stream) {
            in.readAllBytes();
        }
    }
}
