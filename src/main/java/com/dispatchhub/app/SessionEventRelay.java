package com.dispatchhub.app;

import com.dispatchhub.notify.NotificationDispatcher;
import com.dispatchhub.notify.NotificationPayload;
import com.dispatchhub.notify.NotificationType;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

import org.json.JSONObject;

/**
 * Turns inbound session webhook events into notifications.
 *
 * <p>Event mapping:</p>
 * <ul>
 *   <li>session_proposal, session_request, session_update → notification of the same type, data = {@code params}</li>
 *   <li>session_delete → notification with empty data</li>
 *   <li>session_ping → acknowledged, no notification</li>
 *   <li>anything else → logged and ignored</li>
 * </ul>
 */
public class SessionEventRelay {
    private static final Logger logger = Logger.getLogger(SessionEventRelay.class.getName());

    private final NotificationDispatcher dispatcher;

    public SessionEventRelay(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Relay one event.
     *
     * @param event the parsed webhook body; must contain {@code type} and, except for
     *              unknown types, {@code topic}
     * @return completion of the resulting notification's delivery, or an already completed
     *         future when the event produces no notification
     * @throws IllegalArgumentException if {@code type} or a required {@code topic} is missing
     */
    public CompletableFuture<Void> relay(JSONObject event) {
        String type = event.optString("type", null);
        if (type == null) {
            throw new IllegalArgumentException("Webhook event has no type");
        }
        logger.info("Received webhook event: " + type);

        switch (type) {
            case "session_proposal":
            case "session_request":
            case "session_update":
                return forward(NotificationType.fromWireName(type), requireTopic(event), paramsOf(event));
            case "session_delete":
                return forward(NotificationType.SESSION_DELETE, requireTopic(event), Collections.emptyMap());
            case "session_ping":
                logger.fine("Session ping for topic " + requireTopic(event));
                return CompletableFuture.completedFuture(null);
            default:
                logger.warning("Unknown webhook type: " + type);
                return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> forward(NotificationType type, String topic, Map<String, Object> data) {
        logger.info("Processing " + type + " for topic " + topic);
        return dispatcher.sendNotification(NotificationPayload.of(type, topic, data));
    }

    private static String requireTopic(JSONObject event) {
        String topic = event.optString("topic", null);
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Webhook event has no topic");
        }
        return topic;
    }

    private static Map<String, Object> paramsOf(JSONObject event) {
        JSONObject params = event.optJSONObject("params");
        return params != null ? params.toMap() : Collections.emptyMap();
    }
}
