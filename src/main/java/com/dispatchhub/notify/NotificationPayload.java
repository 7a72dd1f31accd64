package com.dispatchhub.notify;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.json.JSONObject;

/**
 * Immutable notification handed to the dispatcher.
 *
 * <p>{@code timestamp} and {@code priority} are optional on input; the dispatcher fills them
 * in with the enqueue time and {@link NotificationPriority#NORMAL} before queueing.</p>
 */
public final class NotificationPayload {
    private final NotificationType type;
    private final String topic;
    private final Map<String, Object> data;
    private final Instant timestamp;
    private final NotificationPriority priority;

    /**
     * @param type notification kind, required
     * @param topic topic the notification concerns (e.g. a session topic), required
     * @param data arbitrary JSON-compatible data, may be null (treated as empty)
     * @param timestamp creation time, or null to stamp at enqueue
     * @param priority delivery priority, or null for NORMAL
     * @throws NullPointerException if type or topic is null
     */
    public NotificationPayload(NotificationType type, String topic, Map<String, Object> data,
                               Instant timestamp, NotificationPriority priority) {
        this.type = Objects.requireNonNull(type, "type");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.timestamp = timestamp;
        this.priority = priority;
    }

    public static NotificationPayload of(NotificationType type, String topic, Map<String, Object> data) {
        return new NotificationPayload(type, topic, data, null, null);
    }

    /**
     * Return a copy with a missing timestamp set to {@code now} and a missing priority set to NORMAL.
     */
    public NotificationPayload withDefaults(Instant now) {
        if (timestamp != null && priority != null) {
            return this;
        }
        return new NotificationPayload(type, topic, data,
                timestamp != null ? timestamp : now,
                priority != null ? priority : NotificationPriority.NORMAL);
    }

    public NotificationType getType() {
        return type;
    }

    public String getTopic() {
        return topic;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * @return the timestamp, or null before defaults are applied
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the priority, or null before defaults are applied
     */
    public NotificationPriority getPriority() {
        return priority;
    }

    /**
     * JSON body for outbound delivery: {@code type}, {@code topic}, {@code data},
     * {@code timestamp} (epoch millis) and {@code priority}.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("type", type.getWireName());
        json.put("topic", topic);
        json.put("data", new JSONObject(data));
        if (timestamp != null) {
            json.put("timestamp", timestamp.toEpochMilli());
        }
        json.put("priority", (priority != null ? priority : NotificationPriority.NORMAL).getWireName());
        return json;
    }

    @Override
    public String toString() {
        return "NotificationPayload{type=" + type + ", topic=" + topic + ", priority=" + priority + "}";
    }
}
