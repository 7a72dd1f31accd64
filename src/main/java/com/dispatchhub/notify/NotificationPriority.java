package com.dispatchhub.notify;

/**
 * Delivery priority carried in the payload and the {@code X-Notification-Priority} header.
 */
public enum NotificationPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high");

    private final String wireName;

    NotificationPriority(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
