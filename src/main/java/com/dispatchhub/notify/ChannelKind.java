package com.dispatchhub.notify;

/**
 * Delivery mechanism of a channel. Each kind maps to one delivery strategy in the dispatcher.
 */
public enum ChannelKind {
    WEBSOCKET("websocket"),
    WEBHOOK("webhook"),
    PUSH("push"),
    EMAIL("email");

    private final String wireName;

    ChannelKind(String wireName) {
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
