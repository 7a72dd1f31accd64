package com.dispatchhub.notify;

/**
 * The fixed set of notification kinds. Each constant has a wire name used in JSON bodies,
 * webhook headers and inbound session events.
 */
public enum NotificationType {
    SESSION_PROPOSAL("session_proposal"),
    SESSION_REQUEST("session_request"),
    SESSION_UPDATE("session_update"),
    SESSION_DELETE("session_delete"),
    SESSION_EXPIRE("session_expire"),
    CONNECTION_UPDATE("connection_update"),
    ERROR("error");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve a wire name such as {@code session_request}.
     *
     * @return the matching type, or null if the name is unknown
     */
    public static NotificationType fromWireName(String name) {
        for (NotificationType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
