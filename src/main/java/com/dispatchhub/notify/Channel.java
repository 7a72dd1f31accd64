package com.dispatchhub.notify;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One configured notification delivery target.
 *
 * <p>A channel without filters receives every notification type. A channel with filters
 * receives only the listed types; an empty filter set therefore receives nothing.</p>
 */
public final class Channel {
    private final String id;
    private final ChannelKind kind;
    private final String endpoint;
    private final boolean enabled;
    private final Set<NotificationType> filters;

    /**
     * @param id unique channel id
     * @param kind delivery mechanism
     * @param endpoint target URL, required for webhook channels
     * @param enabled disabled channels are skipped during fan-out
     * @param filters accepted notification types, or null to accept all
     * @throws IllegalArgumentException if id is blank or a webhook channel has no endpoint
     */
    public Channel(String id, ChannelKind kind, String endpoint, boolean enabled, Set<NotificationType> filters) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Channel id must not be blank");
        }
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == ChannelKind.WEBHOOK && (endpoint == null || endpoint.isBlank())) {
            throw new IllegalArgumentException("Webhook channel " + id + " requires an endpoint");
        }
        this.id = id;
        this.endpoint = endpoint;
        this.enabled = enabled;
        this.filters = filters == null
                ? null
                : Collections.unmodifiableSet(filters.isEmpty()
                        ? EnumSet.noneOf(NotificationType.class)
                        : EnumSet.copyOf(filters));
    }

    public static Channel websocket(String id) {
        return new Channel(id, ChannelKind.WEBSOCKET, null, true, null);
    }

    public static Channel webhook(String id, String endpoint) {
        return new Channel(id, ChannelKind.WEBHOOK, endpoint, true, null);
    }

    public static Channel push(String id) {
        return new Channel(id, ChannelKind.PUSH, null, true, null);
    }

    public static Channel email(String id) {
        return new Channel(id, ChannelKind.EMAIL, null, true, null);
    }

    /**
     * Copy of this channel restricted to the given types.
     */
    public Channel withFilters(Set<NotificationType> types) {
        return new Channel(id, kind, endpoint, enabled, Objects.requireNonNull(types, "types"));
    }

    public Channel withEnabled(boolean enabled) {
        return new Channel(id, kind, endpoint, enabled, filters);
    }

    /**
     * Check whether this channel is enabled and accepts the notification type.
     */
    public boolean accepts(NotificationType type) {
        return enabled && (filters == null || filters.contains(type));
    }

    public String getId() {
        return id;
    }

    public ChannelKind getKind() {
        return kind;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the accepted types, or null when the channel accepts all types
     */
    public Set<NotificationType> getFilters() {
        return filters;
    }

    @Override
    public String toString() {
        return "Channel{id=" + id + ", kind=" + kind + ", enabled=" + enabled
                + (filters != null ? ", filters=" + filters : "") + "}";
    }
}
