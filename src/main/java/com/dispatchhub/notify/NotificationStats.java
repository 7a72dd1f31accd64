package com.dispatchhub.notify;

import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Point-in-time view of the dispatcher: queue depth, channel summary, drain flag and
 * cumulative per-channel delivery outcomes.
 */
public final class NotificationStats {
    private final int queueSize;
    private final List<Channel> channels;
    private final boolean draining;
    private final long deliveredCount;
    private final long failedCount;

    public NotificationStats(int queueSize, List<Channel> channels, boolean draining,
                             long deliveredCount, long failedCount) {
        this.queueSize = queueSize;
        this.channels = List.copyOf(channels);
        this.draining = draining;
        this.deliveredCount = deliveredCount;
        this.failedCount = failedCount;
    }

    public int getQueueSize() {
        return queueSize;
    }

    public List<Channel> getChannels() {
        return channels;
    }

    public boolean isDraining() {
        return draining;
    }

    /**
     * @return channel deliveries that settled successfully
     */
    public long getDeliveredCount() {
        return deliveredCount;
    }

    /**
     * @return channel deliveries that settled with a failure
     */
    public long getFailedCount() {
        return failedCount;
    }

    public JSONObject toJson() {
        JSONArray channelArray = new JSONArray();
        for (Channel channel : channels) {
            JSONObject entry = new JSONObject();
            entry.put("id", channel.getId());
            entry.put("type", channel.getKind().getWireName());
            entry.put("enabled", channel.isEnabled());
            channelArray.put(entry);
        }

        JSONObject json = new JSONObject();
        json.put("queueSize", queueSize);
        json.put("channels", channelArray);
        json.put("processing", draining);
        json.put("delivered", deliveredCount);
        json.put("failed", failedCount);
        return json;
    }
}
