package com.dispatchhub.core;

import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Point-in-time view of the scheduler's queues.
 */
public final class QueueStats {

    /**
     * Counts for one job type. {@code processing} is 1 while the type holds its in-flight slot.
     */
    public static final class TypeStats {
        private final String type;
        private final int pending;
        private final int processing;

        public TypeStats(String type, int pending, int processing) {
            this.type = type;
            this.pending = pending;
            this.processing = processing;
        }

        public String getType() {
            return type;
        }

        public int getPending() {
            return pending;
        }

        public int getProcessing() {
            return processing;
        }
    }

    private final List<TypeStats> queues;
    private final int activeJobs;
    private final int totalPending;
    private final boolean running;
    private final QueueConfig config;

    public QueueStats(List<TypeStats> queues, int activeJobs, int totalPending, boolean running, QueueConfig config) {
        this.queues = List.copyOf(queues);
        this.activeJobs = activeJobs;
        this.totalPending = totalPending;
        this.running = running;
        this.config = config;
    }

    public List<TypeStats> getQueues() {
        return queues;
    }

    /**
     * Look up the counts for a type.
     *
     * @return the type's stats, or null if the type has never had a job
     */
    public TypeStats forType(String type) {
        for (TypeStats stats : queues) {
            if (stats.getType().equals(type)) {
                return stats;
            }
        }
        return null;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public int getTotalPending() {
        return totalPending;
    }

    public boolean isRunning() {
        return running;
    }

    public QueueConfig getConfig() {
        return config;
    }

    public JSONObject toJson() {
        JSONArray queueArray = new JSONArray();
        for (TypeStats stats : queues) {
            JSONObject entry = new JSONObject();
            entry.put("type", stats.getType());
            entry.put("pending", stats.getPending());
            entry.put("processing", stats.getProcessing());
            queueArray.put(entry);
        }

        JSONObject json = new JSONObject();
        json.put("queues", queueArray);
        json.put("activeJobs", activeJobs);
        json.put("totalPending", totalPending);
        json.put("running", running);
        json.put("config", config.toJson());
        return json;
    }
}
