package com.dispatchhub.engine;

import com.dispatchhub.core.JobProcessor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Mapping of job type to the processor that executes it.
 *
 * <p>Registering a processor for a type that already has one replaces it. Lookups made
 * by the dispatch loop always see the latest registration.</p>
 */
public class ProcessorRegistry {
    private static final Logger logger = Logger.getLogger(ProcessorRegistry.class.getName());

    private final Map<String, JobProcessor> processors = new ConcurrentHashMap<>();

    /**
     * Register (or replace) the processor for a job type.
     *
     * @throws IllegalArgumentException if type is blank
     * @throws NullPointerException if processor is null
     */
    public void register(String type, JobProcessor processor) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        if (processor == null) {
            throw new NullPointerException("processor");
        }
        JobProcessor previous = processors.put(type, processor);
        if (previous != null) {
            logger.info("Job processor replaced for type: " + type);
        } else {
            logger.info("Job processor registered for type: " + type);
        }
    }

    /**
     * @return the processor for the type, or null if none is registered
     */
    public JobProcessor get(String type) {
        return processors.get(type);
    }
}
