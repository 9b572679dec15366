package com.whereq.tempo.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job types to processors. Feature modules register theirs during startup.
 */
@Slf4j
@Service
public class ProcessorRegistry {

    private final ConcurrentHashMap<String, JobProcessor> processors = new ConcurrentHashMap<>();

    /**
     * Register a processor for a job type, replacing any previous one
     *
     * @param type job type
     * @param processor execution function
     */
    public void register(String type, JobProcessor processor) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        if (processor == null) {
            throw new IllegalArgumentException("Processor for type '" + type + "' must not be null");
        }

        JobProcessor previous = processors.put(type, processor);
        if (previous != null) {
            log.warn("Replaced processor for job type: {}", type);
        } else {
            log.info("Registered processor for job type: {}", type);
        }
    }

    public Optional<JobProcessor> find(String type) {
        return Optional.ofNullable(processors.get(type));
    }

    public boolean isRegistered(String type) {
        return processors.containsKey(type);
    }

    /**
     * Registered job types, sorted
     */
    public Set<String> types() {
        return new TreeSet<>(processors.keySet());
    }
}
