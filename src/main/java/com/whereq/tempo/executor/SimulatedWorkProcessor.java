package com.whereq.tempo.executor;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in for a long-running computation: waits {@code steps} times for {@code stepMs},
 * reporting progress after each step
 */
public class SimulatedWorkProcessor implements JobProcessor {

    public static final String TYPE = "simulate";

    private static final int DEFAULT_STEPS = 5;

    private static final long DEFAULT_STEP_MS = 1_000;

    private final Clock clock;

    public SimulatedWorkProcessor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Map<String, Object>> process(JsonNode payload, ProgressReporter progress) {
        int steps = Math.max(1, payload.path("steps").asInt(DEFAULT_STEPS));
        long stepMs = Math.max(0, payload.path("stepMs").asLong(DEFAULT_STEP_MS));

        return Flux.range(1, steps)
            .concatMap(step -> Mono.delay(Duration.ofMillis(stepMs))
                .doOnNext(tick -> progress.report(step * 100 / steps)))
            .then(Mono.fromSupplier(() -> {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("message", "Job completed successfully");
                result.put("type", TYPE);
                result.put("steps", steps);
                result.put("processedAt", clock.instant().toString());
                return result;
            }));
    }
}
