package com.whereq.tempo.executor;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Returns its payload unchanged. Used for smoke tests of the queue.
 */
public class EchoProcessor implements JobProcessor {

    public static final String TYPE = "echo";

    @Override
    public Mono<JsonNode> process(JsonNode payload, ProgressReporter progress) {
        return Mono.fromSupplier(() -> {
            progress.report(100);
            return payload;
        });
    }
}
