package com.whereq.tempo.executor;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Pluggable execution function for one job type
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * Execute a job.
     * The returned Mono emits the result (or completes empty for no result) and errors on failure.
     *
     * @param payload job parameters
     * @param progress progress callback, may be called any number of times
     * @return job result
     */
    Mono<?> process(JsonNode payload, ProgressReporter progress);

    /**
     * Adapt a blocking function, running it on the bounded elastic scheduler
     */
    static JobProcessor blocking(BlockingProcessor processor) {
        return (payload, progress) -> Mono.fromCallable(() -> processor.process(payload, progress))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Blocking variant of {@link JobProcessor}
     */
    @FunctionalInterface
    interface BlockingProcessor {
        Object process(JsonNode payload, ProgressReporter progress) throws Exception;
    }
}
