package com.whereq.tempo.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fields written together with a status transition
 */
@Value
@Builder
public class JobUpdate {

    public static final JobUpdate NONE = JobUpdate.builder().build();

    Instant at;

    Object result;

    String error;

    public static JobUpdate at(Instant at) {
        return JobUpdate.builder().at(at).build();
    }

    public static JobUpdate completed(Instant at, Object result) {
        return JobUpdate.builder().at(at).result(result).build();
    }

    public static JobUpdate failed(Instant at, String error) {
        return JobUpdate.builder().at(at).error(error).build();
    }
}
