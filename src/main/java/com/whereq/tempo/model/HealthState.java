package com.whereq.tempo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory queue health
 */
public enum HealthState {
    HEALTHY,
    DEGRADED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
