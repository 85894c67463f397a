package com.kubegraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResourceStatus {
    /** Applied; readiness not (yet) confirmed. */
    DEPLOYED,
    READY,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
