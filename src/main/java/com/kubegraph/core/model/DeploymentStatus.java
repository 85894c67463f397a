package com.kubegraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall outcome of a deploy. {@code RUNNING} is only reported for deployments still in flight.
 */
public enum DeploymentStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
