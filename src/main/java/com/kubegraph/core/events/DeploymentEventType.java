package com.kubegraph.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of the deployment progress stream.
 */
public enum DeploymentEventType {
    STARTED("started"),
    PROGRESS("progress"),
    RESOURCE_STATUS("resource-status"),
    RESOURCE_READY("resource-ready"),
    RESOURCE_WARNING("resource-warning"),
    COMPLETED("completed"),
    FAILED("failed"),
    ROLLBACK("rollback");

    private final String wireName;

    DeploymentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
