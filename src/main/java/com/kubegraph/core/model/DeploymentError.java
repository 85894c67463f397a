package com.kubegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * An error accumulated during a deploy.
 *
 * @param resourceId null for deploy-level errors (timeout, cancellation)
 * @param cause      the underlying exception, not serialized
 */
public record DeploymentError(String resourceId,
                              DeploymentPhase phase,
                              String message,
                              Instant timestamp,
                              @JsonIgnore Throwable cause) {

    public static DeploymentError of(String resourceId, DeploymentPhase phase, String message, Throwable cause) {
        return new DeploymentError(resourceId, phase, message, Instant.now(), cause);
    }

    public static DeploymentError of(String resourceId, DeploymentPhase phase, String message) {
        return of(resourceId, phase, message, null);
    }

    /** Name of the cause's type, e.g. {@code DependencyFailedError}. */
    public String errorType() {
        return cause == null ? null : cause.getClass().getSimpleName();
    }
}
