package com.kubegraph.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a deploy, delivered to the per-call callback, the event bus and
 * SSE clients.
 *
 * @param type         discriminator
 * @param deploymentId the deploy this event belongs to
 * @param resourceId   the resource it concerns (null for deploy-level events)
 * @param message      human-readable summary
 * @param payload      structured details, e.g. the readiness verdict or the error phase
 * @param timestamp    when the event occurred
 */
public record DeploymentEvent(
    DeploymentEventType type,
    String deploymentId,
    String resourceId,
    String message,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public DeploymentEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static DeploymentEvent of(DeploymentEventType type, String deploymentId, String resourceId,
                                     String message, Map<String, Object> payload) {
        return new DeploymentEvent(type, deploymentId, resourceId, message, payload, Instant.now());
    }
}
