package com.kubegraph.core.engine;

import com.kubegraph.core.events.DeploymentEvent;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.events.EventBus;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Delivers one deploy's events to its progress callback and the shared {@link EventBus}.
 */
public class DeploymentEventEmitter {

    private final String deploymentId;
    private final Consumer<DeploymentEvent> callback;
    private final EventBus eventBus;

    public DeploymentEventEmitter(String deploymentId, Consumer<DeploymentEvent> callback, EventBus eventBus) {
        this.deploymentId = deploymentId;
        this.callback = callback;
        this.eventBus = eventBus;
    }

    public void emit(DeploymentEventType type, String resourceId, String message, Map<String, Object> payload) {
        DeploymentEvent event = DeploymentEvent.of(type, deploymentId, resourceId, message, payload);
        if (callback != null) {
            EventBus.deliverSafely(callback, event);
        }
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    public void emit(DeploymentEventType type, String resourceId, String message) {
        emit(type, resourceId, message, Map.of());
    }

    public String deploymentId() {
        return deploymentId;
    }
}
