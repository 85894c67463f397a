package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

import static com.kubegraph.core.readiness.LiveObjects.conditionStatus;
import static com.kubegraph.core.readiness.LiveObjects.has;
import static com.kubegraph.core.readiness.LiveObjects.intAt;
import static com.kubegraph.core.readiness.LiveObjects.textAt;

/**
 * Readiness for pods, storage, autoscalers, definitions and existence-only kinds.
 */
final class CoreReadiness {

    private CoreReadiness() {}

    static ReadinessVerdict exists(JsonNode live) {
        String kind = textAt(live, "kind", "Resource");
        return ReadinessVerdict.ready(kind + " exists");
    }

    static ReadinessVerdict pod(JsonNode live) {
        String phase = textAt(live, "status.phase", null);
        if (phase == null) {
            return ReadinessVerdict.notReady("StatusMissing", "Pod status not available yet");
        }
        if ("Succeeded".equals(phase)) {
            return ReadinessVerdict.ready("Pod completed successfully", Map.of("phase", phase));
        }
        if ("Failed".equals(phase)) {
            return ReadinessVerdict.notReady("PodFailed", "Pod failed: "
                    + textAt(live, "status.message", textAt(live, "status.reason", "unknown reason")),
                    Map.of("phase", phase));
        }
        if ("Running".equals(phase) && "True".equals(conditionStatus(live, "Ready"))) {
            return ReadinessVerdict.ready("Pod is running and ready", Map.of("phase", phase));
        }
        return ReadinessVerdict.notReady("PodNotReady", "Pod is " + phase + " and not ready yet",
                Map.of("phase", phase));
    }

    static ReadinessVerdict persistentVolumeClaim(JsonNode live) {
        String phase = textAt(live, "status.phase", "Pending");
        if ("Bound".equals(phase)) {
            return ReadinessVerdict.ready("PersistentVolumeClaim is bound", Map.of("phase", phase));
        }
        if ("Lost".equals(phase)) {
            return ReadinessVerdict.notReady("ClaimLost", "PersistentVolumeClaim lost its volume",
                    Map.of("phase", phase));
        }
        return ReadinessVerdict.notReady("ClaimPending", "Waiting for PersistentVolumeClaim to bind",
                Map.of("phase", phase));
    }

    static ReadinessVerdict horizontalPodAutoscaler(JsonNode live) {
        if (!has(live, "status.currentReplicas")) {
            return ReadinessVerdict.notReady("StatusMissing", "HorizontalPodAutoscaler has not observed its target yet");
        }
        if ("False".equals(conditionStatus(live, "AbleToScale"))) {
            return ReadinessVerdict.notReady("ConditionFalse", "HorizontalPodAutoscaler is unable to scale");
        }
        int current = intAt(live, "status.currentReplicas", 0);
        return ReadinessVerdict.ready("HorizontalPodAutoscaler is tracking " + current + " replicas",
                Map.of("currentReplicas", current));
    }

    static ReadinessVerdict customResourceDefinition(JsonNode live) {
        if ("True".equals(conditionStatus(live, "Established"))) {
            return ReadinessVerdict.ready("CustomResourceDefinition is established");
        }
        return ReadinessVerdict.notReady("NotEstablished", "Waiting for CustomResourceDefinition to be established");
    }

    static ReadinessVerdict podDisruptionBudget(JsonNode live) {
        if (!has(live, "status.observedGeneration")) {
            return ReadinessVerdict.notReady("StatusMissing", "PodDisruptionBudget status not available yet");
        }
        return ReadinessVerdict.ready("PodDisruptionBudget is observed",
                Map.of("currentHealthy", intAt(live, "status.currentHealthy", 0),
                        "desiredHealthy", intAt(live, "status.desiredHealthy", 0)));
    }
}
