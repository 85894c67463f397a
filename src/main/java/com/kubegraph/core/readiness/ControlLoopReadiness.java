package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

import static com.kubegraph.core.readiness.LiveObjects.conditionStatus;
import static com.kubegraph.core.readiness.LiveObjects.statusMissing;
import static com.kubegraph.core.readiness.LiveObjects.textAt;

/**
 * Readiness of kro objects: the ResourceGraphDefinition and the instances it serves.
 */
public final class ControlLoopReadiness {

    private ControlLoopReadiness() {}

    /** Ready when {@code status.state} is {@code Active} or the Ready condition holds. */
    public static ReadinessVerdict definition(JsonNode live) {
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "ResourceGraphDefinition status not available yet");
        }
        String state = textAt(live, "status.state", "");
        if ("Active".equals(state) || "True".equals(conditionStatus(live, "Ready"))) {
            return ReadinessVerdict.ready("ResourceGraphDefinition is active");
        }
        return ReadinessVerdict.notReady("DefinitionInactive",
                "ResourceGraphDefinition state: " + (state.isEmpty() ? "unknown" : state), Map.of("state", state));
    }

    /** Ready when {@code status.state == ACTIVE} and {@code InstanceSynced=True}; {@code FAILED} is terminal. */
    public static ReadinessVerdict instance(JsonNode live) {
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "Instance status not available yet");
        }
        String state = textAt(live, "status.state", "");
        String synced = conditionStatus(live, "InstanceSynced");
        Map<String, Object> details = Map.of("state", state, "instanceSynced", synced == null ? "Unknown" : synced);
        if ("FAILED".equals(state)) {
            return ReadinessVerdict.notReady("InstanceFailed", "Instance reconciliation failed", details);
        }
        if ("ACTIVE".equals(state) && "True".equals(synced)) {
            return ReadinessVerdict.ready("Instance is active and synced", details);
        }
        return ReadinessVerdict.notReady("InstanceNotSynced",
                "Waiting for instance: state " + (state.isEmpty() ? "unknown" : state), details);
    }
}
