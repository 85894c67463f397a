package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

import static com.kubegraph.core.readiness.LiveObjects.intAt;
import static com.kubegraph.core.readiness.LiveObjects.statusMissing;
import static com.kubegraph.core.readiness.LiveObjects.textAt;

/**
 * Readiness for replica-managing workloads.
 */
final class WorkloadReadiness {

    private WorkloadReadiness() {}

    /** Ready when ready and available replicas both equal the desired count (default 1). */
    static ReadinessVerdict deployment(JsonNode live) {
        int expected = intAt(live, "spec.replicas", 1);
        if (statusMissing(live)) {
            return expected == 0
                    ? ReadinessVerdict.ready("Deployment is scaled to zero")
                    : ReadinessVerdict.notReady("StatusMissing", "Deployment status not available yet");
        }
        int ready = intAt(live, "status.readyReplicas", 0);
        int available = intAt(live, "status.availableReplicas", 0);
        Map<String, Object> details = Map.of(
                "expectedReplicas", expected,
                "readyReplicas", ready,
                "availableReplicas", available,
                "updatedReplicas", intAt(live, "status.updatedReplicas", 0));
        if (ready == expected && available == expected) {
            return ReadinessVerdict.ready("Deployment has " + ready + "/" + expected + " ready replicas", details);
        }
        return ReadinessVerdict.notReady("ReplicasNotReady",
                "Waiting for replicas: " + ready + "/" + expected + " ready, " + available + "/" + expected
                        + " available", details);
    }

    static ReadinessVerdict replicaSet(JsonNode live) {
        int expected = intAt(live, "spec.replicas", 1);
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "ReplicaSet status not available yet");
        }
        int ready = intAt(live, "status.readyReplicas", 0);
        int available = intAt(live, "status.availableReplicas", 0);
        Map<String, Object> details = Map.of("expectedReplicas", expected, "readyReplicas", ready,
                "availableReplicas", available);
        if (ready == expected && available == expected) {
            return ReadinessVerdict.ready("ReplicaSet has " + ready + "/" + expected + " ready replicas", details);
        }
        return ReadinessVerdict.notReady("ReplicasNotReady",
                "Waiting for replicas: " + ready + "/" + expected + " ready", details);
    }

    /**
     * {@code OnDelete} only needs ready replicas; {@code RollingUpdate} (the default) also needs
     * current and updated replicas to match.
     */
    static ReadinessVerdict statefulSet(JsonNode live) {
        int expected = intAt(live, "spec.replicas", 1);
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "StatefulSet status not available yet");
        }
        String strategy = textAt(live, "spec.updateStrategy.type", "RollingUpdate");
        int ready = intAt(live, "status.readyReplicas", 0);
        int current = intAt(live, "status.currentReplicas", 0);
        int updated = intAt(live, "status.updatedReplicas", 0);
        Map<String, Object> details = Map.of("expectedReplicas", expected, "readyReplicas", ready,
                "currentReplicas", current, "updatedReplicas", updated, "updateStrategy", strategy);

        if ("OnDelete".equals(strategy)) {
            if (ready == expected) {
                return ReadinessVerdict.ready("StatefulSet (OnDelete) has " + ready + "/" + expected
                        + " ready replicas", details);
            }
            return ReadinessVerdict.notReady("ReplicasNotReady",
                    "Waiting for replicas: " + ready + "/" + expected + " ready", details);
        }
        if (ready == expected && current == expected && updated == expected) {
            return ReadinessVerdict.ready("StatefulSet has " + ready + "/" + expected
                    + " ready, current and updated replicas", details);
        }
        return ReadinessVerdict.notReady("ReplicasNotReady",
                "Waiting for replicas: " + ready + "/" + expected + " ready, " + current + "/" + expected
                        + " current, " + updated + "/" + expected + " updated", details);
    }

    static ReadinessVerdict daemonSet(JsonNode live) {
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "DaemonSet status not available yet");
        }
        int desired = intAt(live, "status.desiredNumberScheduled", -1);
        int ready = intAt(live, "status.numberReady", 0);
        int updated = intAt(live, "status.updatedNumberScheduled", desired);
        Map<String, Object> details = Map.of("desiredNumberScheduled", desired, "numberReady", ready,
                "updatedNumberScheduled", updated);
        if (desired < 0) {
            return ReadinessVerdict.notReady("StatusMissing", "DaemonSet has not computed its desired pods yet");
        }
        if (ready == desired && updated == desired) {
            return ReadinessVerdict.ready("DaemonSet has " + ready + "/" + desired + " ready pods", details);
        }
        return ReadinessVerdict.notReady("PodsNotReady",
                "Waiting for pods: " + ready + "/" + desired + " ready", details);
    }
}
