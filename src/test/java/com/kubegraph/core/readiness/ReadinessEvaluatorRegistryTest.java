package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessEvaluatorRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ReadinessEvaluatorRegistry registry = new ReadinessEvaluatorRegistry();

    private static JsonNode json(Map<String, Object> value) {
        return MAPPER.valueToTree(value);
    }

    @Nested
    @DisplayName("Workloads")
    class WorkloadTests {

        @Test
        @DisplayName("Deployment is ready when ready and available replicas match spec")
        void deploymentReady() {
            JsonNode live = json(Map.of("kind", "Deployment",
                    "spec", Map.of("replicas", 3),
                    "status", Map.of("readyReplicas", 3, "availableReplicas", 3)));

            ReadinessVerdict verdict = registry.evaluate("Deployment", live);

            assertTrue(verdict.ready());
            assertEquals(3, verdict.details().get("readyReplicas"));
        }

        @Test
        @DisplayName("Deployment with partial replicas is not ready")
        void deploymentPartial() {
            JsonNode live = json(Map.of("spec", Map.of("replicas", 3),
                    "status", Map.of("readyReplicas", 2, "availableReplicas", 2)));

            ReadinessVerdict verdict = registry.evaluate("Deployment", live);

            assertFalse(verdict.ready());
            assertEquals("ReplicasNotReady", verdict.reason());
        }

        @Test
        @DisplayName("Deployment without status waits")
        void deploymentNoStatus() {
            assertEquals("StatusMissing",
                    registry.evaluate("Deployment", json(Map.of("spec", Map.of("replicas", 1)))).reason());
        }

        @Test
        @DisplayName("rolling-update StatefulSet waits for current and updated replicas too")
        void statefulSetRollingUpdate() {
            JsonNode rolling = json(Map.of("spec", Map.of("replicas", 3),
                    "status", Map.of("readyReplicas", 3, "currentReplicas", 3, "updatedReplicas", 1)));
            JsonNode done = json(Map.of("spec", Map.of("replicas", 3),
                    "status", Map.of("readyReplicas", 3, "currentReplicas", 3, "updatedReplicas", 3)));

            assertEquals("ReplicasNotReady", registry.evaluate("StatefulSet", rolling).reason());
            assertTrue(registry.evaluate("StatefulSet", done).ready());
        }

        @Test
        @DisplayName("OnDelete StatefulSet only needs ready replicas")
        void statefulSetOnDelete() {
            JsonNode live = json(Map.of(
                    "spec", Map.of("replicas", 2, "updateStrategy", Map.of("type", "OnDelete")),
                    "status", Map.of("readyReplicas", 2, "currentReplicas", 1, "updatedReplicas", 0)));

            ReadinessVerdict verdict = registry.evaluate("StatefulSet", live);

            assertTrue(verdict.ready());
            assertEquals("OnDelete", verdict.details().get("updateStrategy"));
        }

        @Test
        @DisplayName("DaemonSet is ready when every scheduled pod is ready and updated")
        void daemonSet() {
            JsonNode pending = json(Map.of("status",
                    Map.of("desiredNumberScheduled", 4, "numberReady", 3, "updatedNumberScheduled", 4)));
            JsonNode ready = json(Map.of("status",
                    Map.of("desiredNumberScheduled", 4, "numberReady", 4, "updatedNumberScheduled", 4)));

            assertEquals("PodsNotReady", registry.evaluate("DaemonSet", pending).reason());
            assertTrue(registry.evaluate("DaemonSet", ready).ready());
        }

        @Test
        @DisplayName("DaemonSet without a desired count waits")
        void daemonSetNotComputed() {
            assertEquals("StatusMissing",
                    registry.evaluate("DaemonSet", json(Map.of("status", Map.of("numberReady", 0)))).reason());
        }

        @Test
        @DisplayName("evaluation is deterministic for the same observation")
        void deterministic() {
            JsonNode live = json(Map.of("spec", Map.of("replicas", 2),
                    "status", Map.of("readyReplicas", 1, "availableReplicas", 1)));

            assertEquals(registry.evaluate("Deployment", live), registry.evaluate("Deployment", live));
        }
    }

    @Nested
    @DisplayName("Services and jobs")
    class ServiceAndJobTests {

        @Test
        @DisplayName("ClusterIP service is ready once it exists")
        void clusterIp() {
            assertTrue(registry.evaluate("Service", json(Map.of("spec", Map.of("type", "ClusterIP")))).ready());
        }

        @Test
        @DisplayName("LoadBalancer service waits for an ingress address")
        void loadBalancer() {
            JsonNode pending = json(Map.of("spec", Map.of("type", "LoadBalancer"), "status", Map.of()));
            JsonNode assigned = json(Map.of("spec", Map.of("type", "LoadBalancer"),
                    "status", Map.of("loadBalancer", Map.of("ingress", List.of(Map.of("ip", "10.0.0.9"))))));

            assertEquals("LoadBalancerPending", registry.evaluate("Service", pending).reason());
            assertTrue(registry.evaluate("Service", assigned).ready());
        }

        @Test
        @DisplayName("failed Job is terminal")
        void jobFailed() {
            JsonNode live = json(Map.of("spec", Map.of("backoffLimit", 1), "status", Map.of("failed", 2)));

            ReadinessVerdict verdict = registry.evaluate("Job", live);

            assertEquals("JobFailed", verdict.reason());
            assertTrue(verdict.isTerminal());
        }

        @Test
        @DisplayName("running Job is not terminal")
        void jobRunning() {
            ReadinessVerdict verdict = registry.evaluate("Job", json(Map.of("status", Map.of("active", 1))));

            assertEquals("JobRunning", verdict.reason());
            assertFalse(verdict.isTerminal());
        }

        @Test
        @DisplayName("completed Job is ready")
        void jobComplete() {
            assertTrue(registry.evaluate("Job", json(Map.of("status", Map.of("succeeded", 1)))).ready());
        }
    }

    @Nested
    @DisplayName("CronJobs")
    class CronJobTests {

        @Test
        @DisplayName("a suspended CronJob is ready without any status")
        void suspended() {
            ReadinessVerdict verdict = registry.evaluate("CronJob",
                    json(Map.of("spec", Map.of("schedule", "*/5 * * * *", "suspend", true))));

            assertTrue(verdict.ready());
            assertEquals(true, verdict.details().get("suspended"));
        }

        @Test
        @DisplayName("a CronJob that was never scheduled is not ready")
        void neverScheduled() {
            ReadinessVerdict verdict = registry.evaluate("CronJob",
                    json(Map.of("spec", Map.of("schedule", "*/5 * * * *"), "status", Map.of())));

            assertFalse(verdict.ready());
            assertEquals("NotScheduled", verdict.reason());
            assertFalse(verdict.isTerminal());
        }

        @Test
        @DisplayName("once scheduled a CronJob is ready whatever its active runs")
        void scheduledWithActiveRuns() {
            ReadinessVerdict verdict = registry.evaluate("CronJob", json(Map.of(
                    "spec", Map.of("schedule", "*/5 * * * *"),
                    "status", Map.of("lastScheduleTime", "2026-10-19T10:00:00Z",
                            "active", List.of(Map.of("name", "report-1"), Map.of("name", "report-2"))))));

            assertTrue(verdict.ready());
            assertEquals(2, verdict.details().get("active"));
        }
    }

    @Nested
    @DisplayName("Fallbacks and overrides")
    class FallbackTests {

        @Test
        @DisplayName("missing objects are never ready")
        void missing() {
            assertEquals("NotFound", registry.evaluate("Deployment", null).reason());
        }

        @Test
        @DisplayName("unknown kinds use condition-based generic readiness")
        void generic() {
            JsonNode healthy = json(Map.of("kind", "Widget", "status", Map.of()));
            JsonNode failing = json(Map.of("kind", "Widget", "status", Map.of("conditions",
                    List.of(Map.of("type", "Ready", "status", "False", "message", "broken")))));

            assertFalse(registry.hasBespokeEvaluator("Widget"));
            assertTrue(registry.evaluate("Widget", healthy).ready());
            ReadinessVerdict verdict = registry.evaluate("Widget", failing);
            assertEquals("ConditionFalse", verdict.reason());
            assertTrue(verdict.message().contains("broken"));
        }

        @Test
        @DisplayName("per-resource override wins over the kind entry")
        void override() {
            ReadinessEvaluator never = live -> ReadinessVerdict.notReady("Custom", "never ready");

            assertEquals("Custom", registry.evaluate("ConfigMap", json(Map.of("data", Map.of())), never).reason());
        }

        @Test
        @DisplayName("registering a kind replaces its evaluator")
        void register() {
            registry.register("Widget", live -> ReadinessVerdict.ready("ok"));

            assertTrue(registry.hasBespokeEvaluator("Widget"));
            assertTrue(registry.registeredKinds().contains("Widget"));
            assertTrue(registry.registeredKinds().contains("Deployment"));
        }
    }

    @Nested
    @DisplayName("Control-loop objects")
    class ControlLoopTests {

        @Test
        @DisplayName("definition is ready when Active")
        void definitionActive() {
            assertTrue(registry.evaluate("ResourceGraphDefinition",
                    json(Map.of("status", Map.of("state", "Active")))).ready());
            assertEquals("DefinitionInactive", ControlLoopReadiness.definition(
                    json(Map.of("status", Map.of("state", "Inactive")))).reason());
        }

        @Test
        @DisplayName("instance needs ACTIVE and InstanceSynced")
        void instance() {
            JsonNode synced = json(Map.of("status", Map.of("state", "ACTIVE",
                    "conditions", List.of(Map.of("type", "InstanceSynced", "status", "True")))));
            JsonNode unsynced = json(Map.of("status", Map.of("state", "ACTIVE",
                    "conditions", List.of(Map.of("type", "InstanceSynced", "status", "False")))));

            assertTrue(ControlLoopReadiness.instance(synced).ready());
            assertEquals("InstanceNotSynced", ControlLoopReadiness.instance(unsynced).reason());
        }

        @Test
        @DisplayName("FAILED instance is terminal")
        void instanceFailed() {
            ReadinessVerdict verdict = ControlLoopReadiness.instance(json(Map.of("status", Map.of("state", "FAILED"))));

            assertEquals("InstanceFailed", verdict.reason());
            assertTrue(verdict.isTerminal());
        }
    }
}
