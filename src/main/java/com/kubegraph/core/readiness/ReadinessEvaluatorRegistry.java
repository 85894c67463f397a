package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability registry mapping a resource kind to its readiness evaluator, resolved at apply
 * time. Kinds without an entry fall back to the generic "exists, no fatal condition" check.
 */
@Component
public class ReadinessEvaluatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReadinessEvaluatorRegistry.class);

    private final ConcurrentHashMap<String, ReadinessEvaluator> evaluators = new ConcurrentHashMap<>();

    public ReadinessEvaluatorRegistry() {
        register("Deployment", WorkloadReadiness::deployment);
        register("ReplicaSet", WorkloadReadiness::replicaSet);
        register("StatefulSet", WorkloadReadiness::statefulSet);
        register("DaemonSet", WorkloadReadiness::daemonSet);
        register("Service", NetworkReadiness::service);
        register("Ingress", NetworkReadiness::ingress);
        register("Job", BatchReadiness::job);
        register("CronJob", BatchReadiness::cronJob);
        register("Pod", CoreReadiness::pod);
        register("PersistentVolumeClaim", CoreReadiness::persistentVolumeClaim);
        register("HorizontalPodAutoscaler", CoreReadiness::horizontalPodAutoscaler);
        register("CustomResourceDefinition", CoreReadiness::customResourceDefinition);
        register("PodDisruptionBudget", CoreReadiness::podDisruptionBudget);
        register("ResourceGraphDefinition", ControlLoopReadiness::definition);
        for (String kind : Set.of("ConfigMap", "Secret", "Namespace", "ServiceAccount", "Role", "RoleBinding",
                "ClusterRole", "ClusterRoleBinding", "NetworkPolicy", "StorageClass", "PersistentVolume")) {
            register(kind, CoreReadiness::exists);
        }
    }

    /** Registers or replaces the evaluator for a kind. */
    public void register(String kind, ReadinessEvaluator evaluator) {
        ReadinessEvaluator previous = evaluators.put(kind, evaluator);
        if (previous != null) {
            log.debug("Replaced readiness evaluator for kind {}", kind);
        }
    }

    public ReadinessEvaluator evaluatorFor(String kind) {
        ReadinessEvaluator evaluator = kind == null ? null : evaluators.get(kind);
        return evaluator != null ? evaluator : GenericReadiness::evaluate;
    }

    public boolean hasBespokeEvaluator(String kind) {
        return kind != null && evaluators.containsKey(kind);
    }

    /**
     * Evaluates an observed object. A per-resource override wins over the registry entry;
     * a missing object is never ready.
     */
    public ReadinessVerdict evaluate(String kind, JsonNode liveObject, ReadinessEvaluator override) {
        if (liveObject == null || liveObject.isNull() || liveObject.isMissingNode()) {
            return ReadinessVerdict.notReady("NotFound", kind + " does not exist");
        }
        ReadinessEvaluator evaluator = override != null ? override : evaluatorFor(kind);
        return evaluator.evaluate(liveObject);
    }

    public ReadinessVerdict evaluate(String kind, JsonNode liveObject) {
        return evaluate(kind, liveObject, null);
    }

    public Set<String> registeredKinds() {
        return new TreeSet<>(evaluators.keySet());
    }
}
