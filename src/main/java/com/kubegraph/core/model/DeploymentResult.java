package com.kubegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kubegraph.core.graph.DependencyGraph;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Durable output of one deploy call.
 *
 * @param resources    every resource that was attempted, in apply order
 * @param statusValues evaluated status projection (direct) or instance status (control loop)
 */
public record DeploymentResult(String deploymentId,
                               List<DeployedResource> resources,
                               @JsonIgnore DependencyGraph dependencyGraph,
                               Duration duration,
                               DeploymentStatus status,
                               List<DeploymentError> errors,
                               Map<String, Object> statusValues) {

    public DeploymentResult {
        resources = List.copyOf(resources);
        errors = List.copyOf(errors);
        statusValues = statusValues == null ? Map.of() : statusValues;
    }

    /**
     * {@code success} with no errors; {@code failed} when no resource reached Ready (or Deployed,
     * when waiting was disabled); {@code partial} otherwise.
     */
    public static DeploymentStatus statusOf(List<DeployedResource> resources, List<DeploymentError> errors,
                                            boolean waitForReady) {
        if (errors.isEmpty()) {
            return DeploymentStatus.SUCCESS;
        }
        ResourceStatus goal = waitForReady ? ResourceStatus.READY : ResourceStatus.DEPLOYED;
        boolean anyReached = resources.stream().anyMatch(r -> r.status() == goal);
        return anyReached ? DeploymentStatus.PARTIAL : DeploymentStatus.FAILED;
    }

    public DeployedResource resource(String id) {
        return resources.stream().filter(r -> r.id().equals(id)).findFirst().orElse(null);
    }

    public List<DeploymentError> errorsFor(String resourceId) {
        return errors.stream().filter(e -> resourceId.equals(e.resourceId())).toList();
    }

    @JsonProperty("levels")
    public List<List<String>> levels() {
        return dependencyGraph == null ? List.of() : dependencyGraph.levels();
    }

    public boolean isSuccess() {
        return status == DeploymentStatus.SUCCESS;
    }
}
