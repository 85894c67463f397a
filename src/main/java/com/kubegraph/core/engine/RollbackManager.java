package com.kubegraph.core.engine;

import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.model.DeployedResource;
import com.kubegraph.core.model.DeploymentError;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.RollbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Best-effort deletion of a deployment's applied resources, dependents first. Failures are
 * recorded in the {@link RollbackResult} and never thrown.
 */
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final ClusterApi clusterApi;
    private final KubegraphMetrics metrics;

    public RollbackManager(ClusterApi clusterApi, KubegraphMetrics metrics) {
        this.clusterApi = clusterApi;
        this.metrics = metrics;
    }

    public RollbackResult rollback(DeploymentResult result, DeploymentEventEmitter emitter) {
        List<DeployedResource> applied = new ArrayList<>(
                result.resources().stream().filter(DeployedResource::isApplied).toList());
        // resources are recorded level by level, so the reverse is dependents first
        Collections.reverse(applied);

        log.info("Rolling back deployment {}: {} resources", result.deploymentId(), applied.size());
        var rolledBack = new ArrayList<String>();
        var errors = new ArrayList<DeploymentError>();
        for (DeployedResource resource : applied) {
            ResourceKey key = ResourceKey.of(resource.manifest(), resource.namespace());
            try {
                clusterApi.delete(key);
                rolledBack.add(resource.id());
                emitter.emit(DeploymentEventType.ROLLBACK, resource.id(), "Deleted " + key,
                        Map.of("status", "deleted"));
            } catch (ClusterApiException e) {
                if (e.isNotFound()) {
                    rolledBack.add(resource.id());
                    emitter.emit(DeploymentEventType.ROLLBACK, resource.id(), key + " already absent",
                            Map.of("status", "absent"));
                    continue;
                }
                log.warn("Failed to delete {} during rollback: {}", key, e.getMessage());
                errors.add(DeploymentError.of(resource.id(), DeploymentPhase.ROLLBACK,
                        "Failed to delete " + key + ": " + e.getMessage(), e));
                emitter.emit(DeploymentEventType.ROLLBACK, resource.id(), "Failed to delete " + key,
                        Map.of("status", "failed", "statusCode", e.statusCode()));
            }
        }
        RollbackResult rollback = RollbackResult.of(result.deploymentId(), rolledBack, errors);
        if (metrics != null) {
            metrics.recordRollback(rollback.status().wireName());
        }
        return rollback;
    }
}
