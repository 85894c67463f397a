package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.metrics.KubegraphMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Idempotent create-or-update with retry of transient failures.
 */
public class ResourceApplier {

    private static final Logger log = LoggerFactory.getLogger(ResourceApplier.class);

    private final ClusterApi clusterApi;
    private final KubegraphMetrics metrics;

    public ResourceApplier(ClusterApi clusterApi, KubegraphMetrics metrics) {
        this.clusterApi = clusterApi;
        this.metrics = metrics;
    }

    /**
     * Applies {@code manifest}, retrying transient failures per {@code policy}.
     *
     * @return the object as stored by the cluster
     * @throws ApplyError on a permanent failure or once retries are exhausted
     */
    public ObjectNode apply(String resourceId, ObjectNode manifest, RetryPolicy policy,
                            DeploymentEventEmitter emitter) {
        int attempt = 0;
        while (true) {
            try {
                ObjectNode stored = createOrUpdate(manifest);
                recordAttempt(attempt == 0 ? "success" : "retried");
                return stored;
            } catch (ClusterApiException e) {
                var error = new ApplyError(resourceId, e.statusCode(),
                        "Failed to apply '" + resourceId + "': " + e.getMessage(), e);
                if (!error.isTransient() || attempt >= policy.maxRetries()) {
                    recordAttempt("failed");
                    if (error.isTransient()) {
                        log.warn("Giving up on '{}' after {} retries: {}", resourceId, attempt, e.getMessage());
                    }
                    throw error;
                }
                Duration delay = policy.delayFor(attempt);
                attempt++;
                log.warn("Transient failure applying '{}' (status {}), retry {}/{} in {}ms",
                        resourceId, e.statusCode(), attempt, policy.maxRetries(), delay.toMillis());
                if (emitter != null) {
                    emitter.emit(DeploymentEventType.RESOURCE_WARNING, resourceId,
                            "Apply failed with status " + e.statusCode() + ", retrying",
                            Map.of("attempt", attempt, "statusCode", e.statusCode(),
                                   "delayMs", delay.toMillis()));
                }
                sleep(resourceId, delay);
            }
        }
    }

    /** Reads the object; creates it on 404, otherwise replaces it at the live resourceVersion. */
    ObjectNode createOrUpdate(ObjectNode manifest) {
        ResourceKey key = ResourceKey.of(manifest, null);
        ObjectNode live;
        try {
            live = clusterApi.get(key);
        } catch (ClusterApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("Creating {}", key);
            return clusterApi.create(manifest);
        }
        ObjectNode update = manifest.deepCopy();
        JsonNode resourceVersion = live.path("metadata").path("resourceVersion");
        if (!resourceVersion.isMissingNode()) {
            update.withObject("/metadata").set("resourceVersion", resourceVersion);
        }
        log.debug("Updating {} at resourceVersion {}", key, resourceVersion.asText("?"));
        return clusterApi.replace(update);
    }

    private void recordAttempt(String outcome) {
        if (metrics != null) {
            metrics.recordApplyAttempt(outcome);
        }
    }

    private static void sleep(String resourceId, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApplyError(resourceId, ClusterApiException.NETWORK_ERROR,
                    "Interrupted while backing off before retrying '" + resourceId + "'", e);
        }
    }
}
