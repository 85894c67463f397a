package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.readiness.ReadinessEvaluator;
import com.kubegraph.core.readiness.ReadinessEvaluatorRegistry;
import com.kubegraph.core.readiness.ReadinessVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Polls a resource until its readiness verdict is ready or the readiness timeout elapses.
 * Read and evaluator failures are reported as warnings and polling continues.
 */
public class ReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ReadinessWaiter.class);

    private final ClusterApi clusterApi;
    private final ReadinessEvaluatorRegistry registry;
    private final KubegraphMetrics metrics;

    public ReadinessWaiter(ClusterApi clusterApi, ReadinessEvaluatorRegistry registry, KubegraphMetrics metrics) {
        this.clusterApi = clusterApi;
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * @param override bespoke evaluator for this resource, or null for the registry's
     * @return the live object that produced the ready verdict
     * @throws ReadinessTimeoutError when not ready within the readiness timeout, or before the
     *                               overall deploy deadline
     * @throws ResourceFailedError   when the verdict reports a terminal failure
     */
    public ObjectNode awaitReady(DeploymentContext ctx, String resourceId, ResourceKey key,
                                 ReadinessEvaluator override) {
        DeploymentOptions options = ctx.options();
        DeploymentEventEmitter emitter = ctx.emitter();
        Duration timeout = options.readinessTimeout();
        long startMs = System.currentTimeMillis();
        long readinessDeadline = startMs + timeout.toMillis();
        boolean deployDeadlineFirst = ctx.deadlineAtMillis() < readinessDeadline;
        long deadline = Math.min(readinessDeadline, ctx.deadlineAtMillis());
        String lastMessage = "no status observed";

        log.info("Waiting for {} '{}' to become ready (timeout: {}s)", key.kind(), resourceId, timeout.toSeconds());

        while (true) {
            try {
                ObjectNode live = clusterApi.get(key);
                ReadinessVerdict verdict = registry.evaluate(key.kind(), live, override);
                lastMessage = verdict.message();
                if (verdict.ready()) {
                    long waitedMs = System.currentTimeMillis() - startMs;
                    if (metrics != null) {
                        metrics.recordReadinessWait(key.kind(), waitedMs);
                    }
                    log.info("Resource '{}' is ready: {}", resourceId, verdict.message());
                    emitter.emit(DeploymentEventType.RESOURCE_READY, resourceId, verdict.message(),
                            verdictPayload(verdict));
                    return live;
                }
                if (verdict.isTerminal()) {
                    throw new ResourceFailedError(resourceId, verdict.reason(), verdict.message());
                }
                log.debug("Resource '{}' not ready [{}]: {}", resourceId, verdict.reason(), verdict.message());
                emitter.emit(DeploymentEventType.PROGRESS, resourceId, verdict.message(), verdictPayload(verdict));
            } catch (ClusterApiException e) {
                if (e.isNotFound()) {
                    lastMessage = "Resource not found";
                    emitter.emit(DeploymentEventType.PROGRESS, resourceId, lastMessage,
                            Map.of("ready", false, "reason", "NotFound"));
                } else {
                    log.warn("Transient error reading '{}': {}", resourceId, e.getMessage());
                    emitter.emit(DeploymentEventType.RESOURCE_WARNING, resourceId,
                            "Failed to read status: " + e.getMessage(), Map.of("statusCode", e.statusCode()));
                }
            } catch (ResourceFailedError e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Readiness evaluator failed for '{}': {}", resourceId, e.getMessage());
                emitter.emit(DeploymentEventType.RESOURCE_WARNING, resourceId,
                        "Readiness evaluation failed: " + e.getMessage());
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                if (deployDeadlineFirst) {
                    throw ReadinessTimeoutError.deadlineReached(resourceId,
                            Duration.ofMillis(System.currentTimeMillis() - startMs), lastMessage);
                }
                throw new ReadinessTimeoutError(resourceId, timeout, lastMessage);
            }
            try {
                Thread.sleep(Math.min(options.pollInterval().toMillis(), remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new KubegraphException("Interrupted while waiting for '" + resourceId + "'", e);
            }
        }
    }

    private static Map<String, Object> verdictPayload(ReadinessVerdict verdict) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("ready", verdict.ready());
        if (verdict.reason() != null) {
            payload.put("reason", verdict.reason());
        }
        if (!verdict.details().isEmpty()) {
            payload.put("details", verdict.details());
        }
        return payload;
    }
}
