package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.logging.MdcContext;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.model.DeployedResource;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies the graph level by level and waits for readiness itself. Resources of one level are
 * dispatched concurrently and awaited together; a resource is applied only after every
 * dependency is Ready (or Deployed, when waiting is disabled).
 */
public class DirectDeploymentStrategy implements DeploymentStrategy {

    private static final Logger log = LoggerFactory.getLogger(DirectDeploymentStrategy.class);

    private final ResourceApplier applier;
    private final ReadinessWaiter waiter;
    private final ReferenceResolver resolver;
    private final KubegraphMetrics metrics;

    public DirectDeploymentStrategy(ResourceApplier applier, ReadinessWaiter waiter, ReferenceResolver resolver,
                                    KubegraphMetrics metrics) {
        this.applier = applier;
        this.waiter = waiter;
        this.resolver = resolver;
        this.metrics = metrics;
    }

    @Override
    public DeploymentOptions.Strategy type() {
        return DeploymentOptions.Strategy.DIRECT;
    }

    @Override
    public DeploymentResult deploy(DeploymentContext ctx) {
        if (ctx.options().dryRun()) {
            return dryRun(ctx);
        }
        List<List<String>> levels = ctx.dependencyGraph().levels();
        ExecutorService executor = newExecutor(ctx);
        try {
            for (int level = 0; level < levels.size(); level++) {
                if (!mayStartLevel(ctx, level)) {
                    break;
                }
                runLevel(ctx, level, levels.get(level), executor);
                if (ctx.deadlineExceeded() && (level + 1 < levels.size() || ctx.hasFailures())) {
                    addTimeoutError(ctx);
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        Map<String, Object> statusValues = resolver.evaluateStatus(ctx);
        return ctx.toResult(statusValues);
    }

    private boolean mayStartLevel(DeploymentContext ctx, int level) {
        CancellationSignal cancellation = ctx.options().cancellation();
        if (cancellation.isCancelled()) {
            log.info("Deployment {} cancelled before level {}: {}", ctx.deploymentId(), level, cancellation.reason());
            ctx.markCancelled();
            ctx.addError(null, DeploymentPhase.DEPLOYMENT, "Deployment cancelled: " + cancellation.reason(), null);
            return false;
        }
        if (ctx.deadlineExceeded()) {
            addTimeoutError(ctx);
            return false;
        }
        if (!ctx.options().continueOnFailure() && ctx.hasFailures()) {
            log.info("Stopping deployment {} before level {}: a resource failed and continueOnFailure is off",
                    ctx.deploymentId(), level);
            return false;
        }
        return true;
    }

    private static void addTimeoutError(DeploymentContext ctx) {
        log.warn("Deployment {} exceeded its {}s timeout", ctx.deploymentId(), ctx.options().timeout().toSeconds());
        ctx.addError(null, DeploymentPhase.DEPLOYMENT,
                "Deployment timed out after " + ctx.options().timeout().toMillis() + "ms", null);
    }

    private void runLevel(DeploymentContext ctx, int level, List<String> ids, ExecutorService executor) {
        MdcContext.setLevel(ctx.deploymentId(), level);
        var toStart = new ArrayList<String>();
        for (String id : ids) {
            Optional<String> failedDependency = ctx.failedDependency(id);
            if (failedDependency.isPresent()) {
                skip(ctx, id, failedDependency.get());
            } else {
                toStart.add(id);
            }
        }
        if (toStart.isEmpty()) {
            return;
        }
        if (metrics != null) {
            metrics.recordLevelSize(toStart.size());
        }
        log.info("Dispatching level {} ({} resources): {}", level, toStart.size(), toStart);
        ctx.emitter().emit(DeploymentEventType.PROGRESS, null, "Deploying level " + level,
                Map.of("level", level, "resources", List.copyOf(toStart)));

        var futures = new ArrayList<CompletableFuture<Void>>();
        for (String id : toStart) {
            futures.add(CompletableFuture.runAsync(() -> deployResource(ctx, id, level), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("Unexpected error in level {} of deployment {}", level, ctx.deploymentId(), e);
            ctx.addError(null, DeploymentPhase.DEPLOYMENT, "Level " + level + " failed: " + e.getMessage(), e);
        }
    }

    void deployResource(DeploymentContext ctx, String id, int level) {
        MdcContext.setResource(ctx.deploymentId(), id, level);
        GraphResource resource = ctx.graph().resource(id);
        try {
            ObjectNode manifest = resolver.resolve(ctx, resource);
            ResourceKey key = ResourceKey.of(manifest, null);
            ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, "Applying " + key,
                    Map.of("status", "applying", "level", level));

            ObjectNode stored = applier.apply(id, manifest, ctx.options().retryPolicy(), ctx.emitter());
            var deployed = new DeployedResource(id, key.kind(), key.name(), key.namespace(), manifest,
                    ResourceStatus.DEPLOYED, Instant.now(), null);
            ctx.putLiveObject(id, stored);
            ctx.record(deployed);
            log.info("Applied {} as '{}'", key, id);
            ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, "Applied " + key,
                    Map.of("status", "deployed", "level", level));

            if (!ctx.options().waitForReady()) {
                return;
            }
            ObjectNode live = waiter.awaitReady(ctx, id, key, resource.readinessEvaluator());
            ctx.putLiveObject(id, live);
            ctx.record(deployed.withStatus(ResourceStatus.READY));
        } catch (ReferenceResolutionError e) {
            fail(ctx, resource, DeploymentPhase.VALIDATION, e);
        } catch (ApplyError e) {
            fail(ctx, resource, DeploymentPhase.APPLY, e);
        } catch (ReadinessTimeoutError | ResourceFailedError e) {
            fail(ctx, resource, DeploymentPhase.READINESS, e);
        } catch (RuntimeException e) {
            fail(ctx, resource, DeploymentPhase.APPLY, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void fail(DeploymentContext ctx, GraphResource resource, DeploymentPhase phase, RuntimeException e) {
        String id = resource.id();
        log.warn("Resource '{}' failed during {}: {}", id, phase, e.getMessage());
        ctx.markFailed(id);
        DeployedResource failed = ctx.resource(id)
                .map(r -> r.failed(e.getMessage()))
                .orElseGet(() -> new DeployedResource(id, resource.kind(), resource.name(), resource.namespace(),
                        null, ResourceStatus.FAILED, null, e.getMessage()));
        ctx.record(failed);
        ctx.addError(id, phase, e.getMessage(), e);
        ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, e.getMessage(),
                Map.of("status", "failed", "phase", phase.name()));
    }

    private void skip(DeploymentContext ctx, String id, String failedDependency) {
        GraphResource resource = ctx.graph().resource(id);
        var error = new DependencyFailedError(id, failedDependency);
        log.warn(error.getMessage());
        ctx.markFailed(id);
        ctx.record(new DeployedResource(id, resource.kind(), resource.name(), resource.namespace(), null,
                ResourceStatus.FAILED, null, error.getMessage()));
        ctx.addError(id, DeploymentPhase.DEPENDENCY, error.getMessage(), error);
        ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, error.getMessage(),
                Map.of("status", "failed", "phase", DeploymentPhase.DEPENDENCY.name(),
                       "failedDependency", failedDependency));
    }

    private DeploymentResult dryRun(DeploymentContext ctx) {
        for (String id : ctx.dependencyGraph().topologicalOrder()) {
            GraphResource resource = ctx.graph().resource(id);
            ObjectNode manifest = resolver.preview(ctx, resource);
            ResourceKey key = ResourceKey.of(manifest, null);
            ctx.record(new DeployedResource(id, key.kind(), key.name(), key.namespace(), manifest,
                    ResourceStatus.DEPLOYED, null, null));
            ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, "Would apply " + key,
                    Map.of("status", "dry-run", "level", ctx.dependencyGraph().levelOf(id)));
        }
        return ctx.toResult(Map.of());
    }

    private static ExecutorService newExecutor(DeploymentContext ctx) {
        int widest = ctx.dependencyGraph().levels().stream().mapToInt(List::size).max().orElse(1);
        int threads = Math.max(1, Math.min(ctx.options().maxParallel(), widest));
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "deploy-" + ctx.deploymentId() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
