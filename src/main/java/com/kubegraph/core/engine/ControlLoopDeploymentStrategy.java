package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.logging.MdcContext;
import com.kubegraph.core.model.DeployedResource;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.ResourceStatus;
import com.kubegraph.core.readiness.ControlLoopReadiness;
import com.kubegraph.core.readiness.ReadinessEvaluator;
import com.kubegraph.core.serialization.ControlLoopManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hands the compiled graph to the kro controller: applies the ResourceGraphDefinition, waits
 * for it to become active, then creates the instance and waits for it to sync. The controller
 * evaluates the embedded CEL against live state.
 */
public class ControlLoopDeploymentStrategy implements DeploymentStrategy {

    private static final Logger log = LoggerFactory.getLogger(ControlLoopDeploymentStrategy.class);

    static final String DEFINITION_ID = "resource-graph-definition";
    static final String INSTANCE_ID = "instance";

    private static final Set<String> CONTROLLER_STATUS_FIELDS = Set.of("conditions", "state", "observedGeneration");

    private final ControlLoopManifestWriter writer;
    private final ResourceApplier applier;
    private final ReadinessWaiter waiter;
    private final ObjectMapper mapper;

    public ControlLoopDeploymentStrategy(ControlLoopManifestWriter writer, ResourceApplier applier,
                                         ReadinessWaiter waiter, ObjectMapper mapper) {
        this.writer = writer;
        this.applier = applier;
        this.waiter = waiter;
        this.mapper = mapper;
    }

    @Override
    public DeploymentOptions.Strategy type() {
        return DeploymentOptions.Strategy.CONTROL_LOOP;
    }

    @Override
    public DeploymentResult deploy(DeploymentContext ctx) {
        ObjectNode definition = writer.toResourceGraphDefinition(ctx.graph());
        ObjectNode instance = writer.toInstance(ctx.graph(), ctx.options().namespace());

        if (ctx.options().dryRun()) {
            record(ctx, DEFINITION_ID, definition, ResourceStatus.DEPLOYED, null);
            record(ctx, INSTANCE_ID, instance, ResourceStatus.DEPLOYED, null);
            return ctx.toResult(Map.of());
        }

        if (!step(ctx, DEFINITION_ID, definition, 0, ControlLoopReadiness::definition)) {
            skipInstance(ctx, instance);
            return ctx.toResult(Map.of());
        }
        if (ctx.options().cancellation().isCancelled()) {
            ctx.markCancelled();
            ctx.addError(null, DeploymentPhase.DEPLOYMENT,
                    "Deployment cancelled: " + ctx.options().cancellation().reason(), null);
            return ctx.toResult(Map.of());
        }
        step(ctx, INSTANCE_ID, instance, 1, ControlLoopReadiness::instance);
        return ctx.toResult(instanceStatus(ctx.liveObject(INSTANCE_ID)));
    }

    private boolean step(DeploymentContext ctx, String id, ObjectNode manifest, int level,
                         ReadinessEvaluator evaluator) {
        MdcContext.setResource(ctx.deploymentId(), id, level);
        ResourceKey key = ResourceKey.of(manifest, null);
        try {
            ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, "Applying " + key,
                    Map.of("status", "applying", "level", level));
            ObjectNode stored = applier.apply(id, manifest, ctx.options().retryPolicy(), ctx.emitter());
            ctx.putLiveObject(id, stored);
            DeployedResource deployed = record(ctx, id, manifest, ResourceStatus.DEPLOYED, Instant.now());
            log.info("Applied {}", key);
            if (ctx.options().waitForReady()) {
                ctx.putLiveObject(id, waiter.awaitReady(ctx, id, key, evaluator));
                ctx.record(deployed.withStatus(ResourceStatus.READY));
            }
            return true;
        } catch (ApplyError e) {
            fail(ctx, id, key, manifest, DeploymentPhase.APPLY, e);
        } catch (ReadinessTimeoutError | ResourceFailedError e) {
            fail(ctx, id, key, manifest, DeploymentPhase.READINESS, e);
        } catch (KubegraphException e) {
            fail(ctx, id, key, manifest, DeploymentPhase.DEPLOYMENT, e);
        } finally {
            MdcContext.clear();
        }
        return false;
    }

    private void fail(DeploymentContext ctx, String id, ResourceKey key, ObjectNode manifest,
                      DeploymentPhase phase, RuntimeException e) {
        log.warn("{} failed during {}: {}", key, phase, e.getMessage());
        ctx.markFailed(id);
        DeployedResource failed = ctx.resource(id)
                .map(r -> r.failed(e.getMessage()))
                .orElseGet(() -> new DeployedResource(id, key.kind(), key.name(), key.namespace(), manifest,
                        ResourceStatus.FAILED, null, e.getMessage()));
        ctx.record(failed);
        ctx.addError(id, phase, e.getMessage(), e);
        ctx.emitter().emit(DeploymentEventType.RESOURCE_STATUS, id, e.getMessage(),
                Map.of("status", "failed", "phase", phase.name()));
    }

    private void skipInstance(DeploymentContext ctx, ObjectNode instance) {
        var error = new DependencyFailedError(INSTANCE_ID, DEFINITION_ID);
        ResourceKey key = ResourceKey.of(instance, null);
        ctx.markFailed(INSTANCE_ID);
        ctx.record(new DeployedResource(INSTANCE_ID, key.kind(), key.name(), key.namespace(), instance,
                ResourceStatus.FAILED, null, error.getMessage()));
        ctx.addError(INSTANCE_ID, DeploymentPhase.DEPENDENCY, error.getMessage(), error);
    }

    private static DeployedResource record(DeploymentContext ctx, String id, ObjectNode manifest,
                                           ResourceStatus status, Instant deployedAt) {
        ResourceKey key = ResourceKey.of(manifest, null);
        var resource = new DeployedResource(id, key.kind(), key.name(), key.namespace(), manifest, status,
                deployedAt, null);
        ctx.record(resource);
        return resource;
    }

    /** Status fields written by the controller from the projection; kro's own fields are left out. */
    private Map<String, Object> instanceStatus(ObjectNode live) {
        var values = new LinkedHashMap<String, Object>();
        if (live == null) {
            return values;
        }
        live.path("status").fields().forEachRemaining(field -> {
            if (!CONTROLLER_STATUS_FIELDS.contains(field.getKey())) {
                values.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        });
        return values;
    }
}
