package com.kubegraph.core.engine;

import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.config.KubegraphProperties;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.events.EventBus;
import com.kubegraph.core.expression.CompileError;
import com.kubegraph.core.expression.CompileOptions;
import com.kubegraph.core.expression.CompileResult;
import com.kubegraph.core.expression.CompileTarget;
import com.kubegraph.core.expression.Diagnostic;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.expression.ExpressionContext;
import com.kubegraph.core.graph.DependencyGraph;
import com.kubegraph.core.graph.DependencyGraphBuilder;
import com.kubegraph.core.logging.MdcContext;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.model.DeploymentError;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.DeploymentStatus;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.model.RollbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Entry point for deploys: builds and validates the dependency graph, runs the selected
 * strategy, optionally rolls back, and always emits a terminal {@code completed} or
 * {@code failed} event.
 */
@Service
public class DeploymentEngine {

    private static final Logger log = LoggerFactory.getLogger(DeploymentEngine.class);

    private final DependencyGraphBuilder graphBuilder;
    private final ExpressionCompiler compiler;
    private final Map<DeploymentOptions.Strategy, DeploymentStrategy> strategies =
            new EnumMap<>(DeploymentOptions.Strategy.class);
    private final RollbackManager rollbackManager;
    private final DeploymentRegistry registry;
    private final EventBus eventBus;
    private final KubegraphMetrics metrics;
    private final KubegraphProperties properties;

    public DeploymentEngine(DependencyGraphBuilder graphBuilder,
                            ExpressionCompiler compiler,
                            List<DeploymentStrategy> strategies,
                            RollbackManager rollbackManager,
                            DeploymentRegistry registry,
                            EventBus eventBus,
                            KubegraphMetrics metrics,
                            KubegraphProperties properties) {
        this.graphBuilder = graphBuilder;
        this.compiler = compiler;
        for (DeploymentStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.rollbackManager = rollbackManager;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /** Options pre-filled from {@code kubegraph.*} configuration. */
    public DeploymentOptions.Builder defaultOptions() {
        return DeploymentOptions.fromProperties(properties);
    }

    public DeploymentResult deploy(ResourceGraph graph, DeploymentOptions options) {
        return deploy(newDeploymentId(), graph, options);
    }

    /**
     * Runs a deploy under a caller-chosen id.
     *
     * @throws ConstructionError on a dependency cycle or invalid graph, before anything is applied
     * @throws CompileError      on an expression that cannot be represented
     */
    public DeploymentResult deploy(String deploymentId, ResourceGraph graph, DeploymentOptions options) {
        var emitter = new DeploymentEventEmitter(deploymentId, options.progressCallback(), eventBus);
        DeploymentStrategy strategy;
        DependencyGraph dependencyGraph;
        try {
            strategy = strategies.get(options.strategy());
            if (strategy == null) {
                throw new KubegraphException("No deployment strategy registered for " + options.strategy());
            }
            dependencyGraph = graphBuilder.build(graph);
            validateExpressions(graph);
        } catch (KubegraphException e) {
            reject(deploymentId, emitter, e);
            throw e;
        }

        MdcContext.setDeployment(deploymentId);
        var ctx = new DeploymentContext(deploymentId, graph, dependencyGraph, options, emitter);
        registry.started(deploymentId);
        try {
            log.info("Starting deployment {} of '{}' ({} resources in {} levels, strategy {})",
                    deploymentId, graph.name(), dependencyGraph.size(), dependencyGraph.levels().size(),
                    options.strategy());
            emitter.emit(DeploymentEventType.STARTED, null, "Deploying " + graph.name(),
                    Map.of("strategy", options.strategy().name(), "resources", dependencyGraph.size(),
                           "levels", dependencyGraph.levels(), "dryRun", options.dryRun()));

            DeploymentResult result;
            try {
                result = strategy.deploy(ctx);
            } catch (RuntimeException e) {
                log.error("Deployment {} aborted: {}", deploymentId, e.getMessage(), e);
                ctx.addError(null, DeploymentPhase.DEPLOYMENT, "Deployment aborted: " + e.getMessage(), e);
                result = ctx.toResult(Map.of());
            }

            if (options.rollbackOnFailure() && !result.isSuccess() && !options.dryRun()) {
                RollbackResult rollback = rollbackManager.rollback(result, emitter);
                if (!rollback.errors().isEmpty()) {
                    var errors = new ArrayList<>(result.errors());
                    errors.addAll(rollback.errors());
                    result = new DeploymentResult(result.deploymentId(), result.resources(),
                            result.dependencyGraph(), result.duration(), result.status(), errors,
                            result.statusValues());
                }
            }

            finish(result, options, emitter);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Starts a deploy on {@code executor} and returns its id at once. Failures before the first
     * apply are stored as a failed result.
     */
    public String deployAsync(ResourceGraph graph, DeploymentOptions options, Executor executor) {
        String deploymentId = newDeploymentId();
        registry.started(deploymentId);
        executor.execute(() -> {
            try {
                deploy(deploymentId, graph, options);
            } catch (KubegraphException e) {
                log.debug("Async deployment {} ended with {}", deploymentId, e.getClass().getSimpleName());
            }
        });
        return deploymentId;
    }

    /** Records a deploy rejected before its first apply and emits its terminal failed event. */
    private void reject(String deploymentId, DeploymentEventEmitter emitter, KubegraphException e) {
        log.error("Deployment {} rejected: {}", deploymentId, e.getMessage());
        DeploymentResult rejected = new DeploymentResult(deploymentId, List.of(), null, Duration.ZERO,
                DeploymentStatus.FAILED,
                List.of(DeploymentError.of(null, DeploymentPhase.VALIDATION, e.getMessage(), e)), Map.of());
        registry.completed(rejected);
        emitter.emit(DeploymentEventType.FAILED, null, e.getMessage(),
                Map.of("status", DeploymentStatus.FAILED.wireName()));
    }

    public Optional<DeploymentResult> find(String deploymentId) {
        return registry.find(deploymentId);
    }

    public boolean isRunning(String deploymentId) {
        return registry.isRunning(deploymentId);
    }

    public List<DeploymentResult> list() {
        return registry.list();
    }

    /**
     * Deletes the applied resources of a finished deployment.
     *
     * @return empty when the id is unknown
     */
    public Optional<RollbackResult> rollback(String deploymentId) {
        return registry.find(deploymentId).map(result -> rollbackManager.rollback(result,
                new DeploymentEventEmitter(deploymentId, null, eventBus)));
    }

    /**
     * Compiles every embedded expression to CEL once, so unsupported syntax fails before any
     * apply. Status fields are checked in the status-field context.
     */
    void validateExpressions(ResourceGraph graph) {
        boolean strict = properties.getCompile().isStrict();
        for (GraphResource resource : graph.resources()) {
            try {
                compiler.toManifest(resource.manifest());
            } catch (CompileError e) {
                log.error("Resource '{}' holds an expression that cannot be compiled: {}", resource.id(), e.getMessage());
                throw e;
            }
        }
        var options = new CompileOptions(ExpressionContext.STATUS_FIELD, strict);
        graph.statusProjection().forEach((field, expression) -> {
            CompileResult compiled = compiler.compile(expression, CompileTarget.CEL, options);
            for (Diagnostic diagnostic : compiled.diagnostics()) {
                log.warn("Status field '{}': [{}] {}", field, diagnostic.code(), diagnostic.message());
            }
        });
    }

    private void finish(DeploymentResult result, DeploymentOptions options, DeploymentEventEmitter emitter) {
        var payload = new HashMap<String, Object>();
        payload.put("status", result.status().wireName());
        payload.put("durationMs", result.duration().toMillis());
        payload.put("errors", result.errors().size());
        if (result.status() == DeploymentStatus.FAILED) {
            log.error("Deployment {} failed with {} errors", result.deploymentId(), result.errors().size());
            emitter.emit(DeploymentEventType.FAILED, null, "Deployment failed", payload);
        } else {
            log.info("Deployment {} finished: {} in {}ms", result.deploymentId(), result.status().wireName(),
                    result.duration().toMillis());
            emitter.emit(DeploymentEventType.COMPLETED, null, "Deployment " + result.status().wireName(), payload);
        }
        if (metrics != null) {
            metrics.recordDeployment(options.strategy().name().toLowerCase(), result.status().wireName(),
                    result.duration());
        }
        registry.completed(result);
    }

    static String newDeploymentId() {
        return "deploy-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
