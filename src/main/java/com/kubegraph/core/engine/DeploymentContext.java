package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.graph.DependencyGraph;
import com.kubegraph.core.model.DeployedResource;
import com.kubegraph.core.model.DeploymentError;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.DeploymentStatus;
import com.kubegraph.core.model.ResourceGraph;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * State of one deploy call: the id to {@link DeployedResource} map, live objects read back from
 * the cluster, accumulated errors. Discarded when the call returns.
 */
public class DeploymentContext {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String deploymentId;
    private final ResourceGraph graph;
    private final DependencyGraph dependencyGraph;
    private final DeploymentOptions options;
    private final DeploymentEventEmitter emitter;
    private final long startedAtNanos = System.nanoTime();
    private final long deadlineMillis;

    private final Map<String, DeployedResource> resources = new ConcurrentHashMap<>();
    private final List<String> attemptOrder = new CopyOnWriteArrayList<>();
    private final Map<String, ObjectNode> liveObjects = new ConcurrentHashMap<>();
    private final List<DeploymentError> errors = new CopyOnWriteArrayList<>();
    private final Set<String> failed = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public DeploymentContext(String deploymentId, ResourceGraph graph, DependencyGraph dependencyGraph,
                             DeploymentOptions options, DeploymentEventEmitter emitter) {
        this.deploymentId = deploymentId;
        this.graph = graph;
        this.dependencyGraph = dependencyGraph;
        this.options = options;
        this.emitter = emitter;
        this.deadlineMillis = System.currentTimeMillis() + options.timeout().toMillis();
    }

    public String deploymentId() { return deploymentId; }
    public ResourceGraph graph() { return graph; }
    public DependencyGraph dependencyGraph() { return dependencyGraph; }
    public DeploymentOptions options() { return options; }
    public DeploymentEventEmitter emitter() { return emitter; }

    public void record(DeployedResource resource) {
        if (resources.put(resource.id(), resource) == null) {
            attemptOrder.add(resource.id());
        }
    }

    public Optional<DeployedResource> resource(String id) {
        return Optional.ofNullable(resources.get(id));
    }

    public void putLiveObject(String id, ObjectNode live) {
        liveObjects.put(id, live);
    }

    public ObjectNode liveObject(String id) {
        return liveObjects.get(id);
    }

    public Map<String, ObjectNode> liveObjects() {
        return liveObjects;
    }

    public void addError(DeploymentError error) {
        errors.add(error);
    }

    public void addError(String resourceId, DeploymentPhase phase, String message, Throwable cause) {
        errors.add(DeploymentError.of(resourceId, phase, message, cause));
    }

    public List<DeploymentError> errors() {
        return List.copyOf(errors);
    }

    public void markFailed(String id) {
        failed.add(id);
    }

    public boolean isFailed(String id) {
        return failed.contains(id);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /** First failed dependency of {@code id}, if any. */
    public Optional<String> failedDependency(String id) {
        return dependencyGraph.dependenciesOf(id).stream().filter(failed::contains).sorted().findFirst();
    }

    /** Records that the cancellation signal stopped the deploy; the result is then reported partial. */
    public void markCancelled() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean deadlineExceeded() {
        return System.currentTimeMillis() >= deadlineMillis;
    }

    /** Wall-clock instant, in epoch millis, at which the overall deploy timeout expires. */
    public long deadlineAtMillis() {
        return deadlineMillis;
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }

    /** The graph's input values wrapped as {@code {"spec": ...}}, so {@code schema.spec.x} paths read from it. */
    public JsonNode schemaRoot() {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("spec", MAPPER.valueToTree(graph.schemaSpec()));
        return root;
    }

    /** Resources in the order they were first attempted. */
    public List<DeployedResource> resourcesInOrder() {
        var ordered = new ArrayList<DeployedResource>();
        for (String id : attemptOrder) {
            ordered.add(resources.get(id));
        }
        return ordered;
    }

    public DeploymentResult toResult(Map<String, Object> statusValues) {
        List<DeployedResource> ordered = resourcesInOrder();
        List<DeploymentError> all = errors();
        DeploymentStatus status = cancelled
                ? DeploymentStatus.PARTIAL
                : DeploymentResult.statusOf(ordered, all, options.waitForReady());
        return new DeploymentResult(deploymentId, ordered, dependencyGraph, elapsed(), status, all, statusValues);
    }
}
