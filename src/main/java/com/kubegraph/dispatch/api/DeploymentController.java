package com.kubegraph.dispatch.api;

import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.engine.DeploymentEngine;
import com.kubegraph.core.engine.DeploymentOptions;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.DeploymentStatus;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.model.RollbackResult;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * REST controller for deployment lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/deployments")
public class DeploymentController {

    private static final Logger log = LoggerFactory.getLogger(DeploymentController.class);

    private final DeploymentEngine engine;
    private final GraphDefinitionLoader loader;
    private final SseStreamingService sseStreamingService;
    private final Executor deploymentExecutor;

    public DeploymentController(DeploymentEngine engine,
                                GraphDefinitionLoader loader,
                                SseStreamingService sseStreamingService,
                                @Qualifier("deploymentExecutor") Executor deploymentExecutor) {
        this.engine = engine;
        this.loader = loader;
        this.sseStreamingService = sseStreamingService;
        this.deploymentExecutor = deploymentExecutor;
    }

    /**
     * POST /api/v1/deployments: Submit a graph definition (YAML or JSON). Runs asynchronously.
     */
    @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, "application/yaml", "application/x-yaml",
            MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Map<String, String>> submitDeployment(
            @RequestBody String definition,
            @RequestParam(required = false) String strategy,
            @RequestParam(required = false) Boolean wait,
            @RequestParam(required = false) String namespace,
            @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
        DeploymentOptions.Builder options = engine.defaultOptions().dryRun(dryRun);
        if (strategy != null) {
            try {
                options.strategy(DeploymentOptions.Strategy.parse(strategy));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid strategy: " + strategy));
            }
        }
        if (wait != null) {
            options.waitForReady(wait);
        }
        if (namespace != null && !namespace.isBlank()) {
            options.namespace(namespace);
        }

        ResourceGraph graph;
        try {
            graph = loader.load(definition);
        } catch (KubegraphException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        String deploymentId = engine.deployAsync(graph, options.build(), deploymentExecutor);
        log.info("Accepted deployment {} of '{}'", deploymentId, graph.name());
        return ResponseEntity.accepted().body(Map.of(
                "deploymentId", deploymentId,
                "status", DeploymentStatus.RUNNING.wireName()
        ));
    }

    /**
     * GET /api/v1/deployments: List finished deployments.
     */
    @GetMapping
    public ResponseEntity<List<DeploymentResult>> listDeployments() {
        return ResponseEntity.ok(engine.list());
    }

    /**
     * GET /api/v1/deployments/{id}: Result of a deployment, or {@code running} while it is in flight.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getDeployment(@PathVariable String id) {
        if (engine.isRunning(id)) {
            return ResponseEntity.ok(Map.of("deploymentId", id, "status", DeploymentStatus.RUNNING.wireName()));
        }
        Optional<DeploymentResult> result = engine.find(id);
        if (result.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result.get());
    }

    /**
     * GET /api/v1/deployments/{id}/events: SSE stream of deployment events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    /**
     * POST /api/v1/deployments/{id}/rollback: Delete what a finished deployment applied.
     */
    @PostMapping("/{id}/rollback")
    public ResponseEntity<?> rollback(@PathVariable String id) {
        if (engine.isRunning(id)) {
            return ResponseEntity.status(409).body(Map.of("error", "Deployment " + id + " is still running"));
        }
        Optional<RollbackResult> rollback = engine.rollback(id);
        if (rollback.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rollback.get());
    }
}
