package com.kubegraph.core.serialization;

import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.readiness.ConditionReadiness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphDefinitionLoaderTest {

    private static final String WEBAPP = """
            name: web-app
            schema:
              spec:
                replicas: 3
                image: nginx:1.27
            resources:
              - id: web
                template:
                  apiVersion: apps/v1
                  kind: Deployment
                  metadata:
                    name: web
                  spec:
                    replicas: ${schema.spec.replicas}
                readyWhen:
                  - "${resources.web.status.availableReplicas > 0}"
              - id: svc
                template:
                  apiVersion: v1
                  kind: Service
                  metadata:
                    name: web-svc
                  spec:
                    selector:
                      app: ${resources.web.metadata.name}
            externals:
              - id: db
                kind: Service
                name: postgres
                namespace: data
            status:
              ready: "${resources.web.status.readyReplicas > 0}"
            """;

    private final GraphDefinitionLoader loader = new GraphDefinitionLoader(new ExpressionEvaluator());

    @Test
    @DisplayName("loads name, schema, resources, externals and status")
    void loadsFullDefinition() {
        ResourceGraph graph = loader.load(WEBAPP);

        assertEquals("web-app", graph.name());
        assertEquals("WebApp", graph.kind());
        assertEquals(3, graph.schemaSpec().get("replicas"));
        assertEquals(List.of("web", "svc"), graph.resources().stream().map(GraphResource::id).toList());
        assertEquals(new ResourceKey("v1", "Service", "data", "postgres"), graph.externals().get("db"));
        assertEquals("${resources.web.status.readyReplicas > 0}", graph.statusProjection().get("ready"));
    }

    @Test
    @DisplayName("interpolations stay as text in the templates")
    void keepsInterpolationText() {
        GraphResource svc = loader.load(WEBAPP).resource("svc");

        @SuppressWarnings("unchecked")
        var spec = (Map<String, Object>) svc.manifest().get("spec");
        assertEquals(Map.of("app", "${resources.web.metadata.name}"), spec.get("selector"));
        assertEquals("Service", svc.kind());
        assertEquals("web-svc", svc.name());
    }

    @Test
    @DisplayName("readyWhen builds a condition evaluator and keeps the source text")
    void readyWhen() {
        ResourceGraph graph = loader.load(WEBAPP);

        GraphResource web = graph.resource("web");
        assertInstanceOf(ConditionReadiness.class, web.readinessEvaluator());
        assertEquals(List.of("${resources.web.status.availableReplicas > 0}"), web.readyWhen());
        assertNull(graph.resource("svc").readinessEvaluator());
    }

    @Test
    @DisplayName("reads from a file")
    void loadsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("graph.yaml");
        Files.writeString(file, WEBAPP);

        assertEquals("web-app", loader.load(file).name());
    }

    @Test
    @DisplayName("missing file, missing name and empty resources are construction errors")
    void invalidDefinitions(@TempDir Path dir) {
        assertThrows(ConstructionError.class, () -> loader.load(dir.resolve("absent.yaml")));
        assertThrows(ConstructionError.class, () -> loader.load("resources: []"));
        assertThrows(ConstructionError.class, () -> loader.load("name: empty\nresources: []"));
        assertThrows(ConstructionError.class, () -> loader.load("- just\n- a list"));

        ConstructionError error = assertThrows(ConstructionError.class,
                () -> loader.load("name: x\nresources:\n  - id: web\n"));
        assertEquals(List.of("web"), error.resourceIds());
    }
}
