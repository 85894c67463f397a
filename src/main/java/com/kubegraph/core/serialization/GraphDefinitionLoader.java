package com.kubegraph.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.readiness.ConditionReadiness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a graph definition from YAML (or JSON):
 * <pre>
 * name: webapp
 * schema:
 *   spec:
 *     replicas: 3
 * resources:
 *   - id: web
 *     template: { apiVersion: apps/v1, kind: Deployment, ... }
 *     readyWhen: ["${resources.web.status.availableReplicas > 0}"]
 * externals:
 *   - { id: db, apiVersion: v1, kind: Service, name: postgres, namespace: data }
 * status:
 *   ready: "${resources.web.status.readyReplicas > 0}"
 * </pre>
 * {@code ${...}} strings stay as text and are parsed where they are detected or evaluated.
 */
public class GraphDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphDefinitionLoader.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final ExpressionEvaluator evaluator;

    public GraphDefinitionLoader(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ResourceGraph load(Path file) {
        try {
            log.debug("Loading graph definition from {}", file);
            return load(Files.readString(file));
        } catch (IOException e) {
            throw new ConstructionError("Cannot read graph definition " + file + ": " + e.getMessage());
        }
    }

    /**
     * @throws ConstructionError on malformed input or missing required fields
     */
    public ResourceGraph load(String content) {
        JsonNode root;
        try {
            root = yaml.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConstructionError("Invalid graph definition: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ConstructionError("Graph definition must be a mapping");
        }
        String name = required(root, "name");
        ResourceGraph.Builder builder = ResourceGraph.builder(name);
        if (root.hasNonNull("apiVersion")) {
            builder.apiVersion(root.get("apiVersion").asText());
        }
        if (root.hasNonNull("kind")) {
            builder.kind(root.get("kind").asText());
        }
        toMap(root.path("schema").path("spec")).forEach(builder::spec);

        JsonNode resources = root.path("resources");
        if (!resources.isArray() || resources.isEmpty()) {
            throw new ConstructionError("Graph '" + name + "' declares no resources");
        }
        for (JsonNode entry : resources) {
            builder.resource(resource(entry));
        }
        for (JsonNode external : root.path("externals")) {
            builder.external(required(external, "id"), new ResourceKey(
                    external.path("apiVersion").asText("v1"),
                    required(external, "kind"),
                    external.path("namespace").asText(null),
                    required(external, "name")));
        }
        toMap(root.path("status")).forEach(builder::status);
        return builder.build();
    }

    private GraphResource resource(JsonNode entry) {
        String id = required(entry, "id");
        JsonNode template = entry.path("template");
        if (!template.isObject()) {
            throw new ConstructionError("Resource '" + id + "' has no template", List.of(id));
        }
        List<String> readyWhen = new ArrayList<>();
        for (JsonNode condition : entry.path("readyWhen")) {
            readyWhen.add(condition.asText());
        }
        ConditionReadiness evaluatorOverride = readyWhen.isEmpty()
                ? null
                : new ConditionReadiness(id, readyWhen, evaluator);
        return new GraphResource(id, toMap(template), evaluatorOverride, readyWhen);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return yaml.convertValue(node, MAP_TYPE);
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new ConstructionError("Graph definition is missing '" + field + "'");
        }
        return value.asText();
    }
}
