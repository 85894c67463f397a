package com.kubegraph.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;

import java.util.List;
import java.util.Map;

/**
 * Serializes a graph as a kro {@code ResourceGraphDefinition}, with every reference and
 * expression embedded as a {@code ${...}} CEL string, plus the instance that activates it.
 */
public class ControlLoopManifestWriter {

    public static final String KRO_API_VERSION = "kro.run/v1alpha1";
    public static final String RGD_KIND = "ResourceGraphDefinition";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private final ExpressionCompiler compiler;
    private final ObjectMapper mapper;

    public ControlLoopManifestWriter(ExpressionCompiler compiler, ObjectMapper mapper) {
        this.compiler = compiler;
        this.mapper = mapper;
    }

    public ObjectNode toResourceGraphDefinition(ResourceGraph graph) {
        ObjectNode rgd = mapper.createObjectNode();
        rgd.put("apiVersion", KRO_API_VERSION);
        rgd.put("kind", RGD_KIND);
        rgd.putObject("metadata").put("name", kebabCase(graph.name()));

        ObjectNode spec = rgd.putObject("spec");
        ObjectNode schema = spec.putObject("schema");
        schema.put("apiVersion", graph.apiVersion());
        schema.put("kind", graph.kind());
        schema.set("spec", schemaTypes(graph.schemaSpec()));
        schema.set("status", mapper.valueToTree(compiler.toManifest(graph.statusProjection())));

        ArrayNode resources = spec.putArray("resources");
        for (GraphResource resource : graph.resources()) {
            ObjectNode entry = resources.addObject();
            entry.put("id", resource.id());
            entry.set("template", mapper.valueToTree(compiler.toManifest(resource.manifest())));
            if (!resource.readyWhen().isEmpty()) {
                ArrayNode readyWhen = entry.putArray("readyWhen");
                for (String condition : resource.readyWhen()) {
                    readyWhen.add(String.valueOf(compiler.toManifest(wrap(condition))));
                }
            }
        }
        return rgd;
    }

    /** The custom resource that makes the control loop reconcile the graph. */
    public ObjectNode toInstance(ResourceGraph graph, String namespace) {
        ObjectNode instance = mapper.createObjectNode();
        instance.put("apiVersion", KRO_API_VERSION);
        instance.put("kind", graph.kind());
        ObjectNode metadata = instance.putObject("metadata");
        metadata.put("name", kebabCase(graph.name()));
        if (namespace != null) {
            metadata.put("namespace", namespace);
        }
        instance.set("spec", mapper.valueToTree(graph.schemaSpec()));
        return instance;
    }

    public String toYaml(ResourceGraph graph) {
        return yaml(toResourceGraphDefinition(graph));
    }

    public static String yaml(Object value) {
        try {
            return YAML.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new KubegraphException("Failed to write YAML: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * kro simple-schema types inferred from the input values, e.g. {@code string | default="web"}.
     */
    ObjectNode schemaTypes(Map<String, Object> values) {
        ObjectNode types = mapper.createObjectNode();
        values.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, Object> fields = (Map<String, Object>) nested;
                types.set(key, schemaTypes(fields));
            } else {
                types.put(key, simpleType(value));
            }
        });
        return types;
    }

    static String simpleType(Object value) {
        if (value instanceof List<?> list) {
            return "[]" + (list.isEmpty() ? "string" : scalarType(list.get(0)));
        }
        if (value == null) {
            return "string";
        }
        String literal = value instanceof String text ? "\"" + text.replace("\"", "\\\"") + "\"" : value.toString();
        return scalarType(value) + " | default=" + literal;
    }

    private static String scalarType(Object value) {
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Integer || value instanceof Long) {
            return "integer";
        }
        if (value instanceof Number) {
            return "number";
        }
        return "string";
    }

    private static String wrap(String condition) {
        return condition.contains("${") ? condition : "${" + condition + "}";
    }

    /** {@code MyWebApp} and {@code my_web app} both become {@code my-web-app}. */
    public static String kebabCase(String name) {
        var sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && sb.length() > 0 && sb.charAt(sb.length() - 1) != '-') {
                    sb.append('-');
                }
                sb.append(Character.toLowerCase(c));
            } else if (c == '_' || c == ' ' || c == '.') {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '-') {
                    sb.append('-');
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
