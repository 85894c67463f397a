package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.kubegraph.core.reference.FieldPaths;

/**
 * Null-tolerant accessors for observed objects.
 */
final class LiveObjects {

    private LiveObjects() {}

    static int intAt(JsonNode object, String path, int defaultValue) {
        return FieldPaths.read(object, path).filter(JsonNode::isNumber).map(JsonNode::asInt).orElse(defaultValue);
    }

    static String textAt(JsonNode object, String path, String defaultValue) {
        return FieldPaths.read(object, path).map(JsonNode::asText).orElse(defaultValue);
    }

    static boolean boolAt(JsonNode object, String path) {
        return FieldPaths.read(object, path).map(JsonNode::asBoolean).orElse(false);
    }

    static boolean has(JsonNode object, String path) {
        return FieldPaths.read(object, path).isPresent();
    }

    /** True when {@code status} is absent or null. */
    static boolean statusMissing(JsonNode object) {
        return object == null || !has(object, "status");
    }

    /** Status of the named condition ({@code True}/{@code False}/{@code Unknown}), or null. */
    static String conditionStatus(JsonNode object, String type) {
        JsonNode condition = condition(object, type);
        return condition == null ? null : condition.path("status").asText(null);
    }

    static JsonNode condition(JsonNode object, String type) {
        JsonNode conditions = FieldPaths.read(object, "status.conditions").orElse(null);
        if (conditions == null || !conditions.isArray()) {
            return null;
        }
        for (JsonNode condition : conditions) {
            if (type.equals(condition.path("type").asText())) {
                return condition;
            }
        }
        return null;
    }

    static int arraySize(JsonNode object, String path) {
        return FieldPaths.read(object, path).filter(JsonNode::isArray).map(JsonNode::size).orElse(0);
    }
}
