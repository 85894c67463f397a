package com.kubegraph.core.model;

import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.readiness.ReadinessEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Author-facing input: resources, the input spec they may read from, and the status projection.
 *
 * @param name             graph name; the control-loop definition is named after it
 * @param apiVersion       API version of the instance type the control loop will serve
 * @param kind             kind of that instance type
 * @param schemaSpec       concrete input values, read through {@code schema.spec.*}
 * @param resources        resources in declaration order
 * @param statusProjection status fields as expressions over the resources
 * @param externals        objects outside the graph that references may name, keyed by the id
 *                         used in {@code resources.<id>} paths
 */
public record ResourceGraph(String name,
                            String apiVersion,
                            String kind,
                            Map<String, Object> schemaSpec,
                            List<GraphResource> resources,
                            Map<String, Object> statusProjection,
                            Map<String, ResourceKey> externals) {

    public ResourceGraph {
        schemaSpec = schemaSpec == null ? Map.of() : schemaSpec;
        resources = List.copyOf(resources);
        statusProjection = statusProjection == null ? Map.of() : statusProjection;
        externals = externals == null ? Map.of() : Map.copyOf(externals);
    }

    public ResourceGraph(String name, String apiVersion, String kind, Map<String, Object> schemaSpec,
                         List<GraphResource> resources, Map<String, Object> statusProjection) {
        this(name, apiVersion, kind, schemaSpec, resources, statusProjection, Map.of());
    }

    public GraphResource resource(String id) {
        for (GraphResource resource : resources) {
            if (resource.id().equals(id)) {
                return resource;
            }
        }
        return null;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String apiVersion = "v1alpha1";
        private String kind;
        private final Map<String, Object> schemaSpec = new LinkedHashMap<>();
        private final List<GraphResource> resources = new ArrayList<>();
        private final Map<String, Object> statusProjection = new LinkedHashMap<>();
        private final Map<String, ResourceKey> externals = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder spec(String key, Object value) {
            schemaSpec.put(key, value);
            return this;
        }

        public Builder resource(String id, Map<String, Object> manifest) {
            resources.add(new GraphResource(id, manifest));
            return this;
        }

        public Builder resource(String id, Map<String, Object> manifest, ReadinessEvaluator evaluator) {
            resources.add(new GraphResource(id, manifest, evaluator));
            return this;
        }

        public Builder resource(GraphResource resource) {
            resources.add(resource);
            return this;
        }

        public Builder status(String field, Object expression) {
            statusProjection.put(field, expression);
            return this;
        }

        /** Declares an object that lives outside the graph but may be referenced by id. */
        public Builder external(String id, ResourceKey key) {
            externals.put(id, key);
            return this;
        }

        public ResourceGraph build() {
            String effectiveKind = kind != null ? kind : pascalCase(name);
            return new ResourceGraph(name, apiVersion, effectiveKind, schemaSpec, resources, statusProjection,
                    externals);
        }

        private static String pascalCase(String name) {
            var sb = new StringBuilder();
            boolean upper = true;
            for (char c : name.toCharArray()) {
                if (c == '-' || c == '_' || c == ' ') {
                    upper = true;
                } else {
                    sb.append(upper ? Character.toUpperCase(c) : c);
                    upper = false;
                }
            }
            return sb.toString();
        }
    }
}
