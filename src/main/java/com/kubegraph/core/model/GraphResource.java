package com.kubegraph.core.model;

import com.kubegraph.core.readiness.ReadinessEvaluator;

import java.util.List;
import java.util.Map;

/**
 * One resource template in a graph. The manifest may hold references and expressions anywhere.
 *
 * @param id                 graph-unique id, used in {@code resources.<id>} paths
 * @param manifest           the object to apply, as nested maps and lists
 * @param readinessEvaluator optional bespoke evaluator; the registry's evaluator for the kind is
 *                           used when null
 * @param readyWhen          source text of the readiness conditions the evaluator was built from,
 *                           kept so the control-loop definition can carry them
 */
public record GraphResource(String id,
                            Map<String, Object> manifest,
                            ReadinessEvaluator readinessEvaluator,
                            List<String> readyWhen) {

    public GraphResource {
        readyWhen = readyWhen == null ? List.of() : List.copyOf(readyWhen);
    }

    public GraphResource(String id, Map<String, Object> manifest) {
        this(id, manifest, null, List.of());
    }

    public GraphResource(String id, Map<String, Object> manifest, ReadinessEvaluator readinessEvaluator) {
        this(id, manifest, readinessEvaluator, List.of());
    }

    public String kind() {
        Object kind = manifest.get("kind");
        return kind == null ? "" : kind.toString();
    }

    public String apiVersion() {
        Object apiVersion = manifest.get("apiVersion");
        return apiVersion == null ? "v1" : apiVersion.toString();
    }

    /** {@code metadata.name} when it is a plain string, otherwise null. */
    public String name() {
        return metadataString("name");
    }

    public String namespace() {
        return metadataString("namespace");
    }

    private String metadataString(String key) {
        if (manifest.get("metadata") instanceof Map<?, ?> metadata && metadata.get(key) instanceof String value) {
            return value;
        }
        return null;
    }
}
