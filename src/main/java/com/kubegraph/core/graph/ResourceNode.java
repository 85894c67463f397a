package com.kubegraph.core.graph;

import java.util.Map;
import java.util.Set;

/**
 * A resource placed in the dependency graph, rebuilt on every deploy call.
 *
 * @param id           resource id
 * @param kind         resource kind, e.g. {@code Deployment}
 * @param manifest     manifest as authored, references still embedded
 * @param dependencies ids of in-graph resources this one reads from
 * @param level        0 without dependencies, else one more than its deepest dependency
 */
public record ResourceNode(String id, String kind, Map<String, Object> manifest, Set<String> dependencies, int level) {

    public ResourceNode {
        dependencies = Set.copyOf(dependencies);
    }
}
