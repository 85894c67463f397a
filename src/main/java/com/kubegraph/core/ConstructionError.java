package com.kubegraph.core;

import java.util.List;

/**
 * The graph as authored cannot be built: a dependency cycle, a duplicate id, unsupported syntax
 * or a disallowed field path. Never retried.
 */
public class ConstructionError extends KubegraphException {

    private final List<String> resourceIds;

    public ConstructionError(String message, List<String> resourceIds) {
        super(message);
        this.resourceIds = List.copyOf(resourceIds);
    }

    public ConstructionError(String message) {
        this(message, List.of());
    }

    /** Ids involved in the error; for a cycle, its members in traversal order. */
    public List<String> resourceIds() {
        return resourceIds;
    }
}
