package com.kubegraph.core.engine;

import com.kubegraph.core.KubegraphException;

/**
 * Recorded for every transitive dependent of a failed resource; such resources are never applied.
 */
public class DependencyFailedError extends KubegraphException {

    private final String resourceId;
    private final String failedDependency;

    public DependencyFailedError(String resourceId, String failedDependency) {
        super("Resource '" + resourceId + "' skipped: dependency '" + failedDependency + "' failed");
        this.resourceId = resourceId;
        this.failedDependency = failedDependency;
    }

    public String resourceId() {
        return resourceId;
    }

    public String failedDependency() {
        return failedDependency;
    }
}
