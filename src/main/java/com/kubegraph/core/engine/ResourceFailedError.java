package com.kubegraph.core.engine;

import com.kubegraph.core.KubegraphException;

/**
 * The cluster reports the resource as failed (e.g. a Job past its backoff limit); polling stops.
 */
public class ResourceFailedError extends KubegraphException {

    private final String resourceId;
    private final String reason;

    public ResourceFailedError(String resourceId, String reason, String message) {
        super("Resource '" + resourceId + "' failed [" + reason + "]: " + message);
        this.resourceId = resourceId;
        this.reason = reason;
    }

    public String resourceId() {
        return resourceId;
    }

    public String reason() {
        return reason;
    }
}
