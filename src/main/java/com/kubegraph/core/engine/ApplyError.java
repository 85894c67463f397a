package com.kubegraph.core.engine;

import com.kubegraph.core.KubegraphException;

import java.util.Set;

/**
 * A create-or-update call failed. Classified as transient (retried) or permanent by status code.
 */
public class ApplyError extends KubegraphException {

    private static final Set<Integer> TRANSIENT_CODES = Set.of(-1, 408, 429, 500, 502, 503, 504);

    private final String resourceId;
    private final int statusCode;

    public ApplyError(String resourceId, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
        this.statusCode = statusCode;
    }

    public String resourceId() {
        return resourceId;
    }

    /** HTTP status, or {@code -1} for network errors. */
    public int statusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return isTransientStatus(statusCode);
    }

    public static boolean isTransientStatus(int statusCode) {
        return TRANSIENT_CODES.contains(statusCode);
    }
}
