package com.kubegraph.core.engine;

/**
 * An embedded reference could not be resolved at apply time. Never retried.
 */
public class ReferenceResolutionError extends ApplyError {

    private final String reference;

    public ReferenceResolutionError(String resourceId, String reference, String message) {
        super(resourceId, 0, message, null);
        this.reference = reference;
    }

    public ReferenceResolutionError(String resourceId, String reference, String message, Throwable cause) {
        super(resourceId, 0, message, cause);
        this.reference = reference;
    }

    /** The unresolved path, e.g. {@code resources.db.status.host}. */
    public String reference() {
        return reference;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
