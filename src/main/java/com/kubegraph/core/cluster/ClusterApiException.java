package com.kubegraph.core.cluster;

import com.kubegraph.core.KubegraphException;

/**
 * Failure reported by the cluster API. Network failures carry status code {@link #NETWORK_ERROR}.
 */
public class ClusterApiException extends KubegraphException {

    public static final int NETWORK_ERROR = -1;

    private final int statusCode;

    public ClusterApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ClusterApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }
}
