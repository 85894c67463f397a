package com.kubegraph.core;

/**
 * Base type for every error raised by graph construction, compilation and deployment.
 */
public class KubegraphException extends RuntimeException {
    public KubegraphException(String message) {
        super(message);
    }

    public KubegraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
