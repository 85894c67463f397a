package com.kubegraph.core.engine;

import com.kubegraph.core.KubegraphException;

import java.time.Duration;

public class ReadinessTimeoutError extends KubegraphException {

    private final String resourceId;
    private final Duration timeout;
    private final String lastMessage;

    private final boolean deploymentDeadline;

    public ReadinessTimeoutError(String resourceId, Duration timeout, String lastMessage) {
        this(resourceId, timeout, lastMessage, false,
                "Resource '" + resourceId + "' not ready after " + timeout.toSeconds() + "s: " + lastMessage);
    }

    private ReadinessTimeoutError(String resourceId, Duration timeout, String lastMessage,
                                  boolean deploymentDeadline, String message) {
        super(message);
        this.resourceId = resourceId;
        this.timeout = timeout;
        this.lastMessage = lastMessage;
        this.deploymentDeadline = deploymentDeadline;
    }

    /** The overall deploy deadline ended the wait before the readiness timeout did. */
    public static ReadinessTimeoutError deadlineReached(String resourceId, Duration waited, String lastMessage) {
        return new ReadinessTimeoutError(resourceId, waited, lastMessage, true,
                "Resource '" + resourceId + "' not ready when the deployment timeout expired (waited "
                        + waited.toMillis() + "ms): " + lastMessage);
    }

    public String resourceId() {
        return resourceId;
    }

    /** The readiness timeout, or the time actually waited when the deploy deadline ended the wait. */
    public Duration timeout() {
        return timeout;
    }

    public boolean deploymentDeadline() {
        return deploymentDeadline;
    }

    /** Message of the last verdict observed before giving up. */
    public String lastMessage() {
        return lastMessage;
    }
}
