package com.kubegraph.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing deploy-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setDeployment(String deploymentId) {
        MDC.put("deploymentId", deploymentId);
    }

    public static void setResource(String deploymentId, String resourceId, int level) {
        MDC.put("deploymentId", deploymentId);
        MDC.put("resourceId", resourceId);
        MDC.put("level", String.valueOf(level));
    }

    public static void setLevel(String deploymentId, int level) {
        MDC.put("deploymentId", deploymentId);
        MDC.put("level", String.valueOf(level));
    }

    public static void clear() {
        MDC.remove("deploymentId");
        MDC.remove("resourceId");
        MDC.remove("level");
    }
}
