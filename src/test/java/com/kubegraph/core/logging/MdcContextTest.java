package com.kubegraph.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setDeployment puts deploymentId in MDC")
    void setDeployment() {
        MdcContext.setDeployment("deploy-1");
        assertEquals("deploy-1", MDC.get("deploymentId"));
    }

    @Test
    @DisplayName("setResource puts deploymentId, resourceId and level in MDC")
    void setResource() {
        MdcContext.setResource("deploy-1", "web", 2);
        assertEquals("deploy-1", MDC.get("deploymentId"));
        assertEquals("web", MDC.get("resourceId"));
        assertEquals("2", MDC.get("level"));
    }

    @Test
    @DisplayName("clear removes all deploy MDC keys")
    void clear() {
        MdcContext.setResource("deploy-1", "web", 1);
        MdcContext.clear();
        assertNull(MDC.get("deploymentId"));
        assertNull(MDC.get("resourceId"));
        assertNull(MDC.get("level"));
    }
}
