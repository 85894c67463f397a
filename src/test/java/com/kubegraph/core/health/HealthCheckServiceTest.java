package com.kubegraph.core.health;

import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.config.KubegraphProperties;
import com.kubegraph.core.readiness.ReadinessEvaluatorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private final KubegraphProperties properties = new KubegraphProperties();

    private static HealthStatus component(List<HealthStatus> statuses, String name) {
        return statuses.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null, properties);
        List<HealthStatus> results = service.checkAll();

        assertEquals(2, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(), status.component() + " should be DOWN when null");
        }
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(results));
    }

    @Test
    @DisplayName("Reachable cluster -> cluster UP with its version")
    void clusterReachable() {
        var clusterApi = mock(ClusterApi.class);
        when(clusterApi.version()).thenReturn("v1.30.0");
        var service = new HealthCheckService(clusterApi, new ReadinessEvaluatorRegistry(), properties);

        List<HealthStatus> results = service.checkAll();

        HealthStatus cluster = component(results, "cluster");
        assertEquals(HealthStatus.Status.UP, cluster.status());
        assertEquals("v1.30.0", cluster.metadata().get("version"));
        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(results));
    }

    @Test
    @DisplayName("Forbidden -> cluster DEGRADED, unreachable -> DOWN")
    void clusterErrors() {
        var clusterApi = mock(ClusterApi.class);
        when(clusterApi.version()).thenThrow(new ClusterApiException(403, "forbidden"));
        var service = new HealthCheckService(clusterApi, new ReadinessEvaluatorRegistry(), properties);
        assertEquals(HealthStatus.Status.DEGRADED, service.checkCluster().status());

        var unreachable = mock(ClusterApi.class);
        when(unreachable.version()).thenThrow(new ClusterApiException(ClusterApiException.NETWORK_ERROR, "refused"));
        var downService = new HealthCheckService(unreachable, new ReadinessEvaluatorRegistry(), properties);
        assertEquals(HealthStatus.Status.DOWN, downService.checkCluster().status());
    }

    @Test
    @DisplayName("Health indicator maps the overall status")
    void healthIndicator() {
        var clusterApi = mock(ClusterApi.class);
        when(clusterApi.version()).thenThrow(new ClusterApiException(401, "unauthorized"));
        var indicator = new ClusterHealthIndicator(
                new HealthCheckService(clusterApi, new ReadinessEvaluatorRegistry(), properties));

        Health health = indicator.health();

        assertEquals(new Status("DEGRADED"), health.getStatus());
        assertTrue(health.getDetails().containsKey("cluster"));
        assertTrue(health.getDetails().containsKey("readiness"));
    }
}
