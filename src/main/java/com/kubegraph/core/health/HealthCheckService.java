package com.kubegraph.core.health;

import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.config.KubegraphProperties;
import com.kubegraph.core.readiness.ReadinessEvaluatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ClusterApi clusterApi;
    private final ReadinessEvaluatorRegistry readinessRegistry;
    private final KubegraphProperties properties;

    public HealthCheckService(
            @Autowired(required = false) ClusterApi clusterApi,
            @Autowired(required = false) ReadinessEvaluatorRegistry readinessRegistry,
            KubegraphProperties properties) {
        this.clusterApi = clusterApi;
        this.readinessRegistry = readinessRegistry;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCluster());
        results.add(checkReadinessRegistry());
        return results;
    }

    /** UP only when every component is UP; DOWN when any is DOWN. */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        if (statuses.stream().anyMatch(s -> s.status() == HealthStatus.Status.DOWN)) {
            return HealthStatus.Status.DOWN;
        }
        if (statuses.stream().anyMatch(s -> s.status() == HealthStatus.Status.DEGRADED)) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    HealthStatus checkCluster() {
        String server = String.valueOf(properties.getCluster().getServer());
        if (clusterApi == null) {
            return new HealthStatus("cluster", HealthStatus.Status.DOWN,
                    "No ClusterApi configured", Map.of());
        }
        try {
            String version = clusterApi.version();
            return new HealthStatus("cluster", HealthStatus.Status.UP,
                    "API server reachable", Map.of("server", server, "version", String.valueOf(version)));
        } catch (ClusterApiException e) {
            log.warn("Cluster health check failed: {}", e.getMessage());
            // a 401/403 means the server answered
            HealthStatus.Status status = e.statusCode() == 401 || e.statusCode() == 403
                    ? HealthStatus.Status.DEGRADED : HealthStatus.Status.DOWN;
            return new HealthStatus("cluster", status,
                    "Cluster error: " + e.getMessage(), Map.of("server", server));
        }
    }

    HealthStatus checkReadinessRegistry() {
        if (readinessRegistry == null) {
            return new HealthStatus("readiness", HealthStatus.Status.DOWN,
                    "No readiness registry configured", Map.of());
        }
        int kinds = readinessRegistry.registeredKinds().size();
        return new HealthStatus("readiness", HealthStatus.Status.UP,
                kinds + " kinds with bespoke evaluators", Map.of("kinds", String.valueOf(kinds)));
    }
}
