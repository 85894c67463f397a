package com.kubegraph.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposes {@link HealthCheckService} results on the actuator health endpoint.
 */
@Component("kubegraph")
public class ClusterHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public ClusterHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var statuses = healthCheckService.checkAll();
        Health.Builder builder = switch (HealthCheckService.overall(statuses)) {
            case UP -> Health.up();
            case DEGRADED -> Health.status("DEGRADED");
            case DOWN -> Health.down();
        };
        for (HealthStatus status : statuses) {
            builder.withDetail(status.component(), Map.of("status", status.status().name(),
                    "detail", status.detail()));
        }
        return builder.build();
    }
}
