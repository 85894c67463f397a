package com.kubegraph.dispatch.cli;

import com.kubegraph.core.health.HealthCheckService;
import com.kubegraph.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph health
 * <p>
 * Checks cluster reachability and the readiness registry.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (HealthCheckService.overall(checks) == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
