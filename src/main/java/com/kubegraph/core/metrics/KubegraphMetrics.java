package com.kubegraph.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for deployments.
 */
@Service
public class KubegraphMetrics {

    private final MeterRegistry registry;

    public KubegraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDeployment(String strategy, String status, Duration duration) {
        Counter.builder("kubegraph.deploy.total")
                .tag("strategy", strategy)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("kubegraph.deploy.duration")
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    /**
     * @param outcome "success", "retried" or "failed"
     */
    public void recordApplyAttempt(String outcome) {
        Counter.builder("kubegraph.apply.attempts")
                .description("Create-or-update attempts against the cluster API")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordReadinessWait(String kind, long ms) {
        Timer.builder("kubegraph.readiness.wait")
                .tag("kind", kind == null || kind.isEmpty() ? "unknown" : kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLevelSize(int size) {
        DistributionSummary.builder("kubegraph.level.size")
                .description("Resources dispatched concurrently per level")
                .register(registry)
                .record(size);
    }

    public void recordRollback(String result) {
        Counter.builder("kubegraph.rollback.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
