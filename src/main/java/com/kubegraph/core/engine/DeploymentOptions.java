package com.kubegraph.core.engine;

import com.kubegraph.core.config.KubegraphProperties;
import com.kubegraph.core.events.DeploymentEvent;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Per-call deploy settings. Defaults come from {@code kubegraph.deploy.*}.
 */
public final class DeploymentOptions {

    public enum Strategy {
        DIRECT,
        CONTROL_LOOP;

        /** Parses {@code direct} or {@code control-loop}, case-insensitively. */
        public static Strategy parse(String value) {
            return Strategy.valueOf(value.trim().toUpperCase().replace('-', '_'));
        }
    }

    private final Strategy strategy;
    private final boolean waitForReady;
    private final Duration timeout;
    private final Duration readinessTimeout;
    private final Duration pollInterval;
    private final RetryPolicy retryPolicy;
    private final boolean rollbackOnFailure;
    private final boolean continueOnFailure;
    private final int maxParallel;
    private final String namespace;
    private final boolean dryRun;
    private final CancellationSignal cancellation;
    private final Consumer<DeploymentEvent> progressCallback;

    private DeploymentOptions(Builder b) {
        this.strategy = b.strategy;
        this.waitForReady = b.waitForReady;
        this.timeout = b.timeout;
        this.readinessTimeout = b.readinessTimeout;
        this.pollInterval = b.pollInterval;
        this.retryPolicy = b.retryPolicy;
        this.rollbackOnFailure = b.rollbackOnFailure;
        this.continueOnFailure = b.continueOnFailure;
        this.maxParallel = b.maxParallel;
        this.namespace = b.namespace;
        this.dryRun = b.dryRun;
        this.cancellation = b.cancellation != null ? b.cancellation : new CancellationSignal();
        this.progressCallback = b.progressCallback;
    }

    public static DeploymentOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder fromProperties(KubegraphProperties properties) {
        KubegraphProperties.Deploy deploy = properties.getDeploy();
        return builder()
                .waitForReady(deploy.isWaitForReady())
                .timeout(Duration.ofSeconds(deploy.getTimeoutSeconds()))
                .readinessTimeout(Duration.ofSeconds(deploy.getReadinessTimeoutSeconds()))
                .pollInterval(Duration.ofMillis(deploy.getPollIntervalMs()))
                .retryPolicy(RetryPolicy.from(deploy.getRetry()))
                .rollbackOnFailure(deploy.isRollbackOnFailure())
                .continueOnFailure(deploy.isContinueOnFailure())
                .maxParallel(deploy.getMaxParallel())
                .namespace(properties.getCluster().getNamespace());
    }

    public Builder toBuilder() {
        return builder()
                .strategy(strategy)
                .waitForReady(waitForReady)
                .timeout(timeout)
                .readinessTimeout(readinessTimeout)
                .pollInterval(pollInterval)
                .retryPolicy(retryPolicy)
                .rollbackOnFailure(rollbackOnFailure)
                .continueOnFailure(continueOnFailure)
                .maxParallel(maxParallel)
                .namespace(namespace)
                .dryRun(dryRun)
                .cancellation(cancellation)
                .progressCallback(progressCallback);
    }

    public Strategy strategy() { return strategy; }
    public boolean waitForReady() { return waitForReady; }
    public Duration timeout() { return timeout; }
    public Duration readinessTimeout() { return readinessTimeout; }
    public Duration pollInterval() { return pollInterval; }
    public RetryPolicy retryPolicy() { return retryPolicy; }
    public boolean rollbackOnFailure() { return rollbackOnFailure; }
    public boolean continueOnFailure() { return continueOnFailure; }
    public int maxParallel() { return maxParallel; }
    public String namespace() { return namespace; }
    public boolean dryRun() { return dryRun; }
    public CancellationSignal cancellation() { return cancellation; }
    public Consumer<DeploymentEvent> progressCallback() { return progressCallback; }

    public static final class Builder {
        private Strategy strategy = Strategy.DIRECT;
        private boolean waitForReady = true;
        private Duration timeout = Duration.ofMinutes(5);
        private Duration readinessTimeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(2);
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private boolean rollbackOnFailure;
        private boolean continueOnFailure = true;
        private int maxParallel = 8;
        private String namespace = "default";
        private boolean dryRun;
        private CancellationSignal cancellation;
        private Consumer<DeploymentEvent> progressCallback;

        private Builder() {}

        public Builder strategy(Strategy strategy) { this.strategy = strategy; return this; }
        public Builder waitForReady(boolean waitForReady) { this.waitForReady = waitForReady; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder readinessTimeout(Duration readinessTimeout) { this.readinessTimeout = readinessTimeout; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }
        public Builder rollbackOnFailure(boolean rollbackOnFailure) { this.rollbackOnFailure = rollbackOnFailure; return this; }
        public Builder continueOnFailure(boolean continueOnFailure) { this.continueOnFailure = continueOnFailure; return this; }
        public Builder maxParallel(int maxParallel) { this.maxParallel = Math.max(1, maxParallel); return this; }
        public Builder namespace(String namespace) { this.namespace = namespace; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
        public Builder cancellation(CancellationSignal cancellation) { this.cancellation = cancellation; return this; }
        public Builder progressCallback(Consumer<DeploymentEvent> callback) { this.progressCallback = callback; return this; }

        public DeploymentOptions build() {
            return new DeploymentOptions(this);
        }
    }
}
