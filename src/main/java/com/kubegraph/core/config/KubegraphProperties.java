package com.kubegraph.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "kubegraph")
public class KubegraphProperties {

    private Cluster cluster = new Cluster();
    private Deploy deploy = new Deploy();
    private Compile compile = new Compile();

    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }
    public Deploy getDeploy() { return deploy; }
    public void setDeploy(Deploy deploy) { this.deploy = deploy; }
    public Compile getCompile() { return compile; }
    public void setCompile(Compile compile) { this.compile = compile; }

    public static class Cluster {
        /** API server URL; defaults to a local {@code kubectl proxy}. */
        private String server = "http://localhost:8001";
        private String token = "";
        /** Read when {@code token} is blank, e.g. a mounted service-account token. */
        private String tokenFile = "/var/run/secrets/kubernetes.io/serviceaccount/token";
        private String namespace = "default";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;

        public String getServer() { return server; }
        public void setServer(String server) { this.server = server; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getTokenFile() { return tokenFile; }
        public void setTokenFile(String tokenFile) { this.tokenFile = tokenFile; }
        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Deploy {
        private int timeoutSeconds = 300;
        private int readinessTimeoutSeconds = 300;
        private long pollIntervalMs = 2000;
        private boolean waitForReady = true;
        private boolean rollbackOnFailure = false;
        private boolean continueOnFailure = true;
        private int maxParallel = 8;
        private Retry retry = new Retry();

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getReadinessTimeoutSeconds() { return readinessTimeoutSeconds; }
        public void setReadinessTimeoutSeconds(int readinessTimeoutSeconds) { this.readinessTimeoutSeconds = readinessTimeoutSeconds; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public boolean isWaitForReady() { return waitForReady; }
        public void setWaitForReady(boolean waitForReady) { this.waitForReady = waitForReady; }
        public boolean isRollbackOnFailure() { return rollbackOnFailure; }
        public void setRollbackOnFailure(boolean rollbackOnFailure) { this.rollbackOnFailure = rollbackOnFailure; }
        public boolean isContinueOnFailure() { return continueOnFailure; }
        public void setContinueOnFailure(boolean continueOnFailure) { this.continueOnFailure = continueOnFailure; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
    }

    public static class Retry {
        private int maxRetries = 3;
        private double backoffMultiplier = 2.0;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 10000;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    }

    public static class Compile {
        /** Advisory diagnostics fail compilation when set. */
        private boolean strict = false;
        private int maxDepth = 64;

        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }
}
