package com.kubegraph.core.engine;

import com.kubegraph.core.model.DeploymentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finished deployment results by id, plus the ids still in flight. In-memory only.
 *
 * <p>Holds at most {@link #MAX_RESULTS} results; the oldest finished result is evicted first.
 */
@Component
public class DeploymentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeploymentRegistry.class);
    static final int MAX_RESULTS = 200;

    private final int maxResults;
    private final ConcurrentHashMap<String, DeploymentResult> results = new ConcurrentHashMap<>();
    private final Deque<String> completionOrder = new ArrayDeque<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public DeploymentRegistry() {
        this(MAX_RESULTS);
    }

    DeploymentRegistry(int maxResults) {
        this.maxResults = maxResults;
    }

    public void started(String deploymentId) {
        running.add(deploymentId);
    }

    public synchronized void completed(DeploymentResult result) {
        if (results.put(result.deploymentId(), result) == null) {
            completionOrder.addLast(result.deploymentId());
        }
        running.remove(result.deploymentId());
        while (results.size() > maxResults && !completionOrder.isEmpty()) {
            String evicted = completionOrder.pollFirst();
            results.remove(evicted);
            log.debug("Registry at capacity ({}), evicted deployment {}", maxResults, evicted);
        }
    }

    public Optional<DeploymentResult> find(String deploymentId) {
        return Optional.ofNullable(results.get(deploymentId));
    }

    public boolean isRunning(String deploymentId) {
        return running.contains(deploymentId);
    }

    /** Finished results, oldest id first. */
    public List<DeploymentResult> list() {
        var all = new ArrayList<>(results.values());
        all.sort(Comparator.comparing(DeploymentResult::deploymentId));
        return all;
    }
}
