package com.kubegraph.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for deployment events.
 * <p>
 * Supports per-deployment subscriptions and global subscriptions that receive all events.
 * Thread-safe: readiness polls of one level publish concurrently.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-deployment subscribers keyed by deploymentId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<DeploymentEvent>>> deploymentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<DeploymentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(DeploymentEvent event) {
        log.debug("Publishing {} for deployment {} ({})", event.type().wireName(), event.deploymentId(),
                event.resourceId() == null ? "-" : event.resourceId());

        List<Consumer<DeploymentEvent>> subscribers = deploymentSubscribers.get(event.deploymentId());
        if (subscribers != null) {
            for (Consumer<DeploymentEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<DeploymentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one deployment.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String deploymentId, Consumer<DeploymentEvent> consumer) {
        deploymentSubscribers.computeIfAbsent(deploymentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<DeploymentEvent>> subs = deploymentSubscribers.get(deploymentId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    deploymentSubscribers.remove(deploymentId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<DeploymentEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /** Subscriber failures are logged and never reach the publishing deploy. */
    public static void deliverSafely(Consumer<DeploymentEvent> subscriber, DeploymentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
