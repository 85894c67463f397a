package com.kubegraph.dispatch.api;

import com.kubegraph.core.events.DeploymentEvent;
import com.kubegraph.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each client gets an emitter subscribed to one deployment. Events are sent with their
 * wire name as the SSE event name, and the emitter is completed after the terminal
 * {@code completed} or {@code failed} event. Idle connections are kept open with
 * periodic comment frames.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // lifecycle callbacks remove the registration
                log.debug("Heartbeat failed for deployment {}: {}", registration.deploymentId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for deployment {} (emitter not active)", registration.deploymentId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams the events of one deployment.
     *
     * @param deploymentId the deployment to stream
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter createEmitter(String deploymentId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(deploymentId, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(deploymentId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for deployment {}", deploymentId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for deployment {}", deploymentId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for deployment {}: {}", deploymentId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for deployment {}: {}", deploymentId, e.getMessage());
        }

        log.info("SSE emitter created for deployment {} (timeout={}ms)", deploymentId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static Map<String, Object> toData(DeploymentEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("deploymentId", event.deploymentId());
        if (event.resourceId() != null) {
            data.put("resourceId", event.resourceId());
        }
        if (event.message() != null) {
            data.put("message", event.message());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendEvent(SseEmitter emitter, DeploymentEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(toData(event)));
            if (event.type().isTerminal()) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for deployment {}: {}",
                    event.type().wireName(), event.deploymentId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for deployment {}", registration.deploymentId);
    }

    private record EmitterRegistration(
            String deploymentId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
