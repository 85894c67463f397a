package com.kubegraph.dispatch.api;

import com.kubegraph.core.events.DeploymentEvent;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    // -- Emitter creation tests -----------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per client")
        void createsDistinctEmitters() {
            SseEmitter emitter1 = service.createEmitter("deploy-1");
            SseEmitter emitter2 = service.createEmitter("deploy-1");
            assertNotNull(emitter1);
            assertNotSame(emitter1, emitter2);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("starts at zero")
        void startsAtZero() {
            assertEquals(0, service.activeEmitterCount());
        }
    }

    // -- Event payload tests --------------------------------------------------

    @Nested
    @DisplayName("toData")
    class ToDataTests {

        @Test
        @DisplayName("flattens ids, message and payload into the data map")
        void flattensEvent() {
            var event = DeploymentEvent.of(DeploymentEventType.RESOURCE_READY, "deploy-1", "web",
                    "web is ready", Map.of("reason", "Ready"));

            Map<String, Object> data = SseStreamingService.toData(event);

            assertEquals("deploy-1", data.get("deploymentId"));
            assertEquals("web", data.get("resourceId"));
            assertEquals("web is ready", data.get("message"));
            assertEquals("Ready", data.get("reason"));
            assertEquals(event.timestamp().toString(), data.get("timestamp"));
        }

        @Test
        @DisplayName("omits resourceId for deploy-level events")
        void omitsResourceId() {
            var event = DeploymentEvent.of(DeploymentEventType.STARTED, "deploy-1", null, "started", Map.of());

            assertFalse(SseStreamingService.toData(event).containsKey("resourceId"));
        }
    }

    // -- Event forwarding tests -----------------------------------------------

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("events for other deployments do not disturb an emitter")
        void noDeploymentCrossDelivery() {
            service.createEmitter("deploy-1");
            service.createEmitter("deploy-2");

            eventBus.publish(DeploymentEvent.of(DeploymentEventType.PROGRESS, "deploy-1", "web",
                    "polling", Map.of()));

            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent event publishing does not throw")
        void concurrentPublishDoesNotThrow() throws InterruptedException {
            service.createEmitter("deploy-1");

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final String resourceId = "r" + t;
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(DeploymentEvent.of(DeploymentEventType.RESOURCE_STATUS, "deploy-1",
                                resourceId, "poll " + i, Map.of()));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }
}
