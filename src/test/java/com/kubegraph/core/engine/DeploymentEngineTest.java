package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.TestManifests;
import com.kubegraph.core.cluster.FakeClusterApi;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.config.KubegraphProperties;
import com.kubegraph.core.events.DeploymentEvent;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.events.EventBus;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.graph.DependencyGraphBuilder;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.model.DeployedResource;
import com.kubegraph.core.model.DeploymentError;
import com.kubegraph.core.model.DeploymentPhase;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.DeploymentStatus;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.model.ResourceStatus;
import com.kubegraph.core.model.RollbackResult;
import com.kubegraph.core.readiness.ReadinessEvaluatorRegistry;
import com.kubegraph.core.reference.ResourceRef;
import com.kubegraph.core.serialization.ControlLoopManifestWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentEngineTest {

    private FakeClusterApi cluster;
    private SimpleMeterRegistry meterRegistry;
    private DeploymentEngine engine;
    private List<DeploymentEvent> events;

    @BeforeEach
    void setUp() {
        cluster = new FakeClusterApi();
        meterRegistry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        var metrics = new KubegraphMetrics(meterRegistry);
        var mapper = new ObjectMapper();
        var compiler = new ExpressionCompiler();
        var applier = new ResourceApplier(cluster, metrics);
        var waiter = new ReadinessWaiter(cluster, new ReadinessEvaluatorRegistry(), metrics);
        var direct = new DirectDeploymentStrategy(applier, waiter,
                new ReferenceResolver(new ExpressionEvaluator(), cluster, mapper), metrics);
        var controlLoop = new ControlLoopDeploymentStrategy(
                new ControlLoopManifestWriter(compiler, mapper), applier, waiter, mapper);
        engine = new DeploymentEngine(new DependencyGraphBuilder(), compiler, List.of(direct, controlLoop),
                new RollbackManager(cluster, metrics), new DeploymentRegistry(), new EventBus(), metrics,
                new KubegraphProperties());
    }

    private DeploymentOptions.Builder fastOptions() {
        return DeploymentOptions.builder()
                .pollInterval(Duration.ofMillis(10))
                .readinessTimeout(Duration.ofSeconds(5))
                .retryPolicy(new RetryPolicy(3, 2.0, Duration.ofMillis(1), Duration.ofMillis(5)))
                .progressCallback(events::add);
    }

    /** Deployment {@code web} and a Service {@code web-svc} whose selector reads the deployment's name. */
    private static ResourceGraph webWithService() {
        return ResourceGraph.builder("web-app")
                .resource("web", TestManifests.deployment("web", 3))
                .resource("svc", Map.of(
                        "apiVersion", "v1",
                        "kind", "Service",
                        "metadata", Map.of("name", "web-svc"),
                        "spec", Map.of(
                                "selector", Map.of("app", ResourceRef.of("web").metadata().field("name")),
                                "ports", List.of(Map.of("port", 80)))))
                .status("readyReplicas", ResourceRef.of("web").status().field("readyReplicas"))
                .status("endpoint", "${resources.svc.metadata.name}.default.svc")
                .build();
    }

    /** A ConfigMap {@code config} beside {@link #webWithService()}'s two resources. */
    private static ResourceGraph configWebAndService() {
        ResourceGraph base = webWithService();
        return ResourceGraph.builder("web-app")
                .resource("config", TestManifests.configMap("settings", Map.of("k", "v")))
                .resource(base.resource("web"))
                .resource(base.resource("svc"))
                .build();
    }

    @Nested
    @DisplayName("Direct strategy")
    class DirectTests {

        @Test
        @DisplayName("deployment and service both become ready and the status projection is evaluated")
        void deploysWebWithService() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions().build());

            assertEquals(DeploymentStatus.SUCCESS, result.status(), () -> result.errors().toString());
            assertTrue(result.errors().isEmpty());
            assertEquals(ResourceStatus.READY, result.resource("web").status());
            assertEquals(ResourceStatus.READY, result.resource("svc").status());
            assertEquals(List.of("web", "web-svc"), cluster.created());
            assertEquals(List.of(List.of("web"), List.of("svc")), result.levels());
            assertEquals(3, result.statusValues().get("readyReplicas"));
            assertEquals("web-svc.default.svc", result.statusValues().get("endpoint"));
        }

        @Test
        @DisplayName("references are substituted from live objects and the namespace is filled in")
        void substitutesReferences() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions().namespace("apps").build());

            DeployedResource svc = result.resource("svc");
            assertEquals("web", svc.manifest().path("spec").path("selector").path("app").asText());
            assertEquals("apps", svc.namespace());
        }

        @Test
        @DisplayName("an unrelated deployment and service share level 0 and both become ready")
        void independentResourcesShareLevelZero() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));
            ResourceGraph graph = ResourceGraph.builder("web-app")
                    .resource("web", TestManifests.deployment("web", 3))
                    .resource("webSvc", TestManifests.service("web-svc", "web"))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().build());

            assertEquals(DeploymentStatus.SUCCESS, result.status(), () -> result.errors().toString());
            assertEquals(List.of(List.of("web", "webSvc")), result.levels());
            assertEquals(Set.of("web", "web-svc"), Set.copyOf(cluster.created()));
            assertEquals(ResourceStatus.READY, result.resource("web").status());
            assertEquals(ResourceStatus.READY, result.resource("webSvc").status());
        }

        @Test
        @DisplayName("a dependent is not created until its dependency has polled ready")
        void dependentWaitsForReadiness() {
            cluster.statusAfterReads("web", 3, TestManifests.readyReplicas(3));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions().build());

            assertEquals(DeploymentStatus.SUCCESS, result.status(), () -> result.errors().toString());
            List<String> journal = cluster.journal();
            int webCreated = journal.indexOf("create web");
            int svcCreated = journal.indexOf("create web-svc");
            assertTrue(webCreated >= 0 && svcCreated > webCreated, journal::toString);
            assertEquals(3, journal.subList(webCreated, svcCreated).stream().filter("get web"::equals).count());
            assertEquals(2, events.stream()
                    .filter(e -> e.type() == DeploymentEventType.PROGRESS && "web".equals(e.resourceId()))
                    .count());
        }

        @Test
        @DisplayName("with continueOnFailure off, siblings finish but no later level starts")
        void stopOnFirstFailure() {
            cluster.failCreates("settings", 403).statusOf("web", TestManifests.readyReplicas(3));

            DeploymentResult result = engine.deploy(configWebAndService(), fastOptions()
                    .continueOnFailure(false).build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals(ResourceStatus.FAILED, result.resource("config").status());
            assertEquals(ResourceStatus.READY, result.resource("web").status());
            assertNull(result.resource("svc"));
            assertFalse(cluster.exists("Service", "web-svc"));
        }

        @Test
        @DisplayName("with continueOnFailure on, unaffected branches go on to later levels")
        void continueAfterFailure() {
            cluster.failCreates("settings", 403).statusOf("web", TestManifests.readyReplicas(3));

            DeploymentResult result = engine.deploy(configWebAndService(), fastOptions().build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals(ResourceStatus.READY, result.resource("svc").status());
            assertTrue(cluster.exists("Service", "web-svc"));
        }

        @Test
        @DisplayName("transient create failures are retried until the apply succeeds")
        void retriesTransientFailures() {
            cluster.failCreates("web", 500, 500, 500).statusOf("web", TestManifests.readyReplicas(1));
            ResourceGraph graph = ResourceGraph.builder("retry")
                    .resource("web", TestManifests.deployment("web", 1))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions()
                    .retryPolicy(new RetryPolicy(5, 2.0, Duration.ofMillis(1), Duration.ofMillis(5)))
                    .build());

            assertEquals(ResourceStatus.READY, result.resource("web").status());
            assertTrue(result.errors().isEmpty());
            assertEquals(4, cluster.createAttempts());
            assertEquals(3, events.stream().filter(e -> e.type() == DeploymentEventType.RESOURCE_WARNING).count());
            assertEquals(1.0, meterRegistry.get("kubegraph.apply.attempts").tag("outcome", "retried").counter().count());
        }

        @Test
        @DisplayName("a conflict is permanent: no retry and dependents are skipped")
        void permanentFailureSkipsDependents() {
            cluster.failCreates("web", 409);

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .retryPolicy(new RetryPolicy(5, 2.0, Duration.ofMillis(1), Duration.ofMillis(5)))
                    .build());

            assertEquals(DeploymentStatus.FAILED, result.status());
            assertEquals(1, cluster.createAttempts());
            assertEquals(ResourceStatus.FAILED, result.resource("web").status());
            assertEquals(DeploymentPhase.APPLY, result.errorsFor("web").get(0).phase());

            DeploymentError svcError = result.errorsFor("svc").get(0);
            assertEquals(DeploymentPhase.DEPENDENCY, svcError.phase());
            assertEquals("DependencyFailedError", svcError.errorType());
            assertEquals(ResourceStatus.FAILED, result.resource("svc").status());
            assertFalse(cluster.exists("Service", "web-svc"));
        }

        @Test
        @DisplayName("independent siblings still deploy when one resource fails")
        void partialFailure() {
            cluster.failCreates("web", 403);
            ResourceGraph graph = ResourceGraph.builder("mixed")
                    .resource("config", TestManifests.configMap("settings", Map.of("k", "v")))
                    .resource("web", TestManifests.deployment("web", 1))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals(ResourceStatus.READY, result.resource("config").status());
            assertEquals(ResourceStatus.FAILED, result.resource("web").status());
        }

        @Test
        @DisplayName("readiness timeout fails the resource in the readiness phase")
        void readinessTimeout() {
            ResourceGraph graph = ResourceGraph.builder("slow")
                    .resource("web", TestManifests.deployment("web", 2))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions()
                    .readinessTimeout(Duration.ofMillis(100))
                    .build());

            assertEquals(DeploymentStatus.FAILED, result.status());
            DeploymentError error = result.errorsFor("web").get(0);
            assertEquals(DeploymentPhase.READINESS, error.phase());
            assertEquals("ReadinessTimeoutError", error.errorType());
        }

        @Test
        @DisplayName("without waiting, applied resources end as deployed")
        void noWait() {
            ResourceGraph graph = ResourceGraph.builder("nowait")
                    .resource("web", TestManifests.deployment("web", 2))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().waitForReady(false).build());

            assertEquals(DeploymentStatus.SUCCESS, result.status());
            assertEquals(ResourceStatus.DEPLOYED, result.resource("web").status());
        }

        @Test
        @DisplayName("an existing object is updated at its live resourceVersion")
        void updatesExisting() {
            cluster.seed(TestManifests.configMap("settings", Map.of("k", "old")));
            ResourceGraph graph = ResourceGraph.builder("update")
                    .resource("config", TestManifests.configMap("settings", Map.of("k", "new")))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().build());

            assertTrue(result.isSuccess());
            assertEquals(List.of("settings"), cluster.replaced());
            assertTrue(cluster.created().isEmpty());
        }

        @Test
        @DisplayName("declared externals are read from the cluster and never applied")
        void externalReference() {
            cluster.seed(Map.of("apiVersion", "v1", "kind", "Secret",
                    "metadata", Map.of("name", "db-credentials", "namespace", "default"),
                    "data", Map.of("host", "db.internal")));
            ResourceGraph graph = ResourceGraph.builder("ext")
                    .external("creds", new ResourceKey("v1", "Secret", "default", "db-credentials"))
                    .resource("config", TestManifests.configMap("app", Map.of("dbHost", "${resources.creds.data.host}")))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().build());

            assertTrue(result.isSuccess(), () -> result.errors().toString());
            assertEquals("db.internal",
                    result.resource("config").manifest().path("data").path("dbHost").asText());
            assertEquals(List.of("app"), cluster.created());
        }

        @Test
        @DisplayName("an absent referenced field fails resolution in the validation phase")
        void missingField() {
            ResourceGraph graph = ResourceGraph.builder("missing")
                    .resource("a", TestManifests.configMap("a", Map.of("k", "v")))
                    .resource("b", TestManifests.configMap("b", Map.of("k", "${resources.a.data.absent}")))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().build());

            assertEquals(DeploymentPhase.VALIDATION, result.errorsFor("b").get(0).phase());
            assertEquals(DeploymentStatus.PARTIAL, result.status());
        }
    }

    @Nested
    @DisplayName("Deploy control")
    class ControlTests {

        @Test
        @DisplayName("a cycle is rejected before anything is applied")
        void cycleRejected() {
            ResourceGraph graph = ResourceGraph.builder("loop")
                    .resource("a", TestManifests.configMap("a", Map.of("x", "${resources.b.data.x}")))
                    .resource("b", TestManifests.configMap("b", Map.of("x", "${resources.a.data.x}")))
                    .build();

            assertThrows(ConstructionError.class, () -> engine.deploy(graph, fastOptions().build()));
            assertEquals(0, cluster.createAttempts());
        }

        @Test
        @DisplayName("a deploy cancelled before it starts applies nothing and is reported partial")
        void cancelledBeforeStart() {
            var cancellation = new CancellationSignal();
            cancellation.cancel("operator request");

            DeploymentResult result = engine.deploy(webWithService(),
                    fastOptions().cancellation(cancellation).build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals(DeploymentPhase.DEPLOYMENT, result.errors().get(0).phase());
            assertTrue(result.errors().get(0).message().contains("operator request"));
            assertEquals(0, cluster.createAttempts());
        }

        @Test
        @DisplayName("cancelling mid-deploy lets the running level finish and starts no other")
        void cancelledBetweenLevels() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));
            var cancellation = new CancellationSignal();

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .cancellation(cancellation)
                    .progressCallback(e -> {
                        events.add(e);
                        if (e.type() == DeploymentEventType.RESOURCE_READY && "web".equals(e.resourceId())) {
                            cancellation.cancel("operator request");
                        }
                    })
                    .build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals(List.of("web"), cluster.created());
            assertEquals(ResourceStatus.READY, result.resource("web").status());
            assertNull(result.resource("svc"));
            assertTrue(result.errors().stream().anyMatch(e -> e.phase() == DeploymentPhase.DEPLOYMENT
                    && e.message().contains("operator request")));
            assertEquals(DeploymentEventType.COMPLETED, events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("the overall timeout cuts a readiness wait short and is reported as a deployment error")
        void overallTimeout() {
            long started = System.nanoTime();

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .timeout(Duration.ofMillis(200))
                    .readinessTimeout(Duration.ofSeconds(10))
                    .build());

            assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
            assertEquals(DeploymentStatus.FAILED, result.status());
            DeploymentError webError = result.errorsFor("web").get(0);
            assertEquals(DeploymentPhase.READINESS, webError.phase());
            assertTrue(webError.message().contains("deployment timeout"), webError.message());
            assertFalse(webError.message().contains("10s"), webError.message());
            assertTrue(result.errors().stream().anyMatch(e -> e.resourceId() == null
                    && e.phase() == DeploymentPhase.DEPLOYMENT && e.message().contains("timed out")));
            assertFalse(cluster.exists("Service", "web-svc"));
        }

        @Test
        @DisplayName("a graph rejected before any apply still ends with a failed event and a recorded result")
        void rejectedGraphEmitsFailed() {
            ResourceGraph graph = ResourceGraph.builder("loop")
                    .resource("a", TestManifests.configMap("a", Map.of("x", "${resources.b.data.x}")))
                    .resource("b", TestManifests.configMap("b", Map.of("x", "${resources.a.data.x}")))
                    .build();

            assertThrows(ConstructionError.class, () -> engine.deploy(graph, fastOptions().build()));

            assertEquals(1, events.size());
            assertEquals(DeploymentEventType.FAILED, events.get(0).type());
            assertEquals(DeploymentStatus.FAILED, engine.list().get(0).status());
        }

        @Test
        @DisplayName("dry run applies nothing and previews manifests")
        void dryRun() {
            ResourceGraph graph = ResourceGraph.builder("preview")
                    .spec("name", "demo")
                    .resource("config", TestManifests.configMap("${schema.spec.name}-config", Map.of()))
                    .resource("web", TestManifests.configMap("web", Map.of("peer", "${resources.config.metadata.name}")))
                    .build();

            DeploymentResult result = engine.deploy(graph, fastOptions().dryRun(true).build());

            assertEquals(0, cluster.createAttempts());
            assertEquals("demo-config", result.resource("config").name());
            assertEquals("${resources.config.metadata.name}",
                    result.resource("web").manifest().path("data").path("peer").asText());
        }

        @Test
        @DisplayName("the event stream starts with started and ends with one terminal event")
        void eventOrdering() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));

            engine.deploy(webWithService(), fastOptions().build());

            assertEquals(DeploymentEventType.STARTED, events.get(0).type());
            assertEquals(DeploymentEventType.COMPLETED, events.get(events.size() - 1).type());
            assertEquals(1, events.stream().filter(e -> e.type().isTerminal()).count());
            assertEquals(1.0, meterRegistry.get("kubegraph.deploy.total")
                    .tag("strategy", "direct").tag("status", "success").counter().count());
        }

        @Test
        @DisplayName("a failed deploy ends with a failed event")
        void failedEvent() {
            cluster.failCreates("web", 422);

            engine.deploy(webWithService(), fastOptions().build());

            assertEquals(DeploymentEventType.FAILED, events.get(events.size() - 1).type());
        }
    }

    @Nested
    @DisplayName("Rollback")
    class RollbackTests {

        @Test
        @DisplayName("rollback on failure deletes what was applied")
        void rollbackOnFailure() {
            cluster.failCreates("web", 409);
            ResourceGraph graph = ResourceGraph.builder("mixed")
                    .resource("config", TestManifests.configMap("settings", Map.of("k", "v")))
                    .resource("web", TestManifests.deployment("web", 1))
                    .build();

            engine.deploy(graph, fastOptions().rollbackOnFailure(true).build());

            assertEquals(List.of("settings"), cluster.deleted());
            assertFalse(cluster.exists("ConfigMap", "settings"));
        }

        @Test
        @DisplayName("manual rollback deletes dependents first and tolerates absent objects")
        void manualRollback() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));
            DeploymentResult result = engine.deploy(webWithService(), fastOptions().build());
            cluster.failDeletes("web", 404);

            RollbackResult rollback = engine.rollback(result.deploymentId()).orElseThrow();

            assertEquals(List.of("svc", "web"), rollback.rolledBack());
            assertEquals(DeploymentStatus.SUCCESS, rollback.status());
            assertEquals(List.of("web-svc"), cluster.deleted());
        }

        @Test
        @DisplayName("delete failures are reported, not thrown")
        void rollbackErrors() {
            cluster.statusOf("web", TestManifests.readyReplicas(3));
            DeploymentResult result = engine.deploy(webWithService(), fastOptions().build());
            cluster.failDeletes("web", 500);

            RollbackResult rollback = engine.rollback(result.deploymentId()).orElseThrow();

            assertEquals(DeploymentStatus.PARTIAL, rollback.status());
            assertEquals(DeploymentPhase.ROLLBACK, rollback.errors().get(0).phase());
        }

        @Test
        @DisplayName("unknown deployments have nothing to roll back")
        void unknownDeployment() {
            assertTrue(engine.rollback("deploy-unknown").isEmpty());
        }
    }

    @Nested
    @DisplayName("Control-loop strategy")
    class ControlLoopTests {

        @Test
        @DisplayName("applies the definition, then the instance, and reports the instance status")
        void deploysThroughController() {
            cluster.statusOf("ResourceGraphDefinition", "web-app", Map.of("state", "Active"));
            cluster.statusOf("WebApp", "web-app", Map.of(
                    "state", "ACTIVE",
                    "conditions", List.of(Map.of("type", "InstanceSynced", "status", "True")),
                    "endpoint", "web-svc.default.svc"));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .strategy(DeploymentOptions.Strategy.CONTROL_LOOP).build());

            assertTrue(result.isSuccess(), () -> result.errors().toString());
            assertEquals(ResourceStatus.READY, result.resource(ControlLoopDeploymentStrategy.DEFINITION_ID).status());
            assertEquals(ResourceStatus.READY, result.resource(ControlLoopDeploymentStrategy.INSTANCE_ID).status());
            assertEquals(Map.of("endpoint", "web-svc.default.svc"), result.statusValues());
            assertFalse(cluster.exists("Deployment", "web"));
        }

        @Test
        @DisplayName("the definition embeds CEL interpolations in place of references")
        void definitionCarriesCel() {
            cluster.statusOf("ResourceGraphDefinition", "web-app", Map.of("state", "Active"));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .strategy(DeploymentOptions.Strategy.CONTROL_LOOP).waitForReady(false).build());

            var template = result.resource(ControlLoopDeploymentStrategy.DEFINITION_ID).manifest()
                    .path("spec").path("resources").get(1).path("template");
            assertEquals("${resources.web.metadata.name}", template.path("spec").path("selector").path("app").asText());
        }

        @Test
        @DisplayName("a failed instance is terminal")
        void failedInstance() {
            cluster.statusOf("ResourceGraphDefinition", "web-app", Map.of("state", "Active"));
            cluster.statusOf("WebApp", "web-app", Map.of("state", "FAILED"));

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .strategy(DeploymentOptions.Strategy.CONTROL_LOOP).build());

            assertEquals(DeploymentStatus.PARTIAL, result.status());
            assertEquals("ResourceFailedError",
                    result.errorsFor(ControlLoopDeploymentStrategy.INSTANCE_ID).get(0).errorType());
        }

        @Test
        @DisplayName("the instance is skipped when the definition cannot be applied")
        void definitionFails() {
            cluster.failCreates("web-app", 403);

            DeploymentResult result = engine.deploy(webWithService(), fastOptions()
                    .strategy(DeploymentOptions.Strategy.CONTROL_LOOP).build());

            assertEquals(DeploymentStatus.FAILED, result.status());
            assertEquals(DeploymentPhase.DEPENDENCY,
                    result.errorsFor(ControlLoopDeploymentStrategy.INSTANCE_ID).get(0).phase());
        }
    }
}
