package com.kubegraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.KubernetesRestClusterApi;
import com.kubegraph.core.engine.ControlLoopDeploymentStrategy;
import com.kubegraph.core.engine.DirectDeploymentStrategy;
import com.kubegraph.core.engine.ReadinessWaiter;
import com.kubegraph.core.engine.ReferenceResolver;
import com.kubegraph.core.engine.ResourceApplier;
import com.kubegraph.core.engine.RollbackManager;
import com.kubegraph.core.expression.ContextValidator;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.expression.ReferenceDetector;
import com.kubegraph.core.graph.DependencyGraphBuilder;
import com.kubegraph.core.metrics.KubegraphMetrics;
import com.kubegraph.core.readiness.ReadinessEvaluatorRegistry;
import com.kubegraph.core.serialization.ControlLoopManifestWriter;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class KubegraphConfig {

    private static final Logger log = LoggerFactory.getLogger(KubegraphConfig.class);

    @Bean
    @ConditionalOnMissingBean(ClusterApi.class)
    public ClusterApi clusterApi(KubegraphProperties properties, ObjectMapper objectMapper) {
        log.info("Cluster API server: {}", properties.getCluster().getServer());
        return new KubernetesRestClusterApi(properties.getCluster(), objectMapper);
    }

    @Bean
    public ReferenceDetector referenceDetector(KubegraphProperties properties) {
        return new ReferenceDetector(properties.getCompile().getMaxDepth());
    }

    @Bean
    public ExpressionCompiler expressionCompiler(ReferenceDetector detector) {
        return new ExpressionCompiler(detector, new ContextValidator());
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new ExpressionEvaluator();
    }

    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder(ReferenceDetector detector) {
        return new DependencyGraphBuilder(detector);
    }

    @Bean
    public ControlLoopManifestWriter controlLoopManifestWriter(ExpressionCompiler compiler, ObjectMapper objectMapper) {
        return new ControlLoopManifestWriter(compiler, objectMapper);
    }

    @Bean
    public GraphDefinitionLoader graphDefinitionLoader(ExpressionEvaluator evaluator) {
        return new GraphDefinitionLoader(evaluator);
    }

    @Bean
    public ResourceApplier resourceApplier(ClusterApi clusterApi, KubegraphMetrics metrics) {
        return new ResourceApplier(clusterApi, metrics);
    }

    @Bean
    public ReadinessWaiter readinessWaiter(ClusterApi clusterApi, ReadinessEvaluatorRegistry registry,
                                           KubegraphMetrics metrics) {
        return new ReadinessWaiter(clusterApi, registry, metrics);
    }

    @Bean
    public ReferenceResolver referenceResolver(ExpressionEvaluator evaluator, ClusterApi clusterApi,
                                               ObjectMapper objectMapper) {
        return new ReferenceResolver(evaluator, clusterApi, objectMapper);
    }

    @Bean
    public DirectDeploymentStrategy directDeploymentStrategy(ResourceApplier applier, ReadinessWaiter waiter,
                                                             ReferenceResolver resolver, KubegraphMetrics metrics) {
        return new DirectDeploymentStrategy(applier, waiter, resolver, metrics);
    }

    @Bean
    public ControlLoopDeploymentStrategy controlLoopDeploymentStrategy(ControlLoopManifestWriter writer,
                                                                       ResourceApplier applier,
                                                                       ReadinessWaiter waiter,
                                                                       ObjectMapper objectMapper) {
        return new ControlLoopDeploymentStrategy(writer, applier, waiter, objectMapper);
    }

    @Bean
    public RollbackManager rollbackManager(ClusterApi clusterApi, KubegraphMetrics metrics) {
        return new RollbackManager(clusterApi, metrics);
    }

    /** Runs deploys started over HTTP; each deploy uses its own pool for its levels. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService deploymentExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "kubegraph-deploy-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
