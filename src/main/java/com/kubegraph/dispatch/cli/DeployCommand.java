package com.kubegraph.dispatch.cli;

import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.engine.DeploymentEngine;
import com.kubegraph.core.engine.DeploymentOptions;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.model.DeploymentResult;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.serialization.ControlLoopManifestWriter;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph deploy &lt;file&gt;
 * <p>
 * Deploys a graph, streaming progress events. Exits non-zero unless the result is success.
 */
@Command(name = "deploy", mixinStandardHelpOptions = true, description = "Deploy a resource graph")
@Component
public class DeployCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph definition file (YAML or JSON)")
    private Path file;

    @Option(names = {"--strategy", "-s"}, description = "direct or control-loop", defaultValue = "direct")
    private String strategy;

    @Option(names = "--no-wait", description = "Do not wait for readiness")
    private boolean noWait;

    @Option(names = "--timeout", description = "Overall timeout in seconds")
    private Integer timeoutSeconds;

    @Option(names = "--rollback", description = "Delete applied resources when the deploy does not succeed")
    private boolean rollback;

    @Option(names = {"--namespace", "-n"}, description = "Namespace for resources that do not name one")
    private String namespace;

    @Option(names = "--dry-run", description = "Print the manifests without applying them")
    private boolean dryRun;

    @Option(names = "--fail-fast", description = "Start no new level after a resource fails")
    private boolean failFast;

    @Option(names = {"--verbose", "-v"}, description = "Print every readiness poll")
    private boolean verbose;

    private final GraphDefinitionLoader loader;
    private final DeploymentEngine engine;

    public DeployCommand(GraphDefinitionLoader loader, DeploymentEngine engine) {
        this.loader = loader;
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        DeploymentOptions options;
        try {
            options = options();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid strategy: " + strategy + ". Valid strategies: direct, control-loop");
            return 2;
        }

        DeploymentResult result;
        try {
            ResourceGraph graph = loader.load(file);
            ConsoleOutput.info("Deploying '" + graph.name() + "' with " + graph.resources().size()
                    + " resources (" + options.strategy().name().toLowerCase().replace('_', '-') + ")");
            result = engine.deploy(graph, options);
        } catch (KubegraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (dryRun) {
            result.resources().forEach(r -> System.out.println(
                    "# " + r.id() + "\n" + ControlLoopManifestWriter.yaml(r.manifest())));
        }
        ConsoleOutput.summary(result);
        return result.isSuccess() ? 0 : 1;
    }

    DeploymentOptions options() {
        DeploymentOptions.Builder builder = engine.defaultOptions()
                .strategy(DeploymentOptions.Strategy.parse(strategy))
                .dryRun(dryRun)
                .progressCallback(event -> {
                    if (verbose || event.type() != DeploymentEventType.PROGRESS || event.resourceId() == null) {
                        ConsoleOutput.event(event);
                    }
                });
        if (noWait) {
            builder.waitForReady(false);
        }
        if (timeoutSeconds != null) {
            builder.timeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (rollback) {
            builder.rollbackOnFailure(true);
        }
        if (namespace != null) {
            builder.namespace(namespace);
        }
        if (failFast) {
            builder.continueOnFailure(false);
        }
        return builder.build();
    }
}
