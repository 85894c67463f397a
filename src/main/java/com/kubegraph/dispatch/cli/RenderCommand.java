package com.kubegraph.dispatch.cli;

import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.serialization.ControlLoopManifestWriter;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph render &lt;file&gt;
 * <p>
 * Prints the ResourceGraphDefinition the control-loop strategy would apply.
 */
@Command(name = "render", mixinStandardHelpOptions = true,
        description = "Print the control-loop ResourceGraphDefinition as YAML")
@Component
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph definition file (YAML or JSON)")
    private Path file;

    @Option(names = "--instance", description = "Also print the instance manifest")
    private boolean instance;

    @Option(names = {"--namespace", "-n"}, description = "Namespace of the instance", defaultValue = "default")
    private String namespace;

    private final GraphDefinitionLoader loader;
    private final ControlLoopManifestWriter writer;

    public RenderCommand(GraphDefinitionLoader loader, ControlLoopManifestWriter writer) {
        this.loader = loader;
        this.writer = writer;
    }

    @Override
    public Integer call() {
        try {
            ResourceGraph graph = loader.load(file);
            System.out.print(writer.toYaml(graph));
            if (instance) {
                System.out.println("---");
                System.out.print(ControlLoopManifestWriter.yaml(writer.toInstance(graph, namespace)));
            }
            return 0;
        } catch (KubegraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
