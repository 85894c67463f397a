package com.kubegraph.dispatch.cli;

import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.graph.DependencyGraph;
import com.kubegraph.core.graph.DependencyGraphBuilder;
import com.kubegraph.core.reference.Reference;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph graph &lt;file&gt;
 */
@Command(name = "graph", mixinStandardHelpOptions = true, description = "Print dependency levels")
@Component
public class GraphCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph definition file (YAML or JSON)")
    private Path file;

    private final GraphDefinitionLoader loader;
    private final DependencyGraphBuilder builder;

    public GraphCommand(GraphDefinitionLoader loader, DependencyGraphBuilder builder) {
        this.loader = loader;
        this.builder = builder;
    }

    @Override
    public Integer call() {
        DependencyGraph graph;
        try {
            graph = builder.build(loader.load(file));
        } catch (KubegraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        List<List<String>> levels = graph.levels();
        for (int i = 0; i < levels.size(); i++) {
            ConsoleOutput.level(i, levels.get(i));
            for (String id : levels.get(i)) {
                var deps = graph.dependenciesOf(id);
                if (!deps.isEmpty()) {
                    System.out.println("    " + id + " <- " + String.join(", ", deps));
                }
            }
        }
        for (Reference ref : graph.externalReferences()) {
            ConsoleOutput.warn("External reference: " + ref.toCelPath());
        }
        return 0;
    }
}
