package com.kubegraph.dispatch.cli;

import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.expression.DetectionResult;
import com.kubegraph.core.expression.ReferenceDetector;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.reference.Reference;
import com.kubegraph.core.serialization.GraphDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: kubegraph detect &lt;file&gt;
 * <p>
 * Lists the references each resource and status field holds.
 */
@Command(name = "detect", mixinStandardHelpOptions = true, description = "List references per resource")
@Component
public class DetectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph definition file (YAML or JSON)")
    private Path file;

    private final GraphDefinitionLoader loader;
    private final ReferenceDetector detector;

    public DetectCommand(GraphDefinitionLoader loader, ReferenceDetector detector) {
        this.loader = loader;
        this.detector = detector;
    }

    @Override
    public Integer call() {
        ResourceGraph graph;
        try {
            graph = loader.load(file);
        } catch (KubegraphException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        for (GraphResource resource : graph.resources()) {
            print(resource.id(), detector.detect(resource.manifest()));
        }
        graph.statusProjection().forEach((field, expression) -> print("status." + field, detector.detect(expression)));
        return 0;
    }

    private static void print(String subject, DetectionResult detection) {
        if (!detection.hasReferences()) {
            ConsoleOutput.info(subject + ": no references");
            return;
        }
        ConsoleOutput.info(subject + ": " + detection.references().size() + " reference(s)"
                + (detection.truncated() ? " (depth limit reached)" : ""));
        for (Reference ref : detection.references()) {
            System.out.println("    " + ref.toCelPath());
        }
    }
}
