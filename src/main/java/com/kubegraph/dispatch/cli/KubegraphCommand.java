package com.kubegraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Kubegraph.
 */
@Command(
        name = "kubegraph",
        mixinStandardHelpOptions = true,
        version = "Kubegraph 0.1.0",
        description = "Compile and deploy Kubernetes resource graphs",
        subcommands = {
                DetectCommand.class,
                CompileCommand.class,
                GraphCommand.class,
                RenderCommand.class,
                DeployCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KubegraphCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
