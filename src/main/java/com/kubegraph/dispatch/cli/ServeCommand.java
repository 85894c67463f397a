package com.kubegraph.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: kubegraph serve
 * <p>
 * Starts the HTTP API. The web server is enabled by
 * {@link com.kubegraph.KubegraphApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the server keeps the JVM alive.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Kubegraph HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Kubegraph server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
