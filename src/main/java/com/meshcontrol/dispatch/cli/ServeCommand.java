package com.meshcontrol.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: meshctl serve
 * <p>
 * Starts the mesh as a long-running HTTP server exposing the REST API and the
 * SSE event stream. The web server is enabled by
 * {@link com.meshcontrol.MeshControlApplication#main} detecting "serve" in args.
 * <p>
 * In serve mode {@link CliRunner} skips picocli, so the banner is printed from a
 * {@link WebServerInitializedEvent} listener once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 meshctl serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the mesh control plane HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Mesh control plane running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Events:   http://localhost:" + port + "/api/v1/mesh/events");
        System.out.println("  Metrics:  http://localhost:" + port + "/actuator/metrics");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
