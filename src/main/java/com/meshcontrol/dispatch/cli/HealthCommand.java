package com.meshcontrol.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: meshctl health
 * <p>
 * Shows the health of every registered service with colored output.
 * Exits 1 when any service is down or the server cannot be reached.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check service health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final MeshApiClient client;

    public HealthCommand(MeshApiClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        MeshApiClient.ApiResponse response;
        try {
            response = client.get(port, "/api/v1/health");
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to mesh server at localhost:" + port);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Health check failed: " + e.getMessage());
            return 1;
        }

        // 503 still carries the per-service breakdown
        if (!response.isOk() && response.status() != 503) {
            ConsoleOutput.error(response.errorMessage());
            return 1;
        }

        JsonNode services = response.body().path("services");
        if (!services.isObject() || services.isEmpty()) {
            ConsoleOutput.info("No services registered.");
        } else {
            Iterator<Map.Entry<String, JsonNode>> it = services.fields();
            while (it.hasNext()) {
                var entry = it.next();
                String label = entry.getKey() + ": " + entry.getValue().path("detail").asText();
                switch (entry.getValue().path("status").asText()) {
                    case "UP" -> ConsoleOutput.success(label);
                    case "DOWN" -> ConsoleOutput.error(label);
                    default -> ConsoleOutput.warn(label);
                }
            }
        }

        String overall = response.body().path("status").asText("UNKNOWN");
        System.out.println("──────────────────────────────────");
        switch (overall) {
            case "UP" -> ConsoleOutput.success("Overall: all services operational");
            case "DEGRADED" -> ConsoleOutput.warn("Overall: one or more services degraded");
            default -> ConsoleOutput.error("Overall: one or more services down");
        }
        return "DOWN".equals(overall) ? 1 : 0;
    }
}
