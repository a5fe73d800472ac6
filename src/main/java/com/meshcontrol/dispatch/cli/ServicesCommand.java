package com.meshcontrol.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;

/**
 * CLI command: meshctl services
 * <p>
 * Lists registered services in service-id order.
 */
@Command(name = "services", mixinStandardHelpOptions = true, description = "List registered services")
@Component
public class ServicesCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final MeshApiClient client;

    public ServicesCommand(MeshApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            MeshApiClient.ApiResponse response = client.get(port, "/api/v1/services");
            if (!response.isOk()) {
                ConsoleOutput.error(response.errorMessage());
                return;
            }
            JsonNode services = response.body();
            if (!services.isArray() || services.isEmpty()) {
                ConsoleOutput.info("No services registered.");
                return;
            }

            System.out.println();
            System.out.printf("  %-24s %-24s %-12s %-10s %s%n", "SERVICE", "NAME", "TYPE", "VERSION", "ENDPOINTS");
            System.out.println("  " + "-".repeat(80));
            for (JsonNode s : services) {
                System.out.printf("  %-24s %-24s %-12s %-10s %d%n",
                        ConsoleOutput.truncate(s.path("service_id").asText(), 24),
                        ConsoleOutput.truncate(s.path("name").asText(), 24),
                        s.path("type").asText(),
                        s.path("version").asText("-"),
                        s.path("endpoints").asInt());
            }
            System.out.println();
            ConsoleOutput.info(services.size() + " service" + (services.size() != 1 ? "s" : ""));

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to mesh server at localhost:" + port);
            ConsoleOutput.info("Start the server first: meshctl serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Listing services failed: " + e.getMessage());
        }
    }
}
