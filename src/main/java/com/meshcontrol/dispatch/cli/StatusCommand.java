package com.meshcontrol.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.http.HttpResponse;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * CLI command: meshctl status [service-id]
 * <p>
 * Without an argument, shows the mesh summary. With a service id, shows that
 * service's endpoints with their health and circuit state. {@code --watch}
 * follows the live event stream instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show mesh or service status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Service ID (omit for the whole mesh)")
    private String serviceId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--kinds"}, description = "With --watch, only these event kinds (e.g. circuit,endpoint)")
    private String kinds;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final MeshApiClient client;

    public StatusCommand(MeshApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();
        try {
            if (serviceId == null) {
                showMesh();
            } else {
                showService();
            }
        } catch (ConnectException e) {
            notRunning();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
        }
    }

    private void showMesh() throws Exception {
        MeshApiClient.ApiResponse response = client.get(port, "/api/v1/mesh");
        if (!response.isOk()) {
            ConsoleOutput.error(response.errorMessage());
            return;
        }
        JsonNode mesh = response.body();

        System.out.println();
        String lifecycle = mesh.path("lifecycle").asText();
        if ("RUNNING".equals(lifecycle)) {
            ConsoleOutput.success("Mesh: " + lifecycle);
        } else {
            ConsoleOutput.error("Mesh: " + lifecycle);
        }
        ConsoleOutput.info("Strategy: " + mesh.path("strategy").asText());
        ConsoleOutput.info(String.format("Services: %d | Endpoints: %d healthy of %d | Open circuits: %d",
                mesh.path("services_count").asInt(),
                mesh.path("healthy_endpoints").asInt(),
                mesh.path("total_endpoints").asInt(),
                mesh.path("open_circuits").asInt()));
        ConsoleOutput.info(String.format("Requests: %d total, %d ok, %d failed | avg %s",
                mesh.path("total_requests").asLong(),
                mesh.path("successful_requests").asLong(),
                mesh.path("failed_requests").asLong(),
                ConsoleOutput.formatMillis(mesh.path("average_response_time_ms").asDouble())));
        ConsoleOutput.info(String.format("Rate-limit rejections: %d | Active connections: %d",
                mesh.path("rate_limit_rejections").asLong(),
                mesh.path("active_connections").asInt()));

        JsonNode features = mesh.path("features");
        if (features.isObject()) {
            StringBuilder enabled = new StringBuilder();
            Iterator<Map.Entry<String, JsonNode>> it = features.fields();
            while (it.hasNext()) {
                var feature = it.next();
                if (enabled.length() > 0) enabled.append(", ");
                enabled.append(feature.getKey()).append('=').append(feature.getValue().asBoolean() ? "on" : "off");
            }
            ConsoleOutput.info("Features: " + enabled);
        }
    }

    private void showService() throws Exception {
        MeshApiClient.ApiResponse response = client.get(port, "/api/v1/services/" + encode(serviceId));
        if (response.status() == 404) {
            ConsoleOutput.error("Service not found: " + serviceId);
            return;
        }
        if (!response.isOk()) {
            ConsoleOutput.error(response.errorMessage());
            return;
        }
        JsonNode service = response.body();

        System.out.println();
        System.out.println("SERVICE " + service.path("service_id").asText());
        System.out.println("Name: " + service.path("name").asText() + " | Type: " + service.path("type").asText()
                + " | Version: " + service.path("version").asText("-"));

        String health = service.path("health").asText();
        String line = String.format("Health: %s (%d/%d endpoints healthy)", health,
                service.path("healthy_endpoints").asInt(), service.path("total_endpoints").asInt());
        switch (health) {
            case "HEALTHY" -> ConsoleOutput.success(line);
            case "UNHEALTHY" -> ConsoleOutput.error(line);
            default -> ConsoleOutput.warn(line);
        }

        JsonNode endpoints = service.path("endpoints");
        if (endpoints.isArray() && !endpoints.isEmpty()) {
            System.out.println();
            System.out.printf("  %-36s %-7s %-8s %-10s %-6s %s%n",
                    "ENDPOINT", "WEIGHT", "HEALTHY", "CIRCUIT", "FAILS", "IN-FLIGHT");
            System.out.println("  " + "-".repeat(80));
            for (JsonNode e : endpoints) {
                System.out.printf("  %-36s %-7d %-8s %-10s %-6d %d%n",
                        ConsoleOutput.truncate(e.path("endpoint_id").asText(), 36),
                        e.path("weight").asInt(),
                        e.path("healthy").asBoolean() ? "yes" : "no",
                        ConsoleOutput.circuit(e.path("circuit_state").asText()),
                        e.path("consecutive_failures").asInt(),
                        e.path("in_flight").asInt());
            }
        }

        JsonNode requests = service.path("requests");
        if (requests.isObject()) {
            System.out.println();
            ConsoleOutput.info(String.format("Requests: %d total, %d ok, %d failed | avg %s",
                    requests.path("total").asLong(),
                    requests.path("successful").asLong(),
                    requests.path("failed").asLong(),
                    ConsoleOutput.formatMillis(requests.path("averageResponseTimeMs").asDouble())));
        }
    }

    static String eventsPath(String serviceId, String kinds) {
        StringBuilder query = new StringBuilder();
        if (serviceId != null) {
            query.append("service=").append(encode(serviceId));
        }
        if (kinds != null && !kinds.isBlank()) {
            query.append(query.length() == 0 ? "" : "&").append("kinds=").append(encode(kinds));
        }
        return "/api/v1/mesh/events" + (query.length() == 0 ? "" : "?" + query);
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        String scope = serviceId == null ? "the mesh" : "service " + serviceId;
        ConsoleOutput.info("Watching " + scope + " (connecting to localhost:" + port + ")...");
        System.out.println();

        String path = eventsPath(serviceId, kinds);
        try {
            HttpResponse<Stream<String>> response = client.stream(port, path);
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");

        } catch (ConnectException e) {
            notRunning();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }

    private void notRunning() {
        ConsoleOutput.error("Cannot connect to mesh server at localhost:" + port);
        ConsoleOutput.info("Start the server first: meshctl serve");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
