package com.meshcontrol.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.util.Map;

/**
 * CLI command: meshctl strategy &lt;name&gt;
 * <p>
 * Switches the mesh-wide load-balancing strategy of a running server.
 */
@Command(name = "strategy", mixinStandardHelpOptions = true,
        description = "Change the load-balancing strategy (round_robin, least_connections, random, "
                + "weighted_round_robin, weighted_random, least_response_time)")
@Component
public class StrategyCommand implements Runnable {

    @Parameters(index = "0", description = "Strategy name")
    private String strategy;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final MeshApiClient client;

    public StrategyCommand(MeshApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        try {
            MeshApiClient.ApiResponse response = client.put(port, "/api/v1/mesh/strategy",
                    Map.of("strategy", strategy));
            if (response.isOk()) {
                ConsoleOutput.success("Load-balancing strategy set to " + response.body().path("strategy").asText());
            } else {
                ConsoleOutput.error(response.errorMessage());
            }
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to mesh server at localhost:" + port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            ConsoleOutput.error("Strategy change failed: " + e.getMessage());
        }
    }
}
