package com.meshcontrol.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the mesh control plane.
 * Routes to subcommands: serve, status, services, health, strategy.
 */
@Command(
        name = "meshctl",
        mixinStandardHelpOptions = true,
        version = "meshctl 0.1.0",
        description = "Service mesh control plane: discovery, load balancing, circuit breaking and rate limiting",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                ServicesCommand.class,
                HealthCommand.class,
                StrategyCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MeshCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
