package com.meshcontrol.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for meshctl.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MESHCTL v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MESH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Colors a circuit state name: green when closed, yellow half-open, red open. */
    public static String circuit(String state) {
        String color = switch (state) {
            case "CLOSED" -> "fg(green)";
            case "HALF_OPEN" -> "fg(yellow)";
            case "OPEN" -> "fg(red)";
            default -> "fg(white)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + state + "|@");
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "service.registered", "service.replaced" -> "@|fg(cyan) [SERVICE]|@";
            case "service.unregistered" -> "@|fg(magenta) [SERVICE]|@";
            case "endpoint.healthy" -> "@|fg(green) [HEALTH]|@";
            case "endpoint.unhealthy" -> "@|fg(red) [HEALTH]|@";
            case "circuit.open" -> "@|fg(red),bold [CIRCUIT]|@";
            case "circuit.half_open" -> "@|fg(yellow) [CIRCUIT]|@";
            case "circuit.closed" -> "@|fg(green) [CIRCUIT]|@";
            case "mesh.started", "mesh.stopped", "mesh.strategy_changed" -> "@|bold,fg(yellow) [MESH]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatMillis(double ms) {
        if (ms < 1000) return String.format("%.1fms", ms);
        return String.format("%.2fs", ms / 1000);
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
