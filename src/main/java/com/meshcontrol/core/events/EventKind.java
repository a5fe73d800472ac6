package com.meshcontrol.core.events;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Family of a {@link MeshEvent}, taken from the prefix of its type: {@code circuit.open}
 * is a {@link #CIRCUIT} event.
 */
public enum EventKind {
    MESH,
    SERVICE,
    ENDPOINT,
    CIRCUIT;

    public static EventKind ofType(String eventType) {
        int dot = eventType.indexOf('.');
        return from(dot < 0 ? eventType : eventType.substring(0, dot));
    }

    public static EventKind from(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event kind '" + name.trim()
                    + "'; expected one of mesh, service, endpoint, circuit", e);
        }
    }

    /**
     * Parses a comma-separated list such as {@code circuit,endpoint}. Blank input means
     * every kind.
     */
    public static Set<EventKind> parseList(String csv) {
        if (csv == null || csv.isBlank()) {
            return EnumSet.allOf(EventKind.class);
        }
        Set<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                kinds.add(from(part));
            }
        }
        return kinds.isEmpty() ? EnumSet.allOf(EventKind.class) : kinds;
    }
}
