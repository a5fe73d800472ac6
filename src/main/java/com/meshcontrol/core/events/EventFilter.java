package com.meshcontrol.core.events;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Selects the events a subscriber receives. A service-scoped filter never matches
 * mesh-level events, which carry no service id.
 *
 * @param serviceId service to follow, or null for every service
 * @param kinds     event kinds to deliver; never empty
 */
public record EventFilter(String serviceId, Set<EventKind> kinds) {

    public static final EventFilter ALL = new EventFilter(null, EnumSet.allOf(EventKind.class));

    public EventFilter {
        kinds = kinds == null || kinds.isEmpty() ? Collections.unmodifiableSet(EnumSet.allOf(EventKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public static EventFilter forService(String serviceId) {
        return new EventFilter(serviceId, null);
    }

    public static EventFilter of(String serviceId, String kindsCsv) {
        return new EventFilter(serviceId, EventKind.parseList(kindsCsv));
    }

    public boolean matches(MeshEvent event) {
        if (serviceId != null && !serviceId.equals(event.serviceId())) {
            return false;
        }
        return kinds.contains(event.kind());
    }

    /** Short label for logs, e.g. {@code service orders [CIRCUIT]}. */
    public String describe() {
        String scope = serviceId == null ? "mesh" : "service " + serviceId;
        return kinds.size() == EventKind.values().length ? scope : scope + " " + kinds;
    }
}
