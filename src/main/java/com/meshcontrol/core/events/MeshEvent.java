package com.meshcontrol.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the mesh, used for SSE streaming.
 *
 * @param eventType  event type (e.g. "service.registered", "circuit.open", "endpoint.unhealthy")
 * @param serviceId  the service this event belongs to (nullable for mesh-level events)
 * @param endpointId the endpoint this event relates to (nullable for service-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record MeshEvent(
    String eventType,
    String serviceId,
    String endpointId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public MeshEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public EventKind kind() {
        return EventKind.ofType(eventType);
    }
}
