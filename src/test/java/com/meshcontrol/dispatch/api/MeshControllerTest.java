package com.meshcontrol.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshcontrol.core.balancer.StrategyType;
import com.meshcontrol.core.breaker.CircuitState;
import com.meshcontrol.core.error.CircuitBreakerOpenException;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.error.ServiceAlreadyRegisteredException;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.events.EventFilter;
import com.meshcontrol.core.events.EventKind;
import com.meshcontrol.core.mesh.MeshLifecycle;
import com.meshcontrol.core.mesh.MeshStatus;
import com.meshcontrol.core.mesh.ServiceMeshManager;
import com.meshcontrol.core.mesh.ServiceStatusView;
import com.meshcontrol.core.metrics.RequestStats;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceHealth;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceType;
import com.meshcontrol.core.ratelimit.RateLimitDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MeshController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class MeshControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ServiceMeshManager meshManager;

    @MockitoBean
    private MeshEventStreamService eventStreamService;

    private static ServiceStatusView statusView(String serviceId) {
        return new ServiceStatusView(serviceId, serviceId, null, ServiceType.API, "1.0.0", ServiceHealth.HEALTHY,
                NOW, 1, 1, List.of(), Map.of("http://10.0.0.1:8080", CircuitState.CLOSED), List.of(),
                RequestStats.EMPTY);
    }

    // ── POST /api/v1/services ────────────────────────────────────────

    @Test
    @DisplayName("POST /services registers the service and returns 201 with its status")
    void registerService() throws Exception {
        when(meshManager.getServiceStatus("orders")).thenReturn(statusView("orders"));

        String body = """
                {"service_id":"orders","type":"API","version":"2.1.0",
                 "endpoints":[{"host":"10.0.0.1","port":8080,"weight":3}]}
                """;

        mockMvc.perform(post("/api/v1/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.service_id").value("orders"))
                .andExpect(jsonPath("$.health").value("HEALTHY"));

        ArgumentCaptor<ServiceInfo> captor = ArgumentCaptor.forClass(ServiceInfo.class);
        verify(meshManager).registerService(captor.capture(), eq(false));
        ServiceInfo info = captor.getValue();
        assertEquals("2.1.0", info.version());
        assertEquals(3, info.endpoints().get(0).weight());
        assertEquals("http://10.0.0.1:8080", info.endpoints().get(0).endpointId());
    }

    @Test
    @DisplayName("POST /services for a taken id returns 409")
    void registerDuplicate() throws Exception {
        when(meshManager.registerService(any(ServiceInfo.class), anyBoolean()))
                .thenThrow(new ServiceAlreadyRegisteredException("orders"));

        mockMvc.perform(post("/api/v1/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service_id\":\"orders\",\"endpoints\":[{\"host\":\"h\",\"port\":80}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("service_already_registered"))
                .andExpect(jsonPath("$.service_id").value("orders"));
    }

    @Test
    @DisplayName("POST /services with an invalid body returns 400")
    void registerInvalid() throws Exception {
        when(meshManager.registerService(any(ServiceInfo.class), anyBoolean()))
                .thenThrow(new InvalidServiceConfigurationException("Service orders has no endpoints"));

        mockMvc.perform(post("/api/v1/services")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service_id\":\"orders\",\"endpoints\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"))
                .andExpect(jsonPath("$.message", containsString("no endpoints")));
    }

    // ── GET / DELETE /api/v1/services ────────────────────────────────

    @Test
    @DisplayName("GET /services lists registered services")
    void listServices() throws Exception {
        when(meshManager.getServices()).thenReturn(List.of(
                ServiceInfo.of("orders", List.of(ServiceEndpoint.of("orders", "10.0.0.1", 8080))),
                ServiceInfo.of("users", List.of(ServiceEndpoint.of("users", "10.0.0.2", 8080),
                        ServiceEndpoint.of("users", "10.0.0.3", 8080)))));

        mockMvc.perform(get("/api/v1/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].service_id").value("orders"))
                .andExpect(jsonPath("$[1].endpoints").value(2));
    }

    @Test
    @DisplayName("DELETE /services/{id} returns 204, or 404 when unknown")
    void unregister() throws Exception {
        when(meshManager.unregisterService("orders")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/services/orders"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/services/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("service_not_found"));
    }

    @Test
    @DisplayName("GET /services/{id} for an unknown service returns 404")
    void serviceStatusNotFound() throws Exception {
        when(meshManager.getServiceStatus("ghost")).thenThrow(new ServiceNotFoundException("ghost"));

        mockMvc.perform(get("/api/v1/services/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.service_id").value("ghost"));
    }

    // ── GET /api/v1/services/{id}/endpoint ───────────────────────────

    @Test
    @DisplayName("GET /services/{id}/endpoint previews the selected endpoint")
    void selectEndpoint() throws Exception {
        when(meshManager.previewServiceEndpoint("orders"))
                .thenReturn(ServiceEndpoint.of("orders", "10.0.0.1", 8080));

        mockMvc.perform(get("/api/v1/services/orders/endpoint"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.host").value("10.0.0.1"))
                .andExpect(jsonPath("$.port").value(8080));

        verify(meshManager, never()).getServiceEndpoint(any());
    }

    @Test
    @DisplayName("GET /services/{id}/endpoint with every circuit open returns 503 with Retry-After")
    void selectEndpointCircuitOpen() throws Exception {
        when(meshManager.previewServiceEndpoint("orders"))
                .thenThrow(new CircuitBreakerOpenException("orders", Duration.ofMillis(6500)));

        mockMvc.perform(get("/api/v1/services/orders/endpoint"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "7"))
                .andExpect(jsonPath("$.error").value("circuit_open"))
                .andExpect(jsonPath("$.retry_after_ms").value(6500));
    }

    // ── Mesh status and strategy ─────────────────────────────────────

    @Test
    @DisplayName("GET /mesh returns aggregate status")
    void meshStatus() throws Exception {
        when(meshManager.getMeshStatus()).thenReturn(new MeshStatus(MeshLifecycle.RUNNING, 2, 3, 2, 1,
                StrategyType.ROUND_ROBIN, 10, 8, 2, 12.5, 4, 1, Map.of("circuit_breaker", true), NOW));

        mockMvc.perform(get("/api/v1/mesh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.services_count").value(2))
                .andExpect(jsonPath("$.open_circuits").value(1))
                .andExpect(jsonPath("$.strategy").value("ROUND_ROBIN"))
                .andExpect(jsonPath("$.rate_limit_rejections").value(4));
    }

    @Test
    @DisplayName("PUT /mesh/strategy switches the strategy")
    void setStrategy() throws Exception {
        mockMvc.perform(put("/api/v1/mesh/strategy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategy\":\"least-connections\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("LEAST_CONNECTIONS"));

        verify(meshManager).setLoadBalancingStrategy(StrategyType.LEAST_CONNECTIONS);
    }

    @Test
    @DisplayName("PUT /mesh/strategy with an unknown name returns 400")
    void setStrategyUnknown() throws Exception {
        mockMvc.perform(put("/api/v1/mesh/strategy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategy\":\"fastest\"}"))
                .andExpect(status().isBadRequest());

        verify(meshManager, never()).setLoadBalancingStrategy(any());
    }

    // ── POST /api/v1/rate-limit/check ────────────────────────────────

    @Test
    @DisplayName("POST /rate-limit/check returns 200 when allowed and 429 when rejected")
    void rateLimitCheck() throws Exception {
        when(meshManager.checkRateLimit("c1", "orders", 1))
                .thenReturn(new RateLimitDecision(true, "burst", 4, 0))
                .thenReturn(new RateLimitDecision(false, "burst", 0, 1500));
        String body = objectMapper.writeValueAsString(new RateLimitCheckRequest("c1", "orders", null));

        mockMvc.perform(post("/api/v1/rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.remaining").value(4));

        mockMvc.perform(post("/api/v1/rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "2"))
                .andExpect(jsonPath("$.allowed").value(false));
    }

    @Test
    @DisplayName("POST /rate-limit/check without a client key returns 400")
    void rateLimitCheckMissingKey() throws Exception {
        mockMvc.perform(post("/api/v1/rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resource_key\":\"orders\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(meshManager);
    }

    // ── GET /api/v1/mesh/events ──────────────────────────────────────

    @Test
    @DisplayName("GET /mesh/events opens an SSE stream for the requested service")
    void streamEvents() throws Exception {
        when(eventStreamService.createEmitter(any(EventFilter.class))).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/mesh/events").param("service", "orders")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(eventStreamService).createEmitter(EventFilter.forService("orders"));
    }

    @Test
    @DisplayName("GET /mesh/events passes the kinds filter through")
    void streamEventsByKind() throws Exception {
        when(eventStreamService.createEmitter(any(EventFilter.class))).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/mesh/events").param("kinds", "circuit,endpoint")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk());

        verify(eventStreamService).createEmitter(
                new EventFilter(null, Set.of(EventKind.CIRCUIT, EventKind.ENDPOINT)));
    }

    @Test
    @DisplayName("GET /mesh/events with an unknown kind returns 400")
    void streamEventsUnknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/mesh/events").param("kinds", "latency"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(eventStreamService);
    }
}
