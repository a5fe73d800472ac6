package com.meshcontrol.core.health;

import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.mesh.ServiceMeshManager;
import com.meshcontrol.core.mesh.ServiceStatusView;
import com.meshcontrol.core.metrics.RequestStats;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceHealth;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceHealthServiceTest {

    private static ServiceStatusView view(String id, ServiceHealth health, int healthy, int total) {
        return new ServiceStatusView(id, id, null, ServiceType.API, "1.2.0", health, Instant.EPOCH,
                healthy, total, List.of(), Map.of(), List.of(), RequestStats.EMPTY);
    }

    @Test
    void mapsServiceHealthToStatus() {
        assertEquals(HealthStatus.Status.UP,
                ServiceHealthService.toStatus(view("a", ServiceHealth.HEALTHY, 2, 2)).status());
        assertEquals(HealthStatus.Status.DEGRADED,
                ServiceHealthService.toStatus(view("a", ServiceHealth.DEGRADED, 1, 2)).status());
        assertEquals(HealthStatus.Status.DOWN,
                ServiceHealthService.toStatus(view("a", ServiceHealth.UNHEALTHY, 0, 2)).status());
    }

    @Test
    void detailCarriesEndpointCounts() {
        HealthStatus status = ServiceHealthService.toStatus(view("orders", ServiceHealth.DEGRADED, 1, 3));

        assertEquals("orders", status.component());
        assertEquals("1/3 endpoints healthy", status.detail());
        assertEquals("1.2.0", status.metadata().get("version"));
    }

    @Test
    void checkAllSkipsServicesRemovedMidway() {
        ServiceMeshManager mesh = mock(ServiceMeshManager.class);
        when(mesh.getServices()).thenReturn(List.of(
                ServiceInfo.of("orders", List.of(ServiceEndpoint.of("orders", "h1", 80))),
                ServiceInfo.of("gone", List.of(ServiceEndpoint.of("gone", "h2", 80)))));
        when(mesh.getServiceStatus("orders")).thenReturn(view("orders", ServiceHealth.HEALTHY, 1, 1));
        when(mesh.getServiceStatus("gone")).thenThrow(new ServiceNotFoundException("gone"));

        List<HealthStatus> results = new ServiceHealthService(mesh).checkAll();

        assertEquals(1, results.size());
        assertEquals("orders", results.get(0).component());
    }
}
