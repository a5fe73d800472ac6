package com.meshcontrol.core.health;

import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.mesh.ServiceMeshManager;
import com.meshcontrol.core.mesh.ServiceStatusView;
import com.meshcontrol.core.model.ServiceHealth;
import com.meshcontrol.core.model.ServiceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-service health as reported by {@code /api/v1/health} and {@code meshctl health}.
 */
@Service
public class ServiceHealthService {

    private static final Logger log = LoggerFactory.getLogger(ServiceHealthService.class);

    private final ServiceMeshManager meshManager;

    public ServiceHealthService(ServiceMeshManager meshManager) {
        this.meshManager = meshManager;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (ServiceInfo info : meshManager.getServices()) {
            try {
                results.add(toStatus(meshManager.getServiceStatus(info.serviceId())));
            } catch (ServiceNotFoundException e) {
                // unregistered while iterating
                log.debug("Service {} disappeared during health check", info.serviceId());
            }
        }
        return results;
    }

    public HealthStatus check(String serviceId) {
        return toStatus(meshManager.getServiceStatus(serviceId));
    }

    static HealthStatus toStatus(ServiceStatusView view) {
        HealthStatus.Status status = map(view.health());
        String detail = view.healthyEndpoints() + "/" + view.totalEndpoints() + " endpoints healthy";
        return new HealthStatus(view.serviceId(), status, detail, Map.of(
                "healthy_endpoints", String.valueOf(view.healthyEndpoints()),
                "total_endpoints", String.valueOf(view.totalEndpoints()),
                "version", view.version()));
    }

    private static HealthStatus.Status map(ServiceHealth health) {
        return switch (health) {
            case HEALTHY -> HealthStatus.Status.UP;
            case DEGRADED -> HealthStatus.Status.DEGRADED;
            case UNHEALTHY -> HealthStatus.Status.DOWN;
            case UNKNOWN -> HealthStatus.Status.UNKNOWN;
        };
    }
}
