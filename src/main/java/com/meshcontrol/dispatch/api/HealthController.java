package com.meshcontrol.dispatch.api;

import com.meshcontrol.core.health.HealthStatus;
import com.meshcontrol.core.health.ServiceHealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for per-service health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final ServiceHealthService healthService;

    public HealthController(ServiceHealthService healthService) {
        this.healthService = healthService;
    }

    /**
     * GET /api/v1/health: Health of every registered service.
     * Returns 200 unless some service has no healthy endpoint, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        var checks = healthService.checkAll();
        boolean anyDown = false;
        boolean anyDegraded = false;

        Map<String, Object> services = new LinkedHashMap<>();
        for (var check : checks) {
            services.put(check.component(), describe(check));
            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            } else if (check.status() == HealthStatus.Status.DEGRADED) {
                anyDegraded = true;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("services", services);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/health/{serviceId}: Health of one service; 404 if unknown.
     */
    @GetMapping("/{serviceId}")
    public ResponseEntity<Map<String, Object>> serviceHealth(@PathVariable String serviceId) {
        HealthStatus check = healthService.check(serviceId);
        Map<String, Object> body = describe(check);
        body.put("service_id", check.component());
        return check.status() == HealthStatus.Status.DOWN
                ? ResponseEntity.status(503).body(body)
                : ResponseEntity.ok(body);
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("status", check.status().name());
        info.put("detail", check.detail());
        info.putAll(check.metadata());
        return info;
    }
}
