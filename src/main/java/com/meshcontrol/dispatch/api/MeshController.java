package com.meshcontrol.dispatch.api;

import com.meshcontrol.core.balancer.StrategyType;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.events.EventFilter;
import com.meshcontrol.core.mesh.MeshStatus;
import com.meshcontrol.core.mesh.ServiceMeshManager;
import com.meshcontrol.core.mesh.ServiceStatusView;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.ratelimit.RateLimitDecision;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for service registration, routing and mesh status.
 */
@RestController
@RequestMapping("/api/v1")
public class MeshController {

    private final ServiceMeshManager meshManager;
    private final MeshEventStreamService eventStreamService;

    public MeshController(ServiceMeshManager meshManager, MeshEventStreamService eventStreamService) {
        this.meshManager = meshManager;
        this.eventStreamService = eventStreamService;
    }

    /**
     * POST /api/v1/services: Register a service. 201 on success, 409 if the id is taken
     * and {@code replace} is false.
     */
    @PostMapping("/services")
    public ResponseEntity<ServiceStatusView> registerService(
            @RequestBody RegisterServiceRequest request,
            @RequestParam(name = "replace", defaultValue = "false") boolean replace) {
        ServiceInfo info = request.toServiceInfo();
        meshManager.registerService(info, replace);
        return ResponseEntity.status(HttpStatus.CREATED).body(meshManager.getServiceStatus(info.serviceId()));
    }

    @GetMapping("/services")
    public List<Map<String, Object>> listServices() {
        return meshManager.getServices().stream().map(info -> {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("service_id", info.serviceId());
            summary.put("name", info.name());
            summary.put("type", info.type());
            summary.put("version", info.version());
            summary.put("endpoints", info.endpoints().size());
            return summary;
        }).toList();
    }

    /**
     * DELETE /api/v1/services/{id}: Unregister a service. 204, or 404 if unknown.
     */
    @DeleteMapping("/services/{serviceId}")
    public ResponseEntity<Void> unregisterService(@PathVariable String serviceId) {
        if (!meshManager.unregisterService(serviceId)) {
            throw new ServiceNotFoundException(serviceId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/services/{serviceId}")
    public ServiceStatusView getServiceStatus(@PathVariable String serviceId) {
        return meshManager.getServiceStatus(serviceId);
    }

    /**
     * GET /api/v1/services/{id}/endpoint: Select an endpoint for the next call.
     * <p>
     * The selection only answers "where would a call go now"; it is not followed by a
     * call through this server, so any breaker permit it took is returned immediately.
     */
    @GetMapping("/services/{serviceId}/endpoint")
    public ServiceEndpoint selectEndpoint(@PathVariable String serviceId) {
        return meshManager.previewServiceEndpoint(serviceId);
    }

    @GetMapping("/mesh")
    public MeshStatus getMeshStatus() {
        return meshManager.getMeshStatus();
    }

    @PutMapping("/mesh/strategy")
    public Map<String, String> setStrategy(@RequestBody StrategyRequest request) {
        StrategyType type = StrategyType.from(request.strategy());
        meshManager.setLoadBalancingStrategy(type);
        return Map.of("strategy", type.name());
    }

    /**
     * POST /api/v1/rate-limit/check: Consume budget for a client/resource pair.
     * 200 with the decision when allowed, 429 when rejected.
     */
    @PostMapping("/rate-limit/check")
    public ResponseEntity<RateLimitDecision> checkRateLimit(@RequestBody RateLimitCheckRequest request) {
        if (request.clientKey() == null || request.resourceKey() == null) {
            throw new IllegalArgumentException("client_key and resource_key are required");
        }
        int cost = request.cost() == null ? 1 : request.cost();
        RateLimitDecision decision = meshManager.checkRateLimit(request.clientKey(), request.resourceKey(), cost);
        if (decision.allowed()) {
            return ResponseEntity.ok(decision);
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(GlobalErrorHandler.retryAfterSeconds(decision.retryAfterMillis())))
                .body(decision);
    }

    /**
     * GET /api/v1/mesh/events: SSE stream of mesh events, optionally for one service and
     * a comma-separated list of kinds ({@code mesh}, {@code service}, {@code endpoint},
     * {@code circuit}).
     */
    @GetMapping(value = "/mesh/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@RequestParam(name = "service", required = false) String serviceId,
                                   @RequestParam(name = "kinds", required = false) String kinds) {
        return eventStreamService.createEmitter(EventFilter.of(serviceId, kinds));
    }
}
