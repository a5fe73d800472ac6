package com.meshcontrol.dispatch.api;

import com.meshcontrol.core.error.CircuitBreakerOpenException;
import com.meshcontrol.core.error.ConnectionPoolTimeoutException;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.error.LoadBalancingException;
import com.meshcontrol.core.error.MeshException;
import com.meshcontrol.core.error.RateLimitExceededException;
import com.meshcontrol.core.error.ServiceAlreadyRegisteredException;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.error.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps mesh exceptions to HTTP responses.
 */
@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(ServiceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ServiceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("service_not_found", ex.getMessage(), ex.getServiceId(), null));
    }

    @ExceptionHandler(ServiceAlreadyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ServiceAlreadyRegisteredException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("service_already_registered", ex.getMessage(), ex.getServiceId(), null));
    }

    @ExceptionHandler(CircuitBreakerOpenException.class)
    public ResponseEntity<ErrorResponse> handleCircuitOpen(CircuitBreakerOpenException ex) {
        long retryMs = ex.getRetryAfter().toMillis();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(retryMs)))
                .body(new ErrorResponse("circuit_open", ex.getMessage(), ex.getServiceId(), retryMs));
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(ServiceUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("service_unavailable", ex.getMessage(), ex.getServiceId(), null));
    }

    @ExceptionHandler({InvalidServiceConfigurationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_request", ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(ex.getRetryAfterMillis())))
                .body(new ErrorResponse("rate_limited", ex.getMessage(), ex.getResourceKey(),
                        ex.getRetryAfterMillis()));
    }

    @ExceptionHandler(ConnectionPoolTimeoutException.class)
    public ResponseEntity<ErrorResponse> handlePoolTimeout(ConnectionPoolTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorResponse.of("pool_timeout", ex.getMessage()));
    }

    @ExceptionHandler(LoadBalancingException.class)
    public ResponseEntity<ErrorResponse> handleBalancing(LoadBalancingException ex) {
        log.error("Load balancing failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("load_balancing_error", ex.getMessage()));
    }

    @ExceptionHandler(MeshException.class)
    public ResponseEntity<ErrorResponse> handleMesh(MeshException ex) {
        log.error("Unhandled mesh error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("mesh_error", ex.getMessage()));
    }

    // Retry-After is whole seconds; never advertise 0 for a pending wait.
    static long retryAfterSeconds(long millis) {
        return millis <= 0 ? 0 : millis / 1000 + (millis % 1000 == 0 ? 0 : 1);
    }
}
