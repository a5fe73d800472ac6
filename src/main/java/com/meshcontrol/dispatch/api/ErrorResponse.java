package com.meshcontrol.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON error body returned by {@link GlobalErrorHandler}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    @JsonProperty("service_id") String serviceId,
    @JsonProperty("retry_after_ms") Long retryAfterMs
) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null);
    }
}
