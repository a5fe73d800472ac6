package com.meshcontrol.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing mesh-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setService(String serviceId) {
        putIfPresent("serviceId", serviceId);
    }

    public static void setEndpoint(String serviceId, String endpointId) {
        putIfPresent("serviceId", serviceId);
        putIfPresent("endpointId", endpointId);
    }

    public static void setClient(String clientKey, String serviceId) {
        putIfPresent("clientKey", clientKey);
        putIfPresent("serviceId", serviceId);
    }

    public static void clear() {
        MDC.remove("serviceId");
        MDC.remove("endpointId");
        MDC.remove("clientKey");
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
