package com.meshcontrol.core.balancer;

import com.meshcontrol.core.error.InvalidServiceConfigurationException;

import java.util.Locale;

/**
 * Endpoint selection policies supported by the {@link LoadBalancer}.
 */
public enum StrategyType {
    ROUND_ROBIN,
    LEAST_CONNECTIONS,
    WEIGHTED_RANDOM,
    RANDOM,
    WEIGHTED_ROUND_ROBIN,
    LEAST_RESPONSE_TIME;

    /**
     * Parses a strategy name case-insensitively, accepting {@code -} in place of {@code _}.
     *
     * @throws InvalidServiceConfigurationException for unknown names
     */
    public static StrategyType from(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidServiceConfigurationException("Load-balancing strategy must not be blank");
        }
        try {
            return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidServiceConfigurationException("Unknown load-balancing strategy: " + name);
        }
    }
}
