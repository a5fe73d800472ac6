package com.meshcontrol.core.pool;

import com.meshcontrol.core.error.InvalidServiceConfigurationException;

import java.time.Duration;

/**
 * @param maxConnectionsPerEndpoint upper bound of connections handed out per endpoint
 * @param acquireTimeout            how long an acquisition may wait for a free connection
 */
public record PoolConfig(int maxConnectionsPerEndpoint, Duration acquireTimeout) {

    public static final PoolConfig DEFAULT = new PoolConfig(10, Duration.ofSeconds(1));

    public PoolConfig {
        if (maxConnectionsPerEndpoint < 1) {
            throw new InvalidServiceConfigurationException("maxConnectionsPerEndpoint must be >= 1");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new InvalidServiceConfigurationException("acquireTimeout must not be negative");
        }
    }
}
