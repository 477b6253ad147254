package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;

import java.time.Duration;
import java.util.Map;

/**
 * Connection pool configuration.
 *
 * <p>Durations are configured in seconds.
 */
public class PoolConfig extends ConfigFoundation {

    public PoolConfig() {
        super(Map.of());
    }

    public PoolConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum number of live connections.
     *
     * @return Integer.
     */
    public int getMaxConnections() {
        return Math.toIntExact(getLongProperty("maxConnections", 5L));
    }

    /**
     * Gets number of idle connections kept warm by the health check.
     *
     * @return Integer.
     */
    public int getMinIdle() {
        return Math.toIntExact(getLongProperty("minIdle", 1L));
    }

    public Duration getAcquireTimeout() {
        return Duration.ofSeconds(getLongProperty("acquireTimeout", 30L));
    }

    public Duration getIdleTimeout() {
        return Duration.ofSeconds(getLongProperty("idleTimeout", 300L));
    }

    public Duration getMaxLifetime() {
        return Duration.ofSeconds(getLongProperty("maxLifetime", 3600L));
    }

    public boolean isHealthCheckEnabled() {
        return getBooleanProperty("healthCheckEnabled", true);
    }

    public Duration getHealthCheckInterval() {
        return Duration.ofSeconds(getLongProperty("healthCheckInterval", 60L));
    }
}
