package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;

import java.time.Duration;
import java.util.Map;

/**
 * Circuit breaker configuration.
 *
 * <p>Durations are configured in seconds.
 */
public class CircuitBreakerConfig extends ConfigFoundation {

    public CircuitBreakerConfig() {
        super(Map.of());
    }

    public CircuitBreakerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets failures within the window that open the circuit.
     *
     * @return Integer.
     */
    public int getFailureThreshold() {
        return Math.toIntExact(getLongProperty("failureThreshold", 5L));
    }

    public Duration getFailureWindow() {
        return Duration.ofSeconds(getLongProperty("failureWindow", 60L));
    }

    /**
     * Gets how long the circuit stays open before trial calls are let through.
     *
     * @return Duration.
     */
    public Duration getRecoveryTimeout() {
        return Duration.ofSeconds(getLongProperty("recoveryTimeout", 30L));
    }

    /**
     * Gets consecutive half-open successes that close the circuit.
     * <p>Also bounds the number of concurrent trial calls.
     *
     * @return Integer.
     */
    public int getSuccessThreshold() {
        return Math.toIntExact(getLongProperty("successThreshold", 3L));
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }
}
