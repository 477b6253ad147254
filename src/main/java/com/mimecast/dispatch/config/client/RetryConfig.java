package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;

import java.time.Duration;
import java.util.Map;

/**
 * Retry configuration.
 *
 * <p>Delays are configured in milliseconds.
 */
public class RetryConfig extends ConfigFoundation {

    public RetryConfig() {
        super(Map.of());
    }

    public RetryConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum attempts including the first one.
     *
     * @return Integer.
     */
    public int getMaxAttempts() {
        return Math.toIntExact(getLongProperty("maxAttempts", 3L));
    }

    public Duration getInitialDelay() {
        return Duration.ofMillis(getLongProperty("initialDelay", 500L));
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(getLongProperty("maxDelay", 30000L));
    }

    public double getMultiplier() {
        return getDoubleProperty("multiplier", 2.0);
    }

    /**
     * Is randomized jitter of up to 30% added to each delay.
     *
     * @return Boolean.
     */
    public boolean isJitter() {
        return getBooleanProperty("jitter", true);
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }
}
