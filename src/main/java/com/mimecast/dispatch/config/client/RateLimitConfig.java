package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;

import java.time.Duration;
import java.util.Map;

/**
 * Rate limit configuration.
 *
 * <p>Disabled by default. Durations are configured in seconds.
 */
public class RateLimitConfig extends ConfigFoundation {

    public RateLimitConfig() {
        super(Map.of());
    }

    public RateLimitConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum sends admitted per window.
     *
     * @return Integer or null for unlimited.
     */
    public Integer getMaxEmails() {
        Long value = getLongProperty("maxEmails");
        return value != null ? Math.toIntExact(value) : null;
    }

    public Duration getWindow() {
        return Duration.ofSeconds(getLongProperty("window", 60L));
    }

    /**
     * Gets maximum concurrent sends in flight.
     *
     * @return Integer or null for unlimited.
     */
    public Integer getMaxConnections() {
        Long value = getLongProperty("maxConnections");
        return value != null ? Math.toIntExact(value) : null;
    }

    public OnLimitBehavior getOnLimit() {
        return OnLimitBehavior.fromString(getStringProperty("onLimit", "reject"));
    }

    /**
     * Gets longest wait when behaviour is WAIT_WITH_TIMEOUT.
     *
     * @return Duration.
     */
    public Duration getWaitTimeout() {
        return Duration.ofSeconds(getLongProperty("waitTimeout", 30L));
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }
}
