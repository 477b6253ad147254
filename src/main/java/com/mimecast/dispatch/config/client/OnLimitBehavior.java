package com.mimecast.dispatch.config.client;

import java.util.Locale;

/**
 * What the rate limiter does once the quota is used up.
 */
public enum OnLimitBehavior {

    /**
     * Fail immediately.
     */
    REJECT,

    /**
     * Wait until capacity frees up.
     */
    WAIT,

    /**
     * Wait up to the configured wait timeout, then fail.
     */
    WAIT_WITH_TIMEOUT;

    /**
     * Parses a behaviour name.
     *
     * @param value Name in any case, dashes allowed.
     * @return OnLimitBehavior instance.
     */
    public static OnLimitBehavior fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return "WAITWITHTIMEOUT".equals(normalized) ? WAIT_WITH_TIMEOUT : valueOf(normalized);
    }
}
