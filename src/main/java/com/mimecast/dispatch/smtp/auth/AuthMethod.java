package com.mimecast.dispatch.smtp.auth;

import java.util.Locale;

/**
 * SASL mechanisms supported by the client.
 *
 * <p>Priority orders mechanisms by strength, higher is preferred.
 * <br>Mechanisms that send a reusable secret in the clear require an encrypted channel.
 */
public enum AuthMethod {
    LOGIN("LOGIN", 1, true),
    PLAIN("PLAIN", 2, true),
    CRAM_MD5("CRAM-MD5", 3, false),
    XOAUTH2("XOAUTH2", 4, false),
    OAUTHBEARER("OAUTHBEARER", 5, false);

    private final String mechanism;
    private final int priority;
    private final boolean requiresTls;

    AuthMethod(String mechanism, int priority, boolean requiresTls) {
        this.mechanism = mechanism;
        this.priority = priority;
        this.requiresTls = requiresTls;
    }

    /**
     * Gets SASL mechanism name as used on the wire.
     *
     * @return Mechanism name.
     */
    public String getMechanism() {
        return mechanism;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isRequiresTls() {
        return requiresTls;
    }

    /**
     * Parses a SASL mechanism name.
     *
     * @param value Mechanism name in any case.
     * @return AuthMethod or null if unsupported.
     */
    public static AuthMethod fromMechanism(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (AuthMethod method : values()) {
            if (method.mechanism.equals(normalized)) {
                return method;
            }
        }
        return null;
    }
}
