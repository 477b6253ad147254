package com.mimecast.dispatch.config.client;

import java.util.Locale;

/**
 * Transport encryption policy.
 */
public enum TlsMode {

    /**
     * Plaintext only.
     */
    NONE,

    /**
     * Upgrade with STARTTLS when advertised, continue in plaintext otherwise.
     */
    STARTTLS,

    /**
     * Upgrade with STARTTLS and fail if the server does not advertise it.
     */
    STARTTLS_REQUIRED,

    /**
     * TLS from the first byte.
     */
    IMPLICIT;

    /**
     * Parses a mode name.
     * <p>Accepts enum names in any case plus the aliases opportunistic and required.
     *
     * @param value Mode name.
     * @return TlsMode instance.
     */
    public static TlsMode fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "OPPORTUNISTIC" -> STARTTLS;
            case "REQUIRED" -> STARTTLS_REQUIRED;
            case "TLS", "SMTPS" -> IMPLICIT;
            default -> valueOf(normalized);
        };
    }

    /**
     * Does this mode demand an encrypted channel.
     *
     * @return Boolean.
     */
    public boolean isEncryptionRequired() {
        return this == STARTTLS_REQUIRED || this == IMPLICIT;
    }
}
