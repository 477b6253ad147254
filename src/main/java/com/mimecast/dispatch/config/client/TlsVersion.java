package com.mimecast.dispatch.config.client;

import java.util.Arrays;
import java.util.Locale;

/**
 * TLS protocol versions in ascending order.
 */
public enum TlsVersion {
    TLS_1_0("TLSv1"),
    TLS_1_1("TLSv1.1"),
    TLS_1_2("TLSv1.2"),
    TLS_1_3("TLSv1.3");

    private final String protocol;

    TlsVersion(String protocol) {
        this.protocol = protocol;
    }

    /**
     * Gets the JSSE protocol name.
     *
     * @return Protocol string.
     */
    public String getProtocol() {
        return protocol;
    }

    /**
     * Is this version deprecated by RFC 8996.
     *
     * @return Boolean.
     */
    public boolean isDeprecated() {
        return this == TLS_1_0 || this == TLS_1_1;
    }

    /**
     * Gets JSSE protocol names of this version and every newer one.
     *
     * @return Protocols array.
     */
    public String[] getProtocolsFrom() {
        return Arrays.stream(values())
                .filter(v -> v.ordinal() >= ordinal())
                .map(TlsVersion::getProtocol)
                .toArray(String[]::new);
    }

    /**
     * Parses a version.
     * <p>Accepts JSSE names (TLSv1.2), bare numbers (1.2) and enum names (TLS_1_2).
     *
     * @param value Version string.
     * @return TlsVersion instance.
     */
    public static TlsVersion fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TlsVersion version : values()) {
            if (version.name().equals(normalized) || version.protocol.toUpperCase(Locale.ROOT).equals(normalized)) {
                return version;
            }
        }
        return switch (normalized.replace("TLSV", "").replace("TLS", "").replace("_", ".")) {
            case "1", "1.0", "10" -> TLS_1_0;
            case "1.1", "11" -> TLS_1_1;
            case "1.2", "12" -> TLS_1_2;
            case "1.3", "13" -> TLS_1_3;
            default -> throw new IllegalArgumentException("Unknown TLS version: " + value);
        };
    }

    /**
     * Maps a negotiated JSSE protocol name back to a version.
     *
     * @param protocol Protocol name.
     * @return TlsVersion or null if unknown.
     */
    public static TlsVersion fromProtocol(String protocol) {
        for (TlsVersion version : values()) {
            if (version.protocol.equals(protocol)) {
                return version;
            }
        }
        return null;
    }
}
