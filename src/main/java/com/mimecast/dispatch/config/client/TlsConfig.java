package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;

import java.util.Map;

/**
 * TLS configuration.
 *
 * <p>This class provides type safe access to transport encryption settings.
 */
public class TlsConfig extends ConfigFoundation {

    /**
     * Constructs a new TlsConfig instance with defaults.
     */
    public TlsConfig() {
        super(Map.of());
    }

    /**
     * Constructs a new TlsConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public TlsConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets encryption policy.
     *
     * @return TlsMode, STARTTLS by default.
     */
    public TlsMode getMode() {
        return TlsMode.fromString(getStringProperty("mode", "starttls"));
    }

    /**
     * Gets minimum accepted TLS version.
     *
     * @return TlsVersion, TLSv1.2 by default.
     */
    public TlsVersion getMinVersion() {
        return TlsVersion.fromString(getStringProperty("minVersion", "TLSv1.2"));
    }

    /**
     * Is server certificate verification enabled.
     * <p>Disabling it is refused unless the JVM runs with dispatch.tls.insecure.allowed=true.
     *
     * @return Boolean.
     */
    public boolean isVerifyCertificates() {
        return getBooleanProperty("verifyCertificates", true);
    }

    /**
     * Is hostname verification enabled.
     *
     * @return Boolean.
     */
    public boolean isVerifyHostname() {
        return getBooleanProperty("verifyHostname", true);
    }

    /**
     * Gets path to a PEM CA bundle to trust instead of the JVM default.
     *
     * @return Path string or null.
     */
    public String getCaCertPath() {
        return getStringProperty("caCertPath");
    }

    /**
     * Gets SNI host name override.
     *
     * @return Host name or null to use the configured host.
     */
    public String getSniOverride() {
        return getStringProperty("sniOverride");
    }

    /**
     * Are plaintext secret mechanisms (PLAIN, LOGIN) allowed without encryption.
     * <p>Only honoured when the mode is NONE.
     *
     * @return Boolean.
     */
    public boolean isAllowPlaintextAuth() {
        return getBooleanProperty("allowPlaintextAuth", false);
    }
}
