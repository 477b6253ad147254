package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.config.ConfigFoundation;
import com.mimecast.dispatch.smtp.auth.AuthMethod;
import com.mimecast.dispatch.smtp.auth.Credentials;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * SMTP client configuration container.
 *
 * <p>This class provides type safe access to the client configuration and its sub-configurations.
 * <p>Instances are immutable and validated once by {@link #validate()}.
 * <p>Example JSON5:
 * <pre>
 * {
 *   host: "smtp.example.com",
 *   port: 587,
 *   username: "user@example.com",
 *   password: "secret",
 *   tls: { mode: "starttls_required" },
 *   pool: { maxConnections: 10 },
 *   retry: { maxAttempts: 5 }
 * }
 * </pre>
 *
 * @see ConfigFoundation
 */
public class SmtpConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(SmtpConfig.class);

    /**
     * System property that permits disabling certificate verification.
     */
    public static final String INSECURE_ALLOWED_PROPERTY = "dispatch.tls.insecure.allowed";

    /**
     * Constructs a new SmtpConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public SmtpConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new SmtpConfig instance with configuration path.
     *
     * @param path Path to JSON5 configuration file.
     * @throws IOException Unable to read file.
     */
    public SmtpConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Loads and validates configuration from a JSON5 file.
     *
     * @param path Path to JSON5 configuration file.
     * @return SmtpConfig instance.
     * @throws IOException Unable to read file or invalid configuration.
     */
    public static SmtpConfig load(String path) throws IOException {
        SmtpConfig config = new SmtpConfig(path);
        config.validate();
        log.info("Loaded SMTP configuration from {} for {}:{}", path, config.getHost(), config.getPort());
        return config;
    }

    public String getHost() {
        return getStringProperty("host");
    }

    /**
     * Gets port.
     *
     * @return Port, 587 by default.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 587L));
    }

    /**
     * Gets client identifier used in EHLO/HELO.
     *
     * @return Identifier, localhost by default.
     */
    public String getClientId() {
        return getStringProperty("clientId", "localhost");
    }

    public Duration getConnectTimeout() {
        return Duration.ofSeconds(getLongProperty("connectTimeout", 30L));
    }

    public Duration getCommandTimeout() {
        return Duration.ofSeconds(getLongProperty("commandTimeout", 60L));
    }

    /**
     * Gets local message size ceiling in bytes.
     *
     * @return Size, 10MB by default.
     */
    public long getMaxMessageSize() {
        return getLongProperty("maxMessageSize", 10L * 1024 * 1024);
    }

    /**
     * Gets pinned authentication mechanism.
     *
     * @return AuthMethod or null to negotiate.
     */
    public AuthMethod getAuthMethod() {
        return AuthMethod.fromMechanism(getStringProperty("authMethod"));
    }

    /**
     * Gets credentials derived from username, password and token.
     * <ul>
     *     <li>username and token: XOAUTH2</li>
     *     <li>token alone: OAUTHBEARER</li>
     *     <li>username and password: PLAIN, LOGIN or CRAM-MD5</li>
     * </ul>
     *
     * @return Credentials or null if none configured.
     */
    public Credentials getCredentials() {
        String username = getStringProperty("username");
        String password = getStringProperty("password");
        String token = getStringProperty("token");

        if (StringUtils.isNotEmpty(token)) {
            return StringUtils.isNotEmpty(username) ? new Credentials.XOAuth2(username, token) : new Credentials.OAuthBearer(token);
        }
        if (StringUtils.isNotEmpty(username) && password != null) {
            return new Credentials.Plain(username, password);
        }
        return null;
    }

    public TlsConfig getTls() {
        return new TlsConfig(getMapProperty("tls"));
    }

    public PoolConfig getPool() {
        return new PoolConfig(getMapProperty("pool"));
    }

    public RetryConfig getRetry() {
        return new RetryConfig(getMapProperty("retry"));
    }

    public CircuitBreakerConfig getCircuitBreaker() {
        return new CircuitBreakerConfig(getMapProperty("circuitBreaker"));
    }

    public RateLimitConfig getRateLimit() {
        return new RateLimitConfig(getMapProperty("rateLimit"));
    }

    /**
     * Validates configuration.
     *
     * @throws SmtpException Configuration invalid.
     */
    public void validate() throws SmtpException {
        try {
            if (StringUtils.isBlank(getHost())) {
                throw invalid("host is required");
            }
            if (getPort() < 1 || getPort() > 65535) {
                throw invalid("port must be between 1 and 65535");
            }
            if (getMaxMessageSize() < 1) {
                throw invalid("maxMessageSize must be positive");
            }
            if (hasProperty("authMethod") && getAuthMethod() == null) {
                throw invalid("authMethod not supported: " + getStringProperty("authMethod"));
            }

            validateTls(getTls());

            PoolConfig pool = getPool();
            if (pool.getMaxConnections() < 1) {
                throw invalid("pool.maxConnections must be greater than 0");
            }
            if (pool.getMinIdle() < 0 || pool.getMinIdle() > pool.getMaxConnections()) {
                throw invalid("pool.minIdle must be between 0 and pool.maxConnections");
            }

            RetryConfig retry = getRetry();
            if (retry.getMaxAttempts() < 1) {
                throw invalid("retry.maxAttempts must be at least 1");
            }
            if (retry.getMultiplier() < 1.0) {
                throw invalid("retry.multiplier must be at least 1.0");
            }
            if (retry.getMaxDelay().compareTo(retry.getInitialDelay()) < 0) {
                throw invalid("retry.maxDelay must not be less than retry.initialDelay");
            }

            CircuitBreakerConfig breaker = getCircuitBreaker();
            if (breaker.getFailureThreshold() < 1 || breaker.getSuccessThreshold() < 1) {
                throw invalid("circuitBreaker thresholds must be at least 1");
            }
            if (breaker.getFailureWindow().getSeconds() < 1 || breaker.getRecoveryTimeout().getSeconds() < 1) {
                throw invalid("circuitBreaker failureWindow and recoveryTimeout must be at least 1 second");
            }

            RateLimitConfig rateLimit = getRateLimit();
            if (rateLimit.isEnabled()) {
                if (rateLimit.getMaxEmails() == null && rateLimit.getMaxConnections() == null) {
                    throw invalid("rateLimit enabled without maxEmails or maxConnections");
                }
                if ((rateLimit.getMaxEmails() != null && rateLimit.getMaxEmails() < 1)
                        || (rateLimit.getMaxConnections() != null && rateLimit.getMaxConnections() < 1)) {
                    throw invalid("rateLimit limits must be at least 1");
                }
                rateLimit.getOnLimit();
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw invalid(e.getMessage());
        }
    }

    private void validateTls(TlsConfig tls) throws SmtpException {
        TlsMode mode = tls.getMode();
        TlsVersion minVersion = tls.getMinVersion();

        if (mode != TlsMode.NONE && !tls.isVerifyCertificates() && !Boolean.getBoolean(INSECURE_ALLOWED_PROPERTY)) {
            throw invalid("tls.verifyCertificates=false is only permitted when " + INSECURE_ALLOWED_PROPERTY + "=true");
        }
        if (mode != TlsMode.NONE && minVersion.isDeprecated()) {
            log.warn("TLS minimum version {} is deprecated and insecure", minVersion.getProtocol());
        }
    }

    private static SmtpException invalid(String message) {
        return new SmtpException(SmtpErrorKind.CONFIGURATION_INVALID, "Invalid configuration: " + message);
    }

    @Override
    public String toString() {
        return "SmtpConfig{host=" + getHost() + ", port=" + getPort() + ", tls=" + getTls().getMode() +
                ", credentials=" + getCredentials() + "}";
    }
}
