package com.mimecast.dispatch.config.client;

import com.mimecast.dispatch.smtp.auth.AuthMethod;
import com.mimecast.dispatch.smtp.auth.Credentials;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SmtpConfigTest {

    private static SmtpConfig config(Map<String, Object> overrides) {
        Map<String, Object> map = new HashMap<>();
        map.put("host", "smtp.example.com");
        map.putAll(overrides);
        return new SmtpConfig(map);
    }

    private static SmtpErrorKind invalid(Map<String, Object> overrides) {
        return assertThrows(SmtpException.class, () -> config(overrides).validate()).getKind();
    }

    @Test
    void testLoad() throws IOException {
        SmtpConfig config = SmtpConfig.load("src/test/resources/cfg/client.json5");

        assertEquals("smtp.example.com", config.getHost());
        assertEquals(2525, config.getPort());
        assertEquals("dispatch.example.com", config.getClientId());
        assertEquals(Duration.ofSeconds(10), config.getConnectTimeout());
        assertEquals(Duration.ofSeconds(20), config.getCommandTimeout());
        assertEquals(1048576L, config.getMaxMessageSize());
        assertEquals(new Credentials.Plain("tony@example.com", "giveHerTheRing"), config.getCredentials());

        TlsConfig tls = config.getTls();
        assertEquals(TlsMode.STARTTLS_REQUIRED, tls.getMode());
        assertEquals(TlsVersion.TLS_1_3, tls.getMinVersion());
        assertTrue(tls.isVerifyCertificates());
        assertEquals("mail.example.com", tls.getSniOverride());

        PoolConfig pool = config.getPool();
        assertEquals(4, pool.getMaxConnections());
        assertEquals(0, pool.getMinIdle());
        assertEquals(Duration.ofSeconds(5), pool.getAcquireTimeout());
        assertEquals(Duration.ofSeconds(120), pool.getIdleTimeout());
        assertEquals(Duration.ofSeconds(600), pool.getMaxLifetime());
        assertFalse(pool.isHealthCheckEnabled());

        RetryConfig retry = config.getRetry();
        assertEquals(4, retry.getMaxAttempts());
        assertEquals(Duration.ofMillis(250), retry.getInitialDelay());
        assertEquals(Duration.ofMillis(8000), retry.getMaxDelay());
        assertEquals(3.0, retry.getMultiplier());
        assertFalse(retry.isJitter());

        CircuitBreakerConfig breaker = config.getCircuitBreaker();
        assertEquals(2, breaker.getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), breaker.getFailureWindow());
        assertEquals(Duration.ofSeconds(15), breaker.getRecoveryTimeout());
        assertEquals(1, breaker.getSuccessThreshold());

        RateLimitConfig rateLimit = config.getRateLimit();
        assertTrue(rateLimit.isEnabled());
        assertEquals(100, rateLimit.getMaxEmails());
        assertNull(rateLimit.getMaxConnections());
        assertEquals(OnLimitBehavior.WAIT_WITH_TIMEOUT, rateLimit.getOnLimit());
        assertEquals(Duration.ofSeconds(10), rateLimit.getWaitTimeout());
    }

    @Test
    void testDefaults() throws SmtpException {
        SmtpConfig config = config(Map.of());
        config.validate();

        assertEquals(587, config.getPort());
        assertEquals("localhost", config.getClientId());
        assertEquals(10L * 1024 * 1024, config.getMaxMessageSize());
        assertNull(config.getCredentials());
        assertNull(config.getAuthMethod());
        assertEquals(TlsMode.STARTTLS, config.getTls().getMode());
        assertEquals(TlsVersion.TLS_1_2, config.getTls().getMinVersion());
        assertEquals(5, config.getPool().getMaxConnections());
        assertEquals(3, config.getRetry().getMaxAttempts());
        assertTrue(config.getRetry().isJitter());
        assertEquals(5, config.getCircuitBreaker().getFailureThreshold());
        assertFalse(config.getRateLimit().isEnabled());
    }

    @Test
    void testCredentialsDerivation() {
        assertEquals(new Credentials.XOAuth2("user", "tok"), config(Map.of("username", "user", "token", "tok")).getCredentials());
        assertEquals(new Credentials.OAuthBearer("tok"), config(Map.of("token", "tok")).getCredentials());
        assertNull(config(Map.of("username", "user")).getCredentials());
        assertFalse(config(Map.of("username", "user", "password", "secret")).toString().contains("secret"));
    }

    @Test
    void testAuthMethod() throws SmtpException {
        SmtpConfig config = config(Map.of("authMethod", "cram_md5"));
        config.validate();

        assertEquals(AuthMethod.CRAM_MD5, config.getAuthMethod());
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("authMethod", "GSSAPI")));
    }

    @Test
    void testValidation() {
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, assertThrows(SmtpException.class,
                () -> new SmtpConfig(Map.of()).validate()).getKind());
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("port", 0)));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("port", 70000)));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("port", "smtp")));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("pool", Map.of("maxConnections", 0))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("pool", Map.of("maxConnections", 2, "minIdle", 3))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("retry", Map.of("maxAttempts", 0))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("retry", Map.of("multiplier", 0.5))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("retry", Map.of("initialDelay", 5000, "maxDelay", 100))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("circuitBreaker", Map.of("failureThreshold", 0))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("circuitBreaker", Map.of("failureWindow", 0))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("rateLimit", Map.of("enabled", true))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("rateLimit", Map.of("enabled", true, "maxEmails", 0))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("rateLimit", Map.of("enabled", true, "maxEmails", 1, "onLimit", "queue"))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("tls", Map.of("mode", "sometimes"))));
        assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(Map.of("tls", Map.of("minVersion", "SSLv3"))));
    }

    @Test
    void testInsecureTlsNeedsOptIn() throws SmtpException {
        String previous = System.getProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY);
        Map<String, Object> insecure = Map.of("tls", Map.of("verifyCertificates", false));
        try {
            System.setProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY, "false");
            assertEquals(SmtpErrorKind.CONFIGURATION_INVALID, invalid(insecure));

            System.setProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY, "true");
            config(insecure).validate();

            // Plaintext mode does not verify anything.
            System.setProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY, "false");
            config(Map.of("tls", Map.of("mode", "none", "verifyCertificates", false))).validate();
        } finally {
            if (previous != null) {
                System.setProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY, previous);
            } else {
                System.clearProperty(SmtpConfig.INSECURE_ALLOWED_PROPERTY);
            }
        }
    }

    @Test
    void testEnumAliases() {
        assertEquals(TlsMode.STARTTLS, TlsMode.fromString("opportunistic"));
        assertEquals(TlsMode.STARTTLS_REQUIRED, TlsMode.fromString("starttls-required"));
        assertEquals(TlsMode.IMPLICIT, TlsMode.fromString("smtps"));
        assertTrue(TlsMode.IMPLICIT.isEncryptionRequired());
        assertFalse(TlsMode.STARTTLS.isEncryptionRequired());

        assertEquals(TlsVersion.TLS_1_2, TlsVersion.fromString("1.2"));
        assertEquals(TlsVersion.TLS_1_3, TlsVersion.fromString("TLS_1_3"));
        assertArrayEquals(new String[]{"TLSv1.2", "TLSv1.3"}, TlsVersion.TLS_1_2.getProtocolsFrom());
        assertTrue(TlsVersion.TLS_1_1.isDeprecated());

        assertEquals(OnLimitBehavior.WAIT_WITH_TIMEOUT, OnLimitBehavior.fromString("wait-with-timeout"));
        assertEquals(OnLimitBehavior.REJECT, OnLimitBehavior.fromString("reject"));
    }
}
