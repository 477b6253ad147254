package com.mimecast.dispatch.smtp.connection;

/**
 * SMTP client error kinds.
 *
 * <p>Each kind belongs to a category and carries its default retry eligibility and severity.
 */
public enum SmtpErrorKind {

    // Configuration.
    CONFIGURATION_INVALID(Category.CONFIGURATION, false, ErrorSeverity.CRITICAL),

    // Connection.
    DNS_RESOLUTION_FAILED(Category.CONNECTION, true, ErrorSeverity.WARNING),
    CONNECTION_REFUSED(Category.CONNECTION, true, ErrorSeverity.WARNING),
    CONNECTION_TIMEOUT(Category.CONNECTION, true, ErrorSeverity.WARNING),
    CONNECTION_RESET(Category.CONNECTION, true, ErrorSeverity.WARNING),
    CONNECTION_CLOSED(Category.CONNECTION, true, ErrorSeverity.WARNING),

    // TLS.
    TLS_HANDSHAKE_FAILED(Category.TLS, false, ErrorSeverity.ERROR),
    TLS_CERTIFICATE_INVALID(Category.TLS, false, ErrorSeverity.CRITICAL),
    TLS_VERSION_MISMATCH(Category.TLS, false, ErrorSeverity.ERROR),
    STARTTLS_NOT_SUPPORTED(Category.TLS, false, ErrorSeverity.ERROR),

    // Authentication.
    AUTHENTICATION_REQUIRED(Category.AUTHENTICATION, false, ErrorSeverity.ERROR),
    CREDENTIALS_INVALID(Category.AUTHENTICATION, false, ErrorSeverity.ERROR),
    AUTH_METHOD_NOT_SUPPORTED(Category.AUTHENTICATION, false, ErrorSeverity.ERROR),
    AUTHENTICATION_FAILED(Category.AUTHENTICATION, false, ErrorSeverity.ERROR),

    // Protocol.
    INVALID_RESPONSE(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    UNEXPECTED_RESPONSE(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    INVALID_COMMAND(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    ILLEGAL_STATE(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    SERVER_SHUTDOWN(Category.PROTOCOL, true, ErrorSeverity.WARNING),
    CAPABILITY_MISMATCH(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    GREETING_REJECTED(Category.PROTOCOL, false, ErrorSeverity.ERROR),
    TEMPORARY_FAILURE(Category.PROTOCOL, true, ErrorSeverity.WARNING),
    PERMANENT_FAILURE(Category.PROTOCOL, false, ErrorSeverity.ERROR),

    // Message.
    MESSAGE_TOO_LARGE(Category.MESSAGE, false, ErrorSeverity.ERROR),
    INVALID_FROM_ADDRESS(Category.MESSAGE, false, ErrorSeverity.ERROR),
    INVALID_RECIPIENT_ADDRESS(Category.MESSAGE, false, ErrorSeverity.ERROR),
    INVALID_RECIPIENT(Category.MESSAGE, false, ErrorSeverity.ERROR),
    ALL_RECIPIENTS_REJECTED(Category.MESSAGE, false, ErrorSeverity.ERROR),
    TRANSACTION_FAILED(Category.MESSAGE, false, ErrorSeverity.ERROR),
    ENCODING_FAILED(Category.MESSAGE, false, ErrorSeverity.ERROR),

    // Timeouts.
    READ_TIMEOUT(Category.TIMEOUT, true, ErrorSeverity.WARNING),
    WRITE_TIMEOUT(Category.TIMEOUT, true, ErrorSeverity.WARNING),
    COMMAND_TIMEOUT(Category.TIMEOUT, true, ErrorSeverity.WARNING),

    // Admission control.
    LOCAL_RATE_LIMIT_EXCEEDED(Category.RATE_LIMIT, true, ErrorSeverity.WARNING),
    CIRCUIT_BREAKER_OPEN(Category.CIRCUIT_BREAKER, false, ErrorSeverity.WARNING),

    // Pool.
    POOL_EXHAUSTED(Category.POOL, true, ErrorSeverity.WARNING),
    ACQUIRE_TIMEOUT(Category.POOL, true, ErrorSeverity.WARNING),
    CONNECTION_UNHEALTHY(Category.POOL, true, ErrorSeverity.WARNING),
    POOL_CLOSED(Category.POOL, false, ErrorSeverity.ERROR),

    // Cancellation and anything else.
    CANCELLED(Category.UNKNOWN, false, ErrorSeverity.INFO),
    UNKNOWN(Category.UNKNOWN, false, ErrorSeverity.ERROR);

    /**
     * Error categories.
     */
    public enum Category {
        CONFIGURATION,
        CONNECTION,
        TLS,
        AUTHENTICATION,
        PROTOCOL,
        MESSAGE,
        TIMEOUT,
        RATE_LIMIT,
        CIRCUIT_BREAKER,
        POOL,
        UNKNOWN
    }

    private final Category category;
    private final boolean retryable;
    private final ErrorSeverity severity;

    SmtpErrorKind(Category category, boolean retryable, ErrorSeverity severity) {
        this.category = category;
        this.retryable = retryable;
        this.severity = severity;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }
}
