package com.mimecast.dispatch.smtp.connection;

import com.mimecast.dispatch.smtp.SmtpResponse;

import javax.net.ssl.SSLHandshakeException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.cert.CertificateException;
import java.util.Set;

/**
 * SMTP client exception.
 *
 * <p>Carries an error kind, the server reply code and enhanced status code when one caused it.
 * <br>Retry eligibility is derived from the kind and the reply code.
 * <br>Anything raised once the payload transfer started is never retryable.
 */
public class SmtpException extends IOException {

    /**
     * Reply codes that signal a transient condition.
     */
    private static final Set<Integer> RETRYABLE_CODES = Set.of(421, 450, 451, 452);

    private final SmtpErrorKind kind;
    private final int smtpCode;
    private final String enhancedCode;
    private volatile boolean afterPayloadStarted;

    /**
     * Constructs a new SmtpException instance.
     *
     * @param kind    Error kind.
     * @param message Message.
     */
    public SmtpException(SmtpErrorKind kind, String message) {
        this(kind, message, 0, null, null);
    }

    /**
     * Constructs a new SmtpException instance with cause.
     *
     * @param kind    Error kind.
     * @param message Message.
     * @param cause   Cause.
     */
    public SmtpException(SmtpErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, null, cause);
    }

    /**
     * Constructs a new SmtpException instance with reply details.
     *
     * @param kind         Error kind.
     * @param message      Message.
     * @param smtpCode     Reply code or 0.
     * @param enhancedCode Enhanced status code or null.
     * @param cause        Cause or null.
     */
    public SmtpException(SmtpErrorKind kind, String message, int smtpCode, String enhancedCode, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : SmtpErrorKind.UNKNOWN;
        this.smtpCode = smtpCode;
        this.enhancedCode = enhancedCode;
    }

    /**
     * Builds an exception from a server reply using the reply code to pick the kind.
     *
     * @param response SmtpResponse instance.
     * @return SmtpException instance.
     */
    public static SmtpException fromResponse(SmtpResponse response) {
        return fromResponse(response, null);
    }

    /**
     * Builds an exception from a server reply.
     * <p>The fallback kind is used for permanent failures with no specific mapping.
     *
     * @param response SmtpResponse instance.
     * @param fallback Fallback kind or null.
     * @return SmtpException instance.
     */
    public static SmtpException fromResponse(SmtpResponse response, SmtpErrorKind fallback) {
        SmtpErrorKind kind = switch (response.code()) {
            case 421 -> SmtpErrorKind.SERVER_SHUTDOWN;
            case 450, 451, 452 -> SmtpErrorKind.TEMPORARY_FAILURE;
            case 530 -> SmtpErrorKind.AUTHENTICATION_REQUIRED;
            case 534, 535 -> SmtpErrorKind.CREDENTIALS_INVALID;
            case 552 -> SmtpErrorKind.MESSAGE_TOO_LARGE;
            case 554 -> SmtpErrorKind.TRANSACTION_FAILED;
            default -> {
                if (response.isTemporaryFailure()) {
                    yield SmtpErrorKind.TEMPORARY_FAILURE;
                } else if (response.isPermanentFailure()) {
                    yield fallback != null ? fallback : SmtpErrorKind.PERMANENT_FAILURE;
                }
                yield SmtpErrorKind.UNEXPECTED_RESPONSE;
            }
        };
        return new SmtpException(kind, "Server replied " + response, response.code(), response.enhancedCode(), null);
    }

    /**
     * Classifies an I/O failure.
     * <p>SmtpException instances pass through unchanged.
     *
     * @param e       IOException instance.
     * @param context What was being done.
     * @return SmtpException instance.
     */
    public static SmtpException fromIOException(IOException e, String context) {
        if (e instanceof SmtpException smtpException) {
            return smtpException;
        }

        SmtpErrorKind kind;
        if (e instanceof SocketTimeoutException) {
            kind = "connect".equals(context) ? SmtpErrorKind.CONNECTION_TIMEOUT : SmtpErrorKind.READ_TIMEOUT;
        } else if (e instanceof UnknownHostException) {
            kind = SmtpErrorKind.DNS_RESOLUTION_FAILED;
        } else if (e instanceof ConnectException) {
            kind = SmtpErrorKind.CONNECTION_REFUSED;
        } else if (e instanceof SSLHandshakeException) {
            kind = hasCertificateCause(e) ? SmtpErrorKind.TLS_CERTIFICATE_INVALID : SmtpErrorKind.TLS_HANDSHAKE_FAILED;
        } else if (e instanceof EOFException) {
            kind = SmtpErrorKind.CONNECTION_CLOSED;
        } else if (e instanceof SocketException) {
            kind = SmtpErrorKind.CONNECTION_RESET;
        } else {
            kind = SmtpErrorKind.UNKNOWN;
        }

        return new SmtpException(kind, context + " failed: " + e.getMessage(), e);
    }

    private static boolean hasCertificateCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof CertificateException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Marks this failure as raised once payload transfer started.
     *
     * @return Self.
     */
    public SmtpException markAfterPayloadStarted() {
        this.afterPayloadStarted = true;
        return this;
    }

    public boolean isAfterPayloadStarted() {
        return afterPayloadStarted;
    }

    public SmtpErrorKind getKind() {
        return kind;
    }

    public SmtpErrorKind.Category getCategory() {
        return kind.getCategory();
    }

    public ErrorSeverity getSeverity() {
        return kind.getSeverity();
    }

    /**
     * Gets the server reply code.
     *
     * @return Code or 0 if none.
     */
    public int getSmtpCode() {
        return smtpCode;
    }

    public String getEnhancedCode() {
        return enhancedCode;
    }

    /**
     * Is this failure retryable by the orchestrator.
     *
     * @return Boolean.
     */
    public boolean isRetryable() {
        if (afterPayloadStarted || kind == SmtpErrorKind.ALL_RECIPIENTS_REJECTED || kind == SmtpErrorKind.GREETING_REJECTED) {
            return false;
        }
        if (kind.isRetryable()) {
            return true;
        }
        return RETRYABLE_CODES.contains(smtpCode)
                && kind.getCategory() != SmtpErrorKind.Category.AUTHENTICATION
                && kind.getCategory() != SmtpErrorKind.Category.TLS;
    }

    @Override
    public String toString() {
        return "SmtpException{kind=" + kind +
                (smtpCode > 0 ? ", code=" + smtpCode : "") +
                (enhancedCode != null ? ", enhanced=" + enhancedCode : "") +
                ", message=" + getMessage() + "}";
    }
}
