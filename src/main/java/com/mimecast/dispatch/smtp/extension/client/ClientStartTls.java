package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.config.client.TlsConfig;
import com.mimecast.dispatch.config.client.TlsMode;
import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.SmtpResponses;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * STARTTLS extension processor with policy enforcement.
 * <p>With STARTTLS_REQUIRED the connection fails if the server does not advertise or refuses STARTTLS.
 * <br>With STARTTLS the upgrade is opportunistic and a refusal leaves the session in plaintext.
 * <p>After a successful upgrade the caller must greet again; plaintext capabilities are already discarded.
 *
 * @see <a href="https://tools.ietf.org/html/rfc3207">RFC 3207</a>
 */
public class ClientStartTls extends ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientStartTls.class);

    private final TlsConfig tlsConfig;
    private final String host;

    /**
     * Constructs a new ClientStartTls instance.
     *
     * @param tlsConfig TlsConfig instance.
     * @param host      Server host.
     */
    public ClientStartTls(TlsConfig tlsConfig, String host) {
        this.tlsConfig = tlsConfig;
        this.host = host;
    }

    /**
     * STARTTLS processor.
     *
     * @param transport Transport instance.
     * @return True if the channel was upgraded.
     * @throws IOException Policy violation or handshake failure.
     */
    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);

        TlsMode mode = tlsConfig.getMode();
        if (mode == TlsMode.NONE || mode == TlsMode.IMPLICIT || transport.isEncrypted()) {
            return false;
        }
        requireState(transport.getState().canStartTls(), "STARTTLS");

        boolean required = mode == TlsMode.STARTTLS_REQUIRED;
        boolean advertised = transport.getCapabilities() != null && transport.getCapabilities().isStartTls();
        if (!advertised) {
            if (required) {
                String error = "TLS required but server " + host + " does not advertise STARTTLS";
                log.error(error);
                throw new SmtpException(SmtpErrorKind.STARTTLS_NOT_SUPPORTED, error);
            }
            log.debug("STARTTLS not advertised by {}, continuing in plaintext", host);
            return false;
        }

        SmtpResponse response = exchange(SmtpCommands.startTls());
        if (response.code() != SmtpResponses.SERVICE_READY_220) {
            if (required || response.code() == SmtpResponses.SERVICE_UNAVAILABLE_421) {
                log.error("STARTTLS refused by {}: {}", host, response);
                throw new SmtpException(required ? SmtpErrorKind.STARTTLS_NOT_SUPPORTED : SmtpErrorKind.SERVER_SHUTDOWN,
                        "STARTTLS refused: " + response, response.code(), response.enhancedCode(), null);
            }
            log.warn("STARTTLS refused by {} with {}, continuing in plaintext", host, response.code());
            return false;
        }

        transport.upgradeEncryption(tlsConfig, host);
        return true;
    }
}
