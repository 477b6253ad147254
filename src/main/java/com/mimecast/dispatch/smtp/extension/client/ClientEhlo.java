package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.SmtpResponses;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.Capabilities;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * EHLO extension processor.
 *
 * <p>Sends EHLO and parses the advertised capabilities.
 * <br>Falls back to HELO with no capabilities if EHLO is rejected.
 * <br>If both are rejected the session cannot proceed and the failure is not retryable.
 */
public class ClientEhlo extends ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientEhlo.class);

    private final String clientId;
    private SmtpResponse response;

    /**
     * Constructs a new ClientEhlo instance.
     *
     * @param clientId Client identifier.
     */
    public ClientEhlo(String clientId) {
        this.clientId = clientId;
    }

    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().canGreet(), "EHLO");

        response = exchange(SmtpCommands.ehlo(clientId));
        if (response.isSuccess()) {
            transport.setCapabilities(Capabilities.fromEhlo(response));
            transport.setState(TransactionState.GREETED);
            log.debug("EHLO capabilities: {}", transport.getCapabilities());
            return true;
        }
        if (response.code() == SmtpResponses.SERVICE_UNAVAILABLE_421) {
            throw SmtpException.fromResponse(response);
        }

        log.warn("EHLO rejected with {}, falling back to HELO", response.code());
        response = exchange(SmtpCommands.helo(clientId));
        if (response.isSuccess()) {
            transport.setCapabilities(Capabilities.none());
            transport.setState(TransactionState.GREETED);
            return true;
        }
        if (response.code() == SmtpResponses.SERVICE_UNAVAILABLE_421) {
            throw SmtpException.fromResponse(response);
        }

        throw new SmtpException(SmtpErrorKind.GREETING_REJECTED,
                "EHLO and HELO rejected: " + response, response.code(), response.enhancedCode(), null);
    }

    /**
     * Gets the greeting reply.
     *
     * @return SmtpResponse or null before processing.
     */
    public SmtpResponse getResponse() {
        return response;
    }
}
