package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Client extension processor base.
 *
 * <p>Each processor drives one SMTP verb over a transport.
 * <br>Commands illegal in the current transaction state are refused before touching the wire.
 */
public abstract class ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientProcessor.class);

    /**
     * Transport instance.
     */
    protected Transport transport;

    /**
     * Processor.
     *
     * @param transport Transport instance.
     * @return Boolean.
     * @throws IOException Unable to communicate.
     */
    public boolean process(Transport transport) throws IOException {
        this.transport = transport;
        return true;
    }

    /**
     * Sends a command and logs the exchange.
     *
     * @param command Command string.
     * @return SmtpResponse instance.
     * @throws IOException Unable to communicate.
     */
    protected SmtpResponse exchange(String command) throws IOException {
        SmtpResponse response = transport.sendCommand(command);
        log.debug("{} -> {}", SmtpCommands.loggable(command), response.code());
        return response;
    }

    /**
     * Refuses a command not legal in the current state.
     *
     * @param legal   Is the command legal.
     * @param command Command name for the error.
     * @throws SmtpException Illegal state.
     */
    protected void requireState(boolean legal, String command) throws SmtpException {
        if (!legal) {
            throw new SmtpException(SmtpErrorKind.ILLEGAL_STATE,
                    command + " not permitted in state " + transport.getState());
        }
    }

    /**
     * Gets the latest stable pre-transaction state.
     *
     * @param transport Transport instance.
     * @return AUTHENTICATED if authenticated on this connection, GREETED otherwise.
     */
    public static TransactionState stableState(Transport transport) {
        return transport.getAuthenticatedUser() != null ? TransactionState.AUTHENTICATED : TransactionState.GREETED;
    }
}
