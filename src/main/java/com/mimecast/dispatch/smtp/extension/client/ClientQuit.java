package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * QUIT extension processor.
 *
 * <p>Best effort: failures are logged and the transport is closed regardless.
 */
public class ClientQuit extends ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientQuit.class);

    @Override
    public boolean process(Transport transport) {
        this.transport = transport;
        boolean sent = false;
        if (transport.isOpen() && transport.getState() != TransactionState.INITIAL) {
            try {
                sent = exchange(SmtpCommands.quit()).isSuccess();
            } catch (IOException e) {
                log.debug("QUIT failed: {}", e.getMessage());
            }
        }
        transport.close();
        transport.setState(TransactionState.CLOSED);
        return sent;
    }
}
