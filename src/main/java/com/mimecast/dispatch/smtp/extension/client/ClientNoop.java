package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.connection.Transport;

import java.io.IOException;

/**
 * NOOP extension processor used as connection health probe.
 */
public class ClientNoop extends ClientProcessor {

    /**
     * NOOP processor.
     *
     * @param transport Transport instance.
     * @return True if the server replied 2xx.
     * @throws IOException Unable to communicate.
     */
    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().isOpen() && !transport.getState().isInTransaction(), "NOOP");
        return exchange(SmtpCommands.noop()).isSuccess();
    }
}
