package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;

import java.io.IOException;

/**
 * RSET extension processor.
 *
 * <p>Aborts the open transaction and returns to the latest stable state.
 */
public class ClientRset extends ClientProcessor {

    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().isOpen(), "RSET");

        SmtpResponse response = exchange(SmtpCommands.rset());
        if (!response.isSuccess()) {
            throw SmtpException.fromResponse(response);
        }
        transport.setState(stableState(transport));
        return true;
    }
}
