package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.SmtpResponses;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.TransactionState;

import java.io.IOException;

/**
 * DATA extension processor.
 *
 * <p>Sends DATA, streams the payload after the 354 go ahead and reads the single final reply.
 * <br>Every failure from the go ahead onwards is flagged as after payload start and never retried,
 * <br>the server may already have accepted the message.
 */
public class ClientData extends ClientProcessor {

    private final byte[] payload;
    private SmtpResponse response;

    /**
     * Constructs a new ClientData instance.
     *
     * @param payload Message bytes, not yet dot-stuffed.
     */
    public ClientData(byte[] payload) {
        this.payload = payload;
    }

    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().canSendData(), "DATA");

        SmtpResponse goAhead = exchange(SmtpCommands.data());
        if (goAhead.code() != SmtpResponses.START_MAIL_INPUT_354) {
            throw SmtpException.fromResponse(goAhead, SmtpErrorKind.TRANSACTION_FAILED);
        }
        transport.setState(TransactionState.SENDING_DATA);

        try {
            transport.sendPayload(payload);
            response = transport.readResponse();
        } catch (SmtpException e) {
            throw e.markAfterPayloadStarted();
        } catch (IOException e) {
            throw SmtpException.fromIOException(e, "DATA").markAfterPayloadStarted();
        }

        transport.setState(TransactionState.COMPLETE);
        if (!response.isSuccess()) {
            throw SmtpException.fromResponse(response, SmtpErrorKind.TRANSACTION_FAILED).markAfterPayloadStarted();
        }
        return true;
    }

    /**
     * Gets the final reply.
     *
     * @return SmtpResponse or null before processing.
     */
    public SmtpResponse getResponse() {
        return response;
    }
}
