package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.Capabilities;
import com.mimecast.dispatch.smtp.session.TransactionState;

import java.io.IOException;

/**
 * MAIL extension processor.
 *
 * <p>Attaches SIZE, BODY=8BITMIME and SMTPUTF8 parameters only when the server advertises them.
 */
public class ClientMail extends ClientProcessor {

    private final String from;
    private final long size;
    private final boolean eightBit;
    private final boolean smtpUtf8;

    /**
     * Constructs a new ClientMail instance.
     *
     * @param from     Sender address.
     * @param size     Payload size in bytes.
     * @param eightBit Payload has 8-bit content.
     * @param smtpUtf8 Envelope has non-ASCII addresses.
     */
    public ClientMail(String from, long size, boolean eightBit, boolean smtpUtf8) {
        this.from = from;
        this.size = size;
        this.eightBit = eightBit;
        this.smtpUtf8 = smtpUtf8;
    }

    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().canStartMail(), "MAIL");

        Capabilities capabilities = transport.getCapabilities() != null ? transport.getCapabilities() : Capabilities.none();
        String command = SmtpCommands.mailFrom(from,
                capabilities.isSizeAdvertised() ? size : -1,
                eightBit && capabilities.isEightBitMime(),
                smtpUtf8 && capabilities.isSmtpUtf8());

        SmtpResponse response = exchange(command);
        if (!response.isSuccess()) {
            SmtpErrorKind fallback = response.code() == 553 || response.code() == 550 || response.code() == 501
                    ? SmtpErrorKind.INVALID_FROM_ADDRESS
                    : SmtpErrorKind.TRANSACTION_FAILED;
            throw SmtpException.fromResponse(response, fallback);
        }

        transport.setState(TransactionState.IN_TRANSACTION);
        return true;
    }
}
