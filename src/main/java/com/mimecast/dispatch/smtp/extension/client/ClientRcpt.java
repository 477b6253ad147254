package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.RejectedRecipient;
import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.SmtpResponses;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * RCPT extension processor.
 *
 * <p>Declares every recipient independently; a rejection only affects that recipient.
 * <br>A 421 reply means the server is closing the channel and aborts the whole transaction.
 */
public class ClientRcpt extends ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientRcpt.class);

    private final List<String> recipients;
    private final List<String> accepted = new ArrayList<>();
    private final List<RejectedRecipient> rejected = new ArrayList<>();

    /**
     * Constructs a new ClientRcpt instance.
     *
     * @param recipients Recipient addresses.
     */
    public ClientRcpt(List<String> recipients) {
        this.recipients = recipients;
    }

    /**
     * RCPT processor.
     *
     * @param transport Transport instance.
     * @return True if at least one recipient was accepted.
     * @throws IOException Unable to communicate or server closing.
     */
    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);

        for (String recipient : recipients) {
            requireState(transport.getState().canAddRecipient(), "RCPT");

            SmtpResponse response = exchange(SmtpCommands.rcptTo(recipient));
            if (response.isSuccess()) {
                accepted.add(recipient);
                transport.setState(TransactionState.RECIPIENTS_ADDED);
            } else if (response.code() == SmtpResponses.SERVICE_UNAVAILABLE_421) {
                throw SmtpException.fromResponse(response);
            } else {
                log.info("Recipient {} rejected: {}", recipient, response);
                rejected.add(RejectedRecipient.of(recipient, response));
            }
        }

        return !accepted.isEmpty();
    }

    public List<String> getAccepted() {
        return accepted;
    }

    public List<RejectedRecipient> getRejected() {
        return rejected;
    }
}
