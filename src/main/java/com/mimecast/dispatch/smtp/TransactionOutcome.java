package com.mimecast.dispatch.smtp;

import java.util.List;

/**
 * Result of one completed mail transaction on a connection.
 *
 * @param accepted Recipients accepted by the server.
 * @param rejected Recipients rejected by the server.
 * @param response Final reply after the payload.
 * @param serverId Server side queue identifier or null.
 */
public record TransactionOutcome(List<String> accepted,
                                 List<RejectedRecipient> rejected,
                                 SmtpResponse response,
                                 String serverId) {

    public TransactionOutcome {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }
}
