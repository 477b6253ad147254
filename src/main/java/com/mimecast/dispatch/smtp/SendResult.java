package com.mimecast.dispatch.smtp;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a delivered message.
 *
 * @param messageId Message identifier, null for raw sends.
 * @param accepted  Recipients accepted by the server.
 * @param rejected  Recipients rejected by the server.
 * @param response  Final server reply.
 * @param serverId  Server queue identifier or null.
 * @param duration  Elapsed time including waits and retries.
 */
public record SendResult(String messageId,
                         List<String> accepted,
                         List<RejectedRecipient> rejected,
                         SmtpResponse response,
                         String serverId,
                         Duration duration) {

    public SendResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    /**
     * Every recipient was accepted.
     *
     * @return Boolean.
     */
    public boolean isCompleteSuccess() {
        return rejected.isEmpty();
    }

    /**
     * Some recipients were accepted and some rejected.
     *
     * @return Boolean.
     */
    public boolean isPartialSuccess() {
        return !accepted.isEmpty() && !rejected.isEmpty();
    }
}
