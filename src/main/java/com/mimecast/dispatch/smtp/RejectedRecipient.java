package com.mimecast.dispatch.smtp;

/**
 * Recipient refused by the server during RCPT TO.
 *
 * @param address      Recipient address.
 * @param code         Reply code.
 * @param enhancedCode Enhanced status code or null.
 * @param message      Reply text.
 */
public record RejectedRecipient(String address, int code, String enhancedCode, String message) {

    /**
     * Builds from the RCPT reply.
     *
     * @param address  Recipient address.
     * @param response RCPT reply.
     * @return RejectedRecipient instance.
     */
    public static RejectedRecipient of(String address, SmtpResponse response) {
        return new RejectedRecipient(address, response.code(), response.enhancedCode(), response.getMessage());
    }

    /**
     * Could the recipient be accepted on a later attempt.
     *
     * @return Boolean.
     */
    public boolean isTemporary() {
        return code >= 400 && code < 500;
    }
}
