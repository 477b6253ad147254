package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpException;

/**
 * Turns a logical email into transfer bytes.
 */
public interface MessageEncoder {

    /**
     * Encodes an email.
     *
     * @param email     Email instance.
     * @param messageId Message identifier without angle brackets.
     * @return RFC 5322 message bytes, CRLF line endings, not dot-stuffed.
     * @throws SmtpException Encoding failed.
     */
    byte[] encode(Email email, String messageId) throws SmtpException;

    /**
     * Generates a unique message identifier.
     *
     * @return Identifier without angle brackets.
     */
    String generateMessageId();
}
