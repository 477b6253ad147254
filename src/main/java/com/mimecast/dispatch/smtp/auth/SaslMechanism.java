package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpException;

/**
 * Client side SASL mechanism.
 *
 * <p>Drives the AUTH exchange: an optional initial response, then one reply per 334 challenge.
 * <br>All values are base64 as they appear on the wire.
 *
 * @see <a href="https://tools.ietf.org/html/rfc4954">RFC 4954</a>
 */
public interface SaslMechanism {

    /**
     * Gets mechanism.
     *
     * @return AuthMethod instance.
     */
    AuthMethod getMethod();

    /**
     * Gets the initial response sent with the AUTH command.
     *
     * @return Base64 string or null when the mechanism waits for a challenge.
     */
    String getInitialResponse();

    /**
     * Computes the reply to a server challenge.
     *
     * @param challenge Base64 challenge text from the 334 reply, may be empty.
     * @return Base64 reply line, may be empty.
     * @throws SmtpException Unexpected challenge.
     */
    String evaluateChallenge(String challenge) throws SmtpException;
}
