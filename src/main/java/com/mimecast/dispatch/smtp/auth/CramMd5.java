package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.charset.StandardCharsets;

/**
 * CRAM-MD5 authentication mechanism.
 *
 * <p>Replies to the server challenge with base64 of {@code username SP hex(HMAC-MD5(password, challenge))}.
 *
 * @see <a href="https://tools.ietf.org/html/rfc2195">RFC 2195</a>
 */
public class CramMd5 implements SaslMechanism {

    private final String username;
    private final String password;
    private boolean answered = false;

    /**
     * Constructs a new CramMd5 instance.
     *
     * @param username Username.
     * @param password Password.
     */
    public CramMd5(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public AuthMethod getMethod() {
        return AuthMethod.CRAM_MD5;
    }

    @Override
    public String getInitialResponse() {
        return null;
    }

    @Override
    public String evaluateChallenge(String challenge) throws SmtpException {
        if (answered) {
            throw new SmtpException(SmtpErrorKind.AUTHENTICATION_FAILED, "Unexpected CRAM-MD5 challenge");
        }
        if (challenge == null || challenge.isBlank() || !Base64.isBase64(challenge.trim())) {
            throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Malformed CRAM-MD5 challenge");
        }
        answered = true;
        return getResponse(Base64.decodeBase64(challenge.trim()));
    }

    /**
     * Computes the response for a decoded challenge.
     *
     * @param challenge Decoded challenge bytes.
     * @return Base64 response.
     */
    public String getResponse(byte[] challenge) {
        String digest = new HmacUtils(HmacAlgorithms.HMAC_MD5, password.getBytes(StandardCharsets.UTF_8)).hmacHex(challenge);
        return Base64.encodeBase64String((username + " " + digest).getBytes(StandardCharsets.UTF_8));
    }
}
