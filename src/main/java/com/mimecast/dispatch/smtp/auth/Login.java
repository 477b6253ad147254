package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * Login authentication mechanism.
 *
 * <p>No initial response; answers the first 334 prompt with the username and the second with the password.
 *
 * @see <a href="https://tools.ietf.org/html/draft-murchison-sasl-login-00">DRAFT SASL LOGIN</a>
 */
public class Login implements SaslMechanism {

    /**
     * Username.
     */
    private final String username;

    /**
     * Password.
     */
    private final String password;

    /**
     * Prompts answered.
     */
    private int step = 0;

    /**
     * Constructs a new Login instance.
     *
     * @param username Username.
     * @param password Password.
     */
    public Login(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public AuthMethod getMethod() {
        return AuthMethod.LOGIN;
    }

    @Override
    public String getInitialResponse() {
        return null;
    }

    @Override
    public String evaluateChallenge(String challenge) throws SmtpException {
        return switch (step++) {
            case 0 -> getUsername();
            case 1 -> getPassword();
            default -> throw new SmtpException(SmtpErrorKind.AUTHENTICATION_FAILED, "Unexpected LOGIN challenge");
        };
    }

    /**
     * Gets username.
     *
     * @return Base64 username string.
     */
    public String getUsername() {
        return Base64.encodeBase64String(username.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Gets password.
     *
     * @return Base64 password string.
     */
    public String getPassword() {
        return Base64.encodeBase64String(password.getBytes(StandardCharsets.UTF_8));
    }
}
