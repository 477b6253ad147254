package com.mimecast.dispatch.smtp.auth;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * Plain authentication mechanism.
 *
 * <p>Initial response is base64 of {@code authzid NUL authcid NUL passwd}, authzid left empty.
 *
 * @see <a href="https://tools.ietf.org/html/rfc4616">RFC 4616</a>
 */
public class Plain implements SaslMechanism {

    /**
     * Authorization identity.
     */
    private final String authzid;

    /**
     * Username.
     */
    private final String username;

    /**
     * Password.
     */
    private final String password;

    /**
     * Constructs a new Plain instance.
     *
     * @param username Username.
     * @param password Password.
     */
    public Plain(String username, String password) {
        this("", username, password);
    }

    /**
     * Constructs a new Plain instance with authorization identity.
     *
     * @param authzid  Authorization identity, empty to act as username.
     * @param username Username.
     * @param password Password.
     */
    public Plain(String authzid, String username, String password) {
        this.authzid = authzid != null ? authzid : "";
        this.username = username;
        this.password = password;
    }

    @Override
    public AuthMethod getMethod() {
        return AuthMethod.PLAIN;
    }

    @Override
    public String getInitialResponse() {
        String message = authzid + "\0" + username + "\0" + password;
        return Base64.encodeBase64String(message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Servers not accepting an initial response send an empty challenge first.
     *
     * @param challenge Challenge.
     * @return Base64 string.
     */
    @Override
    public String evaluateChallenge(String challenge) {
        return getInitialResponse();
    }
}
