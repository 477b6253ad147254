package com.mimecast.dispatch.smtp.auth;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * XOAUTH2 authentication mechanism.
 *
 * <p>Initial response is base64 of {@code user=U ^A auth=Bearer T ^A ^A}.
 * <br>On failure the server sends a 334 with a JSON error which is acknowledged with an empty line.
 *
 * @see <a href="https://developers.google.com/gmail/imap/xoauth2-protocol">XOAUTH2 protocol</a>
 */
public class XOAuth2 implements SaslMechanism {

    private final String username;
    private final String token;

    /**
     * Constructs a new XOAuth2 instance.
     *
     * @param username Username.
     * @param token    Access token.
     */
    public XOAuth2(String username, String token) {
        this.username = username;
        this.token = token;
    }

    @Override
    public AuthMethod getMethod() {
        return AuthMethod.XOAUTH2;
    }

    @Override
    public String getInitialResponse() {
        String message = "user=" + username + "\u0001auth=Bearer " + token + "\u0001\u0001";
        return Base64.encodeBase64String(message.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String evaluateChallenge(String challenge) {
        return "";
    }
}
