package com.mimecast.dispatch.smtp.auth;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * OAUTHBEARER authentication mechanism.
 *
 * <p>Initial response is base64 of the GS2 header {@code n,,} followed by the
 * host, port and bearer token key/value pairs each terminated by ^A, and a final ^A.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7628">RFC 7628</a>
 */
public class OAuthBearer implements SaslMechanism {

    private final String token;
    private final String host;
    private final int port;

    /**
     * Constructs a new OAuthBearer instance.
     *
     * @param token Access token.
     * @param host  Server host.
     * @param port  Server port.
     */
    public OAuthBearer(String token, String host, int port) {
        this.token = token;
        this.host = host;
        this.port = port;
    }

    @Override
    public AuthMethod getMethod() {
        return AuthMethod.OAUTHBEARER;
    }

    @Override
    public String getInitialResponse() {
        String message = "n,," + "\u0001host=" + host + "\u0001port=" + port + "\u0001auth=Bearer " + token + "\u0001\u0001";
        return Base64.encodeBase64String(message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Failure challenges carry a JSON status; RFC 7628 requires a single ^A in reply.
     *
     * @param challenge Challenge.
     * @return Base64 of ^A.
     */
    @Override
    public String evaluateChallenge(String challenge) {
        return Base64.encodeBase64String(new byte[]{1});
    }
}
