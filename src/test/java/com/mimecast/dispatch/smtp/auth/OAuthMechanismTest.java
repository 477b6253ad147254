package com.mimecast.dispatch.smtp.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OAuthMechanismTest {

    @Test
    void xoauth2InitialResponse() {
        XOAuth2 xoauth2 = new XOAuth2("someuser@example.com", "ya29.token");

        assertEquals("dXNlcj1zb21ldXNlckBleGFtcGxlLmNvbQFhdXRoPUJlYXJlciB5YTI5LnRva2VuAQE=", xoauth2.getInitialResponse());
        assertEquals("", xoauth2.evaluateChallenge("eyJzdGF0dXMiOiI0MDEifQ=="));
        assertEquals(AuthMethod.XOAUTH2, xoauth2.getMethod());
    }

    @Test
    void oauthBearerInitialResponse() {
        OAuthBearer bearer = new OAuthBearer("tok", "mx.example.com", 587);

        assertEquals("biwsAWhvc3Q9bXguZXhhbXBsZS5jb20BcG9ydD01ODcBYXV0aD1CZWFyZXIgdG9rAQE=", bearer.getInitialResponse());
        assertEquals("AQ==", bearer.evaluateChallenge("eyJzdGF0dXMiOiI0MDEifQ=="));
        assertEquals(AuthMethod.OAUTHBEARER, bearer.getMethod());
    }

    @Test
    void credentialsRedactSecrets() {
        assertFalse(new Credentials.Plain("user", "hunter2").toString().contains("hunter2"));
        assertFalse(new Credentials.XOAuth2("user", "ya29.secret").toString().contains("ya29"));
        assertFalse(new Credentials.OAuthBearer("ya29.secret").toString().contains("ya29"));
    }
}
