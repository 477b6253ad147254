package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.resilience.MutableClock;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OAuth2CredentialProviderTest {

    @Test
    void testTokenCachedUntilNearExpiry() throws SmtpException {
        MutableClock clock = new MutableClock();
        AtomicInteger calls = new AtomicInteger();
        OAuth2CredentialProvider provider = new OAuth2CredentialProvider("tony@example.com",
                () -> new OAuth2Token("token-" + calls.incrementAndGet(), clock.instant().plus(Duration.ofHours(1))), clock);

        assertTrue(provider.needsRefresh());
        Credentials first = provider.getCredentials();
        assertEquals(new Credentials.XOAuth2("tony@example.com", "token-1"), first);

        clock.advance(Duration.ofMinutes(50));
        assertFalse(provider.needsRefresh());
        assertEquals(first, provider.getCredentials());

        // Inside the five minute buffer.
        clock.advance(Duration.ofMinutes(6));
        assertTrue(provider.needsRefresh());
        assertEquals(new Credentials.XOAuth2("tony@example.com", "token-2"), provider.getCredentials());
        assertEquals(2, calls.get());
    }

    @Test
    void testBearerWithoutUsername() throws SmtpException {
        OAuth2CredentialProvider provider = new OAuth2CredentialProvider(null, () -> new OAuth2Token("abc", null));

        assertEquals(new Credentials.OAuthBearer("abc"), provider.getCredentials());
        assertFalse(provider.needsRefresh());
    }

    @Test
    void testTokenSourceFailure() {
        OAuth2CredentialProvider provider = new OAuth2CredentialProvider("user", () -> {
            throw new IllegalStateException("token endpoint down");
        });

        SmtpException e = assertThrows(SmtpException.class, provider::getCredentials);
        assertEquals(SmtpErrorKind.CREDENTIALS_INVALID, e.getKind());
        assertTrue(e.getMessage().contains("token endpoint down"));
    }

    @Test
    void testTokenExpiry() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertFalse(new OAuth2Token("t", now.plus(Duration.ofMinutes(10))).isExpired(now));
        assertTrue(new OAuth2Token("t", now.plus(Duration.ofMinutes(5))).isExpired(now));
        assertFalse(new OAuth2Token("t", null).isExpired(now));
        assertFalse(new OAuth2Token("secret", null).toString().contains("secret"));
    }
}
