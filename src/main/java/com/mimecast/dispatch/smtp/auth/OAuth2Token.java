package com.mimecast.dispatch.smtp.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 access token with expiry.
 *
 * @param accessToken Access token.
 * @param expiresAt   Expiry or null if it does not expire.
 */
public record OAuth2Token(String accessToken, Instant expiresAt) {

    /**
     * Tokens this close to expiry are treated as expired.
     */
    public static final Duration EXPIRY_BUFFER = Duration.ofMinutes(5);

    /**
     * Is the token expired or about to expire.
     *
     * @param now Current instant.
     * @return Boolean.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.plus(EXPIRY_BUFFER).isBefore(expiresAt);
    }

    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    @Override
    public String toString() {
        return "OAuth2Token[accessToken=[REDACTED], expiresAt=" + expiresAt + "]";
    }
}
