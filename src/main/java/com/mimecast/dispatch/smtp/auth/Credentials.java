package com.mimecast.dispatch.smtp.auth;

import java.util.EnumSet;
import java.util.Set;

/**
 * Authentication credentials.
 *
 * <p>Secrets never appear in {@link Object#toString()}.
 */
public sealed interface Credentials {

    /**
     * Gets mechanisms these credentials can drive.
     *
     * @return Set of AuthMethod.
     */
    Set<AuthMethod> getSupportedMethods();

    /**
     * Gets user identity if any.
     *
     * @return Username or null.
     */
    String getUsername();

    /**
     * Username and password.
     *
     * @param username Username.
     * @param password Password.
     */
    record Plain(String username, String password) implements Credentials {

        @Override
        public Set<AuthMethod> getSupportedMethods() {
            return EnumSet.of(AuthMethod.PLAIN, AuthMethod.LOGIN, AuthMethod.CRAM_MD5);
        }

        @Override
        public String getUsername() {
            return username;
        }

        @Override
        public String toString() {
            return "Plain[username=" + username + ", password=[REDACTED]]";
        }
    }

    /**
     * OAuth2 access token with user for XOAUTH2.
     *
     * @param username Username.
     * @param token    Access token.
     */
    record XOAuth2(String username, String token) implements Credentials {

        @Override
        public Set<AuthMethod> getSupportedMethods() {
            return EnumSet.of(AuthMethod.XOAUTH2);
        }

        @Override
        public String getUsername() {
            return username;
        }

        @Override
        public String toString() {
            return "XOAuth2[username=" + username + ", token=[REDACTED]]";
        }
    }

    /**
     * Bearer token alone for OAUTHBEARER.
     *
     * @param token Access token.
     */
    record OAuthBearer(String token) implements Credentials {

        @Override
        public Set<AuthMethod> getSupportedMethods() {
            return EnumSet.of(AuthMethod.OAUTHBEARER);
        }

        @Override
        public String getUsername() {
            return null;
        }

        @Override
        public String toString() {
            return "OAuthBearer[token=[REDACTED]]";
        }
    }
}
