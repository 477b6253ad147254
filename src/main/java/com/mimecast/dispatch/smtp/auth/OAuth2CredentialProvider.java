package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Credential provider backed by a refreshable OAuth2 token.
 *
 * <p>Yields XOAUTH2 credentials when a username is set, OAUTHBEARER otherwise.
 * <br>Token acquisition is delegated to the supplied callable.
 */
public class OAuth2CredentialProvider implements CredentialProvider {
    private static final Logger log = LogManager.getLogger(OAuth2CredentialProvider.class);

    private final String username;
    private final Callable<OAuth2Token> tokenSource;
    private final Clock clock;
    private volatile OAuth2Token token;

    /**
     * Constructs a new OAuth2CredentialProvider instance.
     *
     * @param username    Username or null for OAUTHBEARER.
     * @param tokenSource Token source.
     */
    public OAuth2CredentialProvider(String username, Callable<OAuth2Token> tokenSource) {
        this(username, tokenSource, Clock.systemUTC());
    }

    OAuth2CredentialProvider(String username, Callable<OAuth2Token> tokenSource, Clock clock) {
        this.username = username;
        this.tokenSource = tokenSource;
        this.clock = clock;
    }

    @Override
    public Credentials getCredentials() throws SmtpException {
        if (needsRefresh()) {
            refresh();
        }
        OAuth2Token current = token;
        return username != null
                ? new Credentials.XOAuth2(username, current.accessToken())
                : new Credentials.OAuthBearer(current.accessToken());
    }

    @Override
    public boolean needsRefresh() {
        OAuth2Token current = token;
        return current == null || current.isExpired(clock.instant());
    }

    @Override
    public synchronized void refresh() throws SmtpException {
        try {
            OAuth2Token fresh = tokenSource.call();
            if (fresh == null || fresh.accessToken() == null) {
                throw new SmtpException(SmtpErrorKind.CREDENTIALS_INVALID, "Token source returned no token");
            }
            token = fresh;
            log.debug("OAuth2 token refreshed, expires at {}", fresh.expiresAt());
        } catch (SmtpException e) {
            throw e;
        } catch (Exception e) {
            throw new SmtpException(SmtpErrorKind.CREDENTIALS_INVALID, "Unable to refresh OAuth2 token: " + e.getMessage(), e);
        }
    }
}
