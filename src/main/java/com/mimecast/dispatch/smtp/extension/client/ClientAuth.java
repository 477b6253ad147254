package com.mimecast.dispatch.smtp.extension.client;

import com.mimecast.dispatch.smtp.auth.AuthMethod;
import com.mimecast.dispatch.smtp.auth.Authenticator;
import com.mimecast.dispatch.smtp.auth.CredentialProvider;
import com.mimecast.dispatch.smtp.auth.Credentials;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.metrics.ClientMetrics;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * AUTH extension processor.
 *
 * <p>Refreshes credentials if the provider asks for it, selects a mechanism and runs the exchange.
 * <br>A failed exchange is terminal for this attempt.
 */
public class ClientAuth extends ClientProcessor {
    private static final Logger log = LogManager.getLogger(ClientAuth.class);

    private final Authenticator authenticator;
    private final CredentialProvider credentialProvider;
    private final ClientMetrics metrics;
    private AuthMethod method;

    /**
     * Constructs a new ClientAuth instance.
     *
     * @param authenticator      Authenticator instance.
     * @param credentialProvider CredentialProvider instance.
     * @param metrics            ClientMetrics instance.
     */
    public ClientAuth(Authenticator authenticator, CredentialProvider credentialProvider, ClientMetrics metrics) {
        this.authenticator = authenticator;
        this.credentialProvider = credentialProvider;
        this.metrics = metrics;
    }

    @Override
    public boolean process(Transport transport) throws IOException {
        super.process(transport);
        requireState(transport.getState().canAuthenticate(), "AUTH");

        if (credentialProvider.needsRefresh()) {
            credentialProvider.refresh();
        }
        Credentials credentials = credentialProvider.getCredentials();
        if (credentials == null) {
            throw new SmtpException(SmtpErrorKind.CREDENTIALS_INVALID, "Credential provider returned no credentials");
        }

        method = authenticator.select(transport.getCapabilities(), credentials, transport.isEncrypted());
        try {
            authenticator.exchange(transport, authenticator.mechanism(method, credentials));
        } catch (SmtpException e) {
            metrics.recordAuthFailure(method);
            log.error("Authentication with {} failed: {}", method.getMechanism(), e.getMessage());
            throw e;
        }

        metrics.recordAuthSuccess(method);
        transport.setAuthenticatedUser(credentials.getUsername() != null ? credentials.getUsername() : "bearer");
        transport.setState(TransactionState.AUTHENTICATED);
        log.info("Authenticated {} using {}", transport.getAuthenticatedUser(), method.getMechanism());
        return true;
    }

    /**
     * Gets mechanism used.
     *
     * @return AuthMethod or null before processing.
     */
    public AuthMethod getMethod() {
        return method;
    }
}
