package com.mimecast.dispatch.smtp.auth;

/**
 * Credential provider returning fixed credentials.
 */
public class StaticCredentialProvider implements CredentialProvider {

    private final Credentials credentials;

    /**
     * Constructs a new StaticCredentialProvider instance.
     *
     * @param credentials Credentials instance.
     */
    public StaticCredentialProvider(Credentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public Credentials getCredentials() {
        return credentials;
    }

    @Override
    public String toString() {
        return "StaticCredentialProvider{" + credentials + "}";
    }
}
