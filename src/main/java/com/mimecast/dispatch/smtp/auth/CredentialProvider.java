package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpException;

/**
 * Supplies credentials at authentication time.
 */
public interface CredentialProvider {

    /**
     * Gets current credentials.
     *
     * @return Credentials instance.
     * @throws SmtpException Unable to obtain credentials.
     */
    Credentials getCredentials() throws SmtpException;

    /**
     * Should {@link #refresh()} be called before the next authentication.
     *
     * @return Boolean.
     */
    default boolean needsRefresh() {
        return false;
    }

    /**
     * Refreshes credentials.
     *
     * @throws SmtpException Unable to refresh.
     */
    default void refresh() throws SmtpException {
    }
}
