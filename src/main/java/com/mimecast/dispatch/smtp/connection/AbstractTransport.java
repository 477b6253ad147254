package com.mimecast.dispatch.smtp.connection;

import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.session.Capabilities;
import com.mimecast.dispatch.smtp.session.TransactionState;

/**
 * Transport base holding per connection session data.
 */
public abstract class AbstractTransport implements Transport {

    protected volatile TransactionState state = TransactionState.INITIAL;
    protected Capabilities capabilities;
    protected String authenticatedUser;
    protected SmtpResponse banner;
    protected boolean encrypted;

    @Override
    public boolean isEncrypted() {
        return encrypted;
    }

    @Override
    public Capabilities getCapabilities() {
        return capabilities;
    }

    @Override
    public void setCapabilities(Capabilities capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public TransactionState getState() {
        return state;
    }

    @Override
    public void setState(TransactionState state) {
        this.state = state;
    }

    @Override
    public String getAuthenticatedUser() {
        return authenticatedUser;
    }

    @Override
    public void setAuthenticatedUser(String user) {
        this.authenticatedUser = user;
    }

    @Override
    public SmtpResponse getBanner() {
        return banner;
    }

    @Override
    public void setBanner(SmtpResponse banner) {
        this.banner = banner;
    }

    /**
     * Marks the channel encrypted and drops everything negotiated in plaintext.
     */
    protected void encryptionEstablished() {
        this.encrypted = true;
        this.capabilities = null;
        this.authenticatedUser = null;
        this.state = TransactionState.TLS_ESTABLISHED;
    }
}
