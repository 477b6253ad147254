package com.mimecast.dispatch.smtp.session;

/**
 * Per connection SMTP dialogue state.
 *
 * <p>The state is authoritative for which commands may be issued next.
 */
public enum TransactionState {
    INITIAL,
    CONNECTED,
    GREETED,
    TLS_ESTABLISHED,
    AUTHENTICATED,
    IN_TRANSACTION,
    RECIPIENTS_ADDED,
    SENDING_DATA,
    COMPLETE,
    CLOSED;

    /**
     * EHLO/HELO may be sent.
     *
     * @return Boolean.
     */
    public boolean canGreet() {
        return this == CONNECTED || this == GREETED || this == TLS_ESTABLISHED;
    }

    public boolean canStartTls() {
        return this == GREETED;
    }

    public boolean canAuthenticate() {
        return this == GREETED;
    }

    /**
     * MAIL FROM may be sent.
     * <p>A completed transaction leaves the connection ready for the next one.
     *
     * @return Boolean.
     */
    public boolean canStartMail() {
        return this == GREETED || this == AUTHENTICATED || this == COMPLETE;
    }

    public boolean canAddRecipient() {
        return this == IN_TRANSACTION || this == RECIPIENTS_ADDED;
    }

    public boolean canSendData() {
        return this == RECIPIENTS_ADDED;
    }

    /**
     * A mail transaction is open on the server.
     *
     * @return Boolean.
     */
    public boolean isInTransaction() {
        return this == IN_TRANSACTION || this == RECIPIENTS_ADDED || this == SENDING_DATA;
    }

    /**
     * The connection has completed setup and no transaction is open.
     *
     * @return Boolean.
     */
    public boolean isReady() {
        return canStartMail();
    }

    /**
     * Commands legal outside a transaction on an open session, RSET, NOOP, VRFY and QUIT.
     *
     * @return Boolean.
     */
    public boolean isOpen() {
        return this != INITIAL && this != CLOSED;
    }
}
