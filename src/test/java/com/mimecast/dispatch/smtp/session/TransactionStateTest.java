package com.mimecast.dispatch.smtp.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionStateTest {

    @Test
    void testMailPermitted() {
        assertTrue(TransactionState.GREETED.canStartMail());
        assertTrue(TransactionState.AUTHENTICATED.canStartMail());
        assertTrue(TransactionState.COMPLETE.canStartMail());

        assertFalse(TransactionState.CONNECTED.canStartMail());
        assertFalse(TransactionState.TLS_ESTABLISHED.canStartMail());
        assertFalse(TransactionState.IN_TRANSACTION.canStartMail());
        assertFalse(TransactionState.CLOSED.canStartMail());
    }

    @Test
    void testTransactionOrdering() {
        assertTrue(TransactionState.IN_TRANSACTION.canAddRecipient());
        assertTrue(TransactionState.RECIPIENTS_ADDED.canAddRecipient());
        assertFalse(TransactionState.IN_TRANSACTION.canSendData());
        assertTrue(TransactionState.RECIPIENTS_ADDED.canSendData());
        assertFalse(TransactionState.GREETED.canAddRecipient());
    }

    @Test
    void testGreetingAndTls() {
        assertTrue(TransactionState.CONNECTED.canGreet());
        assertTrue(TransactionState.TLS_ESTABLISHED.canGreet());
        assertTrue(TransactionState.GREETED.canStartTls());
        assertFalse(TransactionState.AUTHENTICATED.canStartTls());
        assertTrue(TransactionState.GREETED.canAuthenticate());
        assertFalse(TransactionState.TLS_ESTABLISHED.canAuthenticate());
    }

    @Test
    void testOpenAndInTransaction() {
        assertFalse(TransactionState.INITIAL.isOpen());
        assertFalse(TransactionState.CLOSED.isOpen());
        assertTrue(TransactionState.SENDING_DATA.isOpen());
        assertTrue(TransactionState.SENDING_DATA.isInTransaction());
        assertFalse(TransactionState.COMPLETE.isInTransaction());
    }
}
