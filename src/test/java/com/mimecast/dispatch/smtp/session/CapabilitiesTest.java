package com.mimecast.dispatch.smtp.session;

import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.auth.AuthMethod;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilitiesTest {

    @Test
    void testFromEhlo() throws SmtpException {
        Capabilities capabilities = Capabilities.fromEhlo(SmtpResponse.parse(List.of(
                "250-mx.example.com greets client.example.com",
                "250-PIPELINING",
                "250-SIZE 35882577",
                "250-STARTTLS",
                "250-AUTH PLAIN LOGIN CRAM-MD5",
                "250-8BITMIME",
                "250-ENHANCEDSTATUSCODES",
                "250-CHUNKING",
                "250-DSN",
                "250 SMTPUTF8")));

        assertTrue(capabilities.isPipelining());
        assertEquals(35882577L, capabilities.getMaxSize());
        assertTrue(capabilities.isSizeAdvertised());
        assertTrue(capabilities.isStartTls());
        assertEquals(Set.of("PLAIN", "LOGIN", "CRAM-MD5"), capabilities.getAuthMechanisms());
        assertTrue(capabilities.supportsAuth(AuthMethod.CRAM_MD5));
        assertFalse(capabilities.supportsAuth(AuthMethod.XOAUTH2));
        assertTrue(capabilities.isEightBitMime());
        assertTrue(capabilities.isEnhancedStatusCodes());
        assertTrue(capabilities.isChunking());
        assertTrue(capabilities.isDsn());
        assertTrue(capabilities.isSmtpUtf8());
        assertEquals(9, capabilities.getRaw().size());
    }

    @Test
    void testLegacyAuthSyntaxAndLowercase() throws SmtpException {
        Capabilities capabilities = Capabilities.fromEhlo(SmtpResponse.parse(List.of(
                "250-mx.example.com",
                "250-auth=login plain",
                "250 size")));

        assertEquals(Set.of("LOGIN", "PLAIN"), capabilities.getAuthMechanisms());
        assertTrue(capabilities.isSizeAdvertised());
        assertEquals(0, capabilities.getMaxSize());
    }

    @Test
    void testMalformedSizeIgnored() throws SmtpException {
        Capabilities capabilities = Capabilities.fromEhlo(SmtpResponse.parse(List.of(
                "250-mx.example.com",
                "250 SIZE lots")));

        assertEquals(0, capabilities.getMaxSize());
    }

    @Test
    void testGreetingOnly() throws SmtpException {
        Capabilities capabilities = Capabilities.fromEhlo(SmtpResponse.parse(List.of("250 mx.example.com")));

        assertTrue(capabilities.getAuthMechanisms().isEmpty());
        assertFalse(capabilities.isStartTls());
        assertFalse(capabilities.isSizeAdvertised());
        assertTrue(capabilities.getRaw().isEmpty());
    }

    @Test
    void testNone() {
        Capabilities none = Capabilities.none();

        assertTrue(none.getAuthMechanisms().isEmpty());
        assertFalse(none.isEightBitMime());
        assertThrows(UnsupportedOperationException.class, () -> none.getAuthMechanisms().add("PLAIN"));
    }
}
