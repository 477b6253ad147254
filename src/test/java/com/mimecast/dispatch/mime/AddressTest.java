package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    void testParseBare() throws SmtpException {
        Address address = Address.parse(" tony@example.com ", SmtpErrorKind.INVALID_FROM_ADDRESS);

        assertEquals("tony@example.com", address.email());
        assertNull(address.name());
        assertEquals("<tony@example.com>", address.toHeader());
    }

    @Test
    void testParseWithName() throws SmtpException {
        Address address = Address.parse("Tony Stark <tony@example.com>", SmtpErrorKind.INVALID_FROM_ADDRESS);

        assertEquals("tony@example.com", address.email());
        assertEquals("Tony Stark", address.name());
        assertEquals("Tony Stark <tony@example.com>", address.toHeader());
        assertEquals("Tony Stark <tony@example.com>", address.toString());
    }

    @Test
    void testNonAsciiNameEncoded() {
        String header = new Address("jurgen@example.de", "Jürgen").toHeader();

        assertTrue(header.startsWith("=?UTF-8?"), header);
        assertTrue(header.endsWith("<jurgen@example.de>"), header);
    }

    @Test
    void testInvalidAddressUsesGivenKind() {
        SmtpException e = assertThrows(SmtpException.class,
                () -> Address.parse("not an address", SmtpErrorKind.INVALID_RECIPIENT_ADDRESS));
        assertEquals(SmtpErrorKind.INVALID_RECIPIENT_ADDRESS, e.getKind());

        e = assertThrows(SmtpException.class, () -> Address.parse("local-only", SmtpErrorKind.INVALID_FROM_ADDRESS));
        assertEquals(SmtpErrorKind.INVALID_FROM_ADDRESS, e.getKind());

        e = assertThrows(SmtpException.class, () -> Address.parse("  ", SmtpErrorKind.INVALID_FROM_ADDRESS));
        assertEquals(SmtpErrorKind.INVALID_FROM_ADDRESS, e.getKind());
    }
}
