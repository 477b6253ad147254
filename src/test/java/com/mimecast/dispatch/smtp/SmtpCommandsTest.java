package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmtpCommandsTest {

    @Test
    void testMailFrom() throws SmtpException {
        assertEquals("MAIL FROM:<tony@example.com>", SmtpCommands.mailFrom("tony@example.com", -1, false, false));
        assertEquals("MAIL FROM:<tony@example.com> SIZE=1024 BODY=8BITMIME SMTPUTF8",
                SmtpCommands.mailFrom("tony@example.com", 1024, true, true));
        assertEquals("MAIL FROM:<>", SmtpCommands.mailFrom("", -1, false, false));
    }

    @Test
    void testSimpleCommands() throws SmtpException {
        assertEquals("EHLO client.example.com", SmtpCommands.ehlo("client.example.com"));
        assertEquals("HELO client.example.com", SmtpCommands.helo("client.example.com"));
        assertEquals("RCPT TO:<pepper@example.com>", SmtpCommands.rcptTo("pepper@example.com"));
        assertEquals("AUTH LOGIN", SmtpCommands.auth("LOGIN", null));
        assertEquals("AUTH PLAIN AHVzZXIAcGFzcw==", SmtpCommands.auth("PLAIN", "AHVzZXIAcGFzcw=="));
        assertEquals("VRFY pepper", SmtpCommands.vrfy("pepper"));
        assertEquals("STARTTLS", SmtpCommands.startTls());
        assertEquals("DATA", SmtpCommands.data());
        assertEquals("RSET", SmtpCommands.rset());
        assertEquals("NOOP", SmtpCommands.noop());
        assertEquals("QUIT", SmtpCommands.quit());
    }

    @Test
    void testLineBreakInjectionRefused() {
        SmtpException e = assertThrows(SmtpException.class,
                () -> SmtpCommands.rcptTo("pepper@example.com>\r\nRCPT TO:<evil@example.com"));
        assertEquals(SmtpErrorKind.INVALID_COMMAND, e.getKind());
        assertFalse(e.isRetryable());

        assertThrows(SmtpException.class, () -> SmtpCommands.ehlo("host\nDATA"));
        assertThrows(SmtpException.class, () -> SmtpCommands.mailFrom("a@b.c\r", 1, false, false));
    }

    @Test
    void testLoggableHidesAuthPayload() {
        assertEquals("AUTH PLAIN ***", SmtpCommands.loggable("AUTH PLAIN AHVzZXIAcGFzcw=="));
        assertEquals("AUTH LOGIN", SmtpCommands.loggable("AUTH LOGIN"));
        assertEquals("MAIL FROM:<a@b.c>", SmtpCommands.loggable("MAIL FROM:<a@b.c>"));
    }
}
