package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoginTest {

    @Test
    void evaluateChallenge() throws SmtpException {
        Login login = new Login("tony@example.com", "giveHerTheRing");

        assertNull(login.getInitialResponse());
        assertEquals("dG9ueUBleGFtcGxlLmNvbQ==", login.evaluateChallenge("VXNlcm5hbWU6"));
        assertEquals("Z2l2ZUhlclRoZVJpbmc=", login.evaluateChallenge("UGFzc3dvcmQ6"));

        SmtpException e = assertThrows(SmtpException.class, () -> login.evaluateChallenge("VXNlcm5hbWU6"));
        assertEquals(SmtpErrorKind.AUTHENTICATION_FAILED, e.getKind());
    }
}
