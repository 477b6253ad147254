package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailTest {

    @Test
    void testBuild() throws SmtpException {
        Email email = Email.builder()
                .from("Tony <tony@example.com>")
                .to("pepper@example.com", "happy@example.com")
                .cc("rhodey@example.com")
                .bcc("jarvis@example.com")
                .replyTo("support@example.com")
                .subject("Status")
                .text("All good")
                .header("X-Priority", "1")
                .messageId("fixed@example.com")
                .build();

        assertEquals("tony@example.com", email.getFrom().email());
        assertEquals(2, email.getTo().size());
        assertEquals("support@example.com", email.getReplyTo().email());
        assertEquals("1", email.getHeaders().get("X-Priority"));
        assertEquals("fixed@example.com", email.getMessageId());
        assertEquals(List.of("pepper@example.com", "happy@example.com", "rhodey@example.com", "jarvis@example.com"),
                email.getAllRecipients());
    }

    @Test
    void testRecipientsDeduplicated() throws SmtpException {
        Email email = Email.builder()
                .from("tony@example.com")
                .to("pepper@example.com")
                .cc("Pepper@Example.com")
                .bcc("pepper@example.com", "happy@example.com")
                .build();

        assertEquals(List.of("pepper@example.com", "happy@example.com"), email.getAllRecipients());
    }

    @Test
    void testBccOnly() throws SmtpException {
        Email email = Email.builder().from("tony@example.com").bcc("hidden@example.com").build();

        assertEquals(List.of("hidden@example.com"), email.getAllRecipients());
    }

    @Test
    void testMissingSender() {
        SmtpException e = assertThrows(SmtpException.class, () -> Email.builder().to("pepper@example.com").build());
        assertEquals(SmtpErrorKind.INVALID_FROM_ADDRESS, e.getKind());
    }

    @Test
    void testMissingRecipients() {
        SmtpException e = assertThrows(SmtpException.class, () -> Email.builder().from("tony@example.com").build());
        assertEquals(SmtpErrorKind.INVALID_RECIPIENT_ADDRESS, e.getKind());
    }

    @Test
    void testInvalidRecipient() {
        SmtpException e = assertThrows(SmtpException.class,
                () -> Email.builder().from("tony@example.com").to("pepper@example.com", "broken@").build());
        assertEquals(SmtpErrorKind.INVALID_RECIPIENT_ADDRESS, e.getKind());
    }

    @Test
    void testInvalidHeaderName() {
        SmtpException e = assertThrows(SmtpException.class, () -> Email.builder()
                .from("tony@example.com").to("pepper@example.com").header("Bad Name", "x").build());
        assertEquals(SmtpErrorKind.ENCODING_FAILED, e.getKind());
    }

    @Test
    void testAttachmentCopiesContent() {
        byte[] content = {1, 2, 3};
        Attachment attachment = new Attachment("a.bin", null, content);
        content[0] = 9;

        assertEquals("application/octet-stream", attachment.contentType());
        assertEquals(1, attachment.content()[0]);
    }
}
