package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EmailBuilderTest {

    private final EmailBuilder builder = new EmailBuilder("dispatch.example.com");

    private String encode(Email email) throws SmtpException {
        return new String(builder.encode(email, "id-1@dispatch.example.com"), StandardCharsets.UTF_8);
    }

    private static Email.Builder base() {
        return Email.builder().from("Tony Stark <tony@example.com>").to("pepper@example.com").subject("Hello");
    }

    @Test
    void testGenerateMessageId() {
        String id = builder.generateMessageId();

        assertTrue(id.endsWith("@dispatch.example.com"));
        assertNotEquals(id, builder.generateMessageId());
        assertTrue(new EmailBuilder(null).generateMessageId().endsWith("@localhost"));
    }

    @Test
    void testPlainText() throws SmtpException {
        String message = encode(base().text("Line one\nLine two").build());

        assertTrue(message.contains("Message-ID: <id-1@dispatch.example.com>\r\n"));
        assertTrue(message.contains("From: Tony Stark <tony@example.com>\r\n"));
        assertTrue(message.contains("To: <pepper@example.com>\r\n"));
        assertTrue(message.contains("Subject: Hello\r\n"));
        assertTrue(message.contains("MIME-Version: 1.0\r\n"));
        assertTrue(message.contains("Date: "));
        assertTrue(message.contains("Content-Type: text/plain; charset=\"us-ascii\"\r\n"));
        assertTrue(message.contains("Content-Transfer-Encoding: 7bit\r\n"));
        assertTrue(message.endsWith("\r\n\r\nLine one\r\nLine two"));
        assertFalse(message.contains("multipart"));
    }

    @Test
    void testBccNeverWritten() throws SmtpException {
        String message = encode(base().cc("rhodey@example.com").bcc("secret@example.com").text("x").build());

        assertTrue(message.contains("Cc: <rhodey@example.com>\r\n"));
        assertFalse(message.contains("secret@example.com"));
        assertFalse(message.contains("Bcc"));
    }

    @Test
    void testNonAsciiBodyIsBase64() throws SmtpException {
        String message = encode(base().text("Grüße").build());

        assertTrue(message.contains("Content-Type: text/plain; charset=\"utf-8\"\r\n"));
        assertTrue(message.contains("Content-Transfer-Encoding: base64\r\n"));
        assertTrue(message.contains(Base64.encodeBase64String("Grüße".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testLongLineIsBase64() throws SmtpException {
        String message = encode(base().text("a".repeat(1200)).build());

        assertTrue(message.contains("Content-Transfer-Encoding: base64\r\n"));
        assertFalse(message.contains("a".repeat(1200)));
    }

    @Test
    void testTextAndHtmlAlternative() throws SmtpException {
        String message = encode(base().text("plain").html("<p>rich</p>").build());

        assertTrue(message.contains("Content-Type: multipart/alternative; boundary=\"dispatchAlternative"));
        assertTrue(message.indexOf("Content-Type: text/plain") < message.indexOf("Content-Type: text/html"));
        assertTrue(message.contains("<p>rich</p>"));
        assertTrue(message.trim().endsWith("--"));
    }

    @Test
    void testAttachmentsMixed() throws SmtpException {
        byte[] pdf = {37, 80, 68, 70, 0, -1};
        String message = encode(base().text("see attached")
                .attachment(new Attachment("report.pdf", "application/pdf", pdf))
                .build());

        assertTrue(message.contains("Content-Type: multipart/mixed; boundary=\"dispatchMixed"));
        assertTrue(message.contains("Content-Type: application/pdf; name=\"report.pdf\"\r\n"));
        assertTrue(message.contains("Content-Disposition: attachment; filename=\"report.pdf\"\r\n"));
        assertTrue(message.contains(Base64.encodeBase64String(pdf)));
        assertTrue(message.contains("see attached"));
    }

    @Test
    void testEmptyBody() throws SmtpException {
        String message = encode(base().build());

        assertTrue(message.contains("Content-Type: text/plain; charset=\"us-ascii\"\r\n"));
        assertTrue(message.endsWith("Content-Transfer-Encoding: 7bit\r\n\r\n"));
    }

    @Test
    void testCustomHeaderAndReplyTo() throws SmtpException {
        String message = encode(base().text("x").replyTo("support@example.com").header("X-Campaign", "launch").build());

        assertTrue(message.contains("Reply-To: <support@example.com>\r\n"));
        assertTrue(message.contains("X-Campaign: launch\r\n"));
    }

    @Test
    void testEncodeHeader() {
        assertEquals("Hello", EmailBuilder.encodeHeader("Hello"));
        assertTrue(EmailBuilder.encodeHeader("Grüße").startsWith("=?UTF-8?"));

        String multiline = EmailBuilder.encodeHeader("one\r\nBcc: injected@example.com");
        assertEquals("=?UTF-8?B?" + Base64.encodeBase64String("one\r\nBcc: injected@example.com".getBytes(StandardCharsets.UTF_8)) + "?=",
                multiline);
        assertFalse(multiline.contains("\n"));
    }
}
