package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default message encoder producing a minimal RFC 5322 message.
 *
 * <p>Structure:
 * <ul>
 *     <li>text or html alone: a single part</li>
 *     <li>text and html: multipart/alternative</li>
 *     <li>attachments: multipart/mixed wrapping the body</li>
 * </ul>
 * <p>Non-ASCII header values are RFC 2047 encoded. Bcc is never written.
 * <br>ASCII text with short lines goes as 7bit, anything else as base64.
 */
public class EmailBuilder implements MessageEncoder {
    private static final Logger log = LogManager.getLogger(EmailBuilder.class);

    private static final String CRLF = "\r\n";
    private static final int MAX_LINE = 998;

    private final String domain;

    /**
     * Constructs a new EmailBuilder instance.
     *
     * @param domain Domain used in generated message identifiers.
     */
    public EmailBuilder(String domain) {
        this.domain = StringUtils.defaultIfBlank(domain, "localhost");
    }

    @Override
    public String generateMessageId() {
        return UUID.randomUUID() + "@" + domain;
    }

    @Override
    public byte[] encode(Email email, String messageId) throws SmtpException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            writeTo(email, messageId, outputStream);
        } catch (IOException e) {
            throw new SmtpException(SmtpErrorKind.ENCODING_FAILED, "Unable to encode message: " + e.getMessage(), e);
        }
        return outputStream.toByteArray();
    }

    /**
     * Writes the complete message.
     *
     * @param email        Email instance.
     * @param messageId    Message identifier without angle brackets.
     * @param outputStream OutputStream instance.
     * @throws IOException Unable to write.
     */
    void writeTo(Email email, String messageId, OutputStream outputStream) throws IOException {
        List<String[]> headers = new ArrayList<>();
        DateFormat dateFormat = new SimpleDateFormat("EEE, d MMM yyyy HH:mm:ss Z", Locale.ENGLISH);
        headers.add(new String[]{"Date", dateFormat.format(new Date())});
        headers.add(new String[]{"Message-ID", "<" + messageId + ">"});
        headers.add(new String[]{"From", email.getFrom().toHeader()});
        if (!email.getTo().isEmpty()) {
            headers.add(new String[]{"To", join(email.getTo())});
        }
        if (!email.getCc().isEmpty()) {
            headers.add(new String[]{"Cc", join(email.getCc())});
        }
        if (email.getReplyTo() != null) {
            headers.add(new String[]{"Reply-To", email.getReplyTo().toHeader()});
        }
        headers.add(new String[]{"Subject", encodeHeader(StringUtils.defaultString(email.getSubject()))});
        for (Map.Entry<String, String> header : email.getHeaders().entrySet()) {
            headers.add(new String[]{header.getKey(), encodeHeader(header.getValue())});
        }
        headers.add(new String[]{"MIME-Version", "1.0"});

        for (String[] header : headers) {
            write(outputStream, header[0] + ": " + header[1] + CRLF);
        }

        List<Part> alternative = new ArrayList<>();
        if (email.getText() != null) {
            alternative.add(textPart("text/plain", email.getText()));
        }
        if (email.getHtml() != null) {
            alternative.add(textPart("text/html", email.getHtml()));
        }
        if (alternative.isEmpty()) {
            alternative.add(textPart("text/plain", ""));
        }

        List<Part> mixed = email.getAttachments().stream()
                .map(EmailBuilder::attachmentPart)
                .collect(Collectors.toList());

        String id = UUID.randomUUID().toString().replace("-", "");
        if (mixed.isEmpty()) {
            writeBody(outputStream, alternative, "alternative", id);
        } else {
            String boundary = "dispatchMixed" + id;
            write(outputStream, "Content-Type: multipart/mixed; boundary=\"" + boundary + "\"" + CRLF + CRLF);
            write(outputStream, "--" + boundary + CRLF);
            writeBody(outputStream, alternative, "alternative", id);
            for (Part part : mixed) {
                write(outputStream, CRLF + "--" + boundary + CRLF);
                part.writeTo(outputStream);
            }
            write(outputStream, CRLF + "--" + boundary + "--" + CRLF);
        }
    }

    /**
     * Writes one part as is, or several as a multipart of the given type.
     */
    private void writeBody(OutputStream outputStream, List<Part> parts, String type, String id) throws IOException {
        if (parts.size() == 1) {
            parts.get(0).writeTo(outputStream);
            return;
        }

        String boundary = "dispatch" + StringUtils.capitalize(type) + id;
        write(outputStream, "Content-Type: multipart/" + type + "; boundary=\"" + boundary + "\"" + CRLF + CRLF);
        for (Part part : parts) {
            write(outputStream, "--" + boundary + CRLF);
            part.writeTo(outputStream);
            write(outputStream, CRLF);
        }
        write(outputStream, "--" + boundary + "--" + CRLF);
    }

    private static Part textPart(String type, String text) {
        String normalized = text.replaceAll("\r\n|\r|\n", CRLF);
        boolean plain = StandardCharsets.US_ASCII.newEncoder().canEncode(normalized)
                && normalized.lines().allMatch(l -> l.length() <= MAX_LINE);

        if (plain) {
            return new Part("Content-Type: " + type + "; charset=\"us-ascii\"" + CRLF +
                    "Content-Transfer-Encoding: 7bit" + CRLF,
                    normalized.getBytes(StandardCharsets.US_ASCII));
        }
        return new Part("Content-Type: " + type + "; charset=\"utf-8\"" + CRLF +
                "Content-Transfer-Encoding: base64" + CRLF,
                Base64.encodeBase64Chunked(normalized.getBytes(StandardCharsets.UTF_8)));
    }

    private static Part attachmentPart(Attachment attachment) {
        String filename = encodeHeader(StringUtils.defaultIfBlank(attachment.filename(), "attachment"));
        return new Part("Content-Type: " + attachment.contentType() + "; name=\"" + filename + "\"" + CRLF +
                "Content-Disposition: attachment; filename=\"" + filename + "\"" + CRLF +
                "Content-Transfer-Encoding: base64" + CRLF,
                Base64.encodeBase64Chunked(attachment.content()));
    }

    /**
     * Encodes a header value, base64 encoded words for multiline values.
     *
     * @param value Header value.
     * @return Encoded value.
     */
    static String encodeHeader(String value) {
        boolean multiline = value.contains("\r") || value.contains("\n");
        if (multiline) {
            return "=?UTF-8?B?" + Base64.encodeBase64String(value.getBytes(StandardCharsets.UTF_8)).trim() + "?=";
        }
        try {
            return MimeUtility.encodeText(value, StandardCharsets.UTF_8.name(), null);
        } catch (UnsupportedEncodingException e) {
            log.warn("Unable to encode header value: {}", e.getMessage());
            return value;
        }
    }

    private static String join(List<Address> addresses) {
        return addresses.stream().map(Address::toHeader).collect(Collectors.joining(", "));
    }

    private static void write(OutputStream outputStream, String value) throws IOException {
        outputStream.write(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Encoded MIME part: header block and transfer encoded body.
     */
    private record Part(String headers, byte[] body) {

        void writeTo(OutputStream outputStream) throws IOException {
            write(outputStream, headers + CRLF);
            outputStream.write(body);
        }
    }
}
