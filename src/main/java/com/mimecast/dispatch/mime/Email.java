package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logical email.
 *
 * <p>Built with {@link #builder()}; addresses are validated on build.
 */
public class Email {

    private final Address from;
    private final List<Address> to;
    private final List<Address> cc;
    private final List<Address> bcc;
    private final Address replyTo;
    private final String subject;
    private final String text;
    private final String html;
    private final List<Attachment> attachments;
    private final Map<String, String> headers;
    private final String messageId;

    private Email(Builder builder, Address from, List<Address> to, List<Address> cc, List<Address> bcc, Address replyTo) {
        this.from = from;
        this.to = Collections.unmodifiableList(to);
        this.cc = Collections.unmodifiableList(cc);
        this.bcc = Collections.unmodifiableList(bcc);
        this.replyTo = replyTo;
        this.subject = builder.subject;
        this.text = builder.text;
        this.html = builder.html;
        this.attachments = List.copyOf(builder.attachments);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.messageId = builder.messageId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Address getFrom() {
        return from;
    }

    public List<Address> getTo() {
        return to;
    }

    public List<Address> getCc() {
        return cc;
    }

    public List<Address> getBcc() {
        return bcc;
    }

    public Address getReplyTo() {
        return replyTo;
    }

    public String getSubject() {
        return subject;
    }

    public String getText() {
        return text;
    }

    public String getHtml() {
        return html;
    }

    public List<Attachment> getAttachments() {
        return attachments;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Gets the caller supplied message identifier.
     *
     * @return Identifier or null to generate one.
     */
    public String getMessageId() {
        return messageId;
    }

    /**
     * Gets envelope recipients: to, cc and bcc, deduplicated case insensitively in order.
     *
     * @return List of bare addresses.
     */
    public List<String> getAllRecipients() {
        Map<String, String> unique = new LinkedHashMap<>();
        for (List<Address> list : List.of(to, cc, bcc)) {
            for (Address address : list) {
                unique.putIfAbsent(address.email().toLowerCase(Locale.ROOT), address.email());
            }
        }
        return new ArrayList<>(unique.values());
    }

    @Override
    public String toString() {
        return "Email{from=" + from + ", recipients=" + getAllRecipients().size() + ", subject=" + subject + "}";
    }

    /**
     * Email builder.
     */
    public static class Builder {
        private String from;
        private final List<String> to = new ArrayList<>();
        private final List<String> cc = new ArrayList<>();
        private final List<String> bcc = new ArrayList<>();
        private String replyTo;
        private String subject;
        private String text;
        private String html;
        private final List<Attachment> attachments = new ArrayList<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String messageId;

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String... addresses) {
            Collections.addAll(to, addresses);
            return this;
        }

        public Builder cc(String... addresses) {
            Collections.addAll(cc, addresses);
            return this;
        }

        public Builder bcc(String... addresses) {
            Collections.addAll(bcc, addresses);
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder html(String html) {
            this.html = html;
            return this;
        }

        public Builder attachment(Attachment attachment) {
            attachments.add(attachment);
            return this;
        }

        /**
         * Adds an extra header.
         *
         * @param name  Header name.
         * @param value Header value.
         * @return Self.
         */
        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        /**
         * Validates addresses and builds the email.
         *
         * @return Email instance.
         * @throws SmtpException Invalid or missing sender or recipients.
         */
        public Email build() throws SmtpException {
            if (from == null) {
                throw new SmtpException(SmtpErrorKind.INVALID_FROM_ADDRESS, "Sender is required");
            }
            Address sender = Address.parse(from, SmtpErrorKind.INVALID_FROM_ADDRESS);
            List<Address> toList = parseAll(to);
            List<Address> ccList = parseAll(cc);
            List<Address> bccList = parseAll(bcc);
            if (toList.isEmpty() && ccList.isEmpty() && bccList.isEmpty()) {
                throw new SmtpException(SmtpErrorKind.INVALID_RECIPIENT_ADDRESS, "At least one recipient is required");
            }
            Address reply = replyTo != null ? Address.parse(replyTo, SmtpErrorKind.INVALID_RECIPIENT_ADDRESS) : null;
            for (String name : headers.keySet()) {
                if (name.isEmpty() || name.chars().anyMatch(c -> c <= 32 || c >= 127 || c == ':')) {
                    throw new SmtpException(SmtpErrorKind.ENCODING_FAILED, "Invalid header name: " + name);
                }
            }
            return new Email(this, sender, toList, ccList, bccList, reply);
        }

        private static List<Address> parseAll(List<String> values) throws SmtpException {
            List<Address> list = new ArrayList<>();
            for (String value : values) {
                list.add(Address.parse(value, SmtpErrorKind.INVALID_RECIPIENT_ADDRESS));
            }
            return list;
        }
    }
}
