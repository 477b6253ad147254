package com.mimecast.dispatch.mime;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.commons.lang3.StringUtils;

import javax.mail.internet.AddressException;
import javax.mail.internet.InternetAddress;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * Mailbox address with optional display name.
 *
 * @param email Bare address, local@domain.
 * @param name  Display name or null.
 */
public record Address(String email, String name) {

    /**
     * Constructs a bare address.
     *
     * @param email Bare address.
     */
    public Address(String email) {
        this(email, null);
    }

    /**
     * Parses {@code Name <local@domain>} or a bare address with strict RFC 822 rules.
     *
     * @param value Address string.
     * @param kind  Error kind reported when invalid.
     * @return Address instance.
     * @throws SmtpException Invalid address.
     */
    public static Address parse(String value, SmtpErrorKind kind) throws SmtpException {
        if (StringUtils.isBlank(value)) {
            throw new SmtpException(kind, "Empty address");
        }
        try {
            InternetAddress address = new InternetAddress(value.trim(), true);
            address.validate();
            if (!address.getAddress().contains("@")) {
                throw new SmtpException(kind, "Address has no domain: " + value);
            }
            return new Address(address.getAddress(), StringUtils.trimToNull(address.getPersonal()));
        } catch (AddressException e) {
            throw new SmtpException(kind, "Invalid address " + value + ": " + e.getMessage(), e);
        }
    }

    /**
     * Formats for a message header, RFC 2047 encoding the display name when needed.
     *
     * @return Header value.
     */
    public String toHeader() {
        if (name == null) {
            return "<" + email + ">";
        }
        try {
            return new InternetAddress(email, name, StandardCharsets.UTF_8.name()).toString();
        } catch (UnsupportedEncodingException e) {
            return "<" + email + ">";
        }
    }

    @Override
    public String toString() {
        return name != null ? name + " <" + email + ">" : email;
    }
}
