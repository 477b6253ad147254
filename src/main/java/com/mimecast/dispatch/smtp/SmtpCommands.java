package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;

/**
 * SMTP command rendering.
 *
 * <p>Commands are rendered without the CRLF terminator which the transport appends.
 * <br>Arguments carrying CR or LF are refused to prevent command injection.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321#section-4.1">RFC 5321 Section 4.1</a>
 */
public final class SmtpCommands {

    private SmtpCommands() {
        // Utility class.
    }

    public static String ehlo(String domain) throws SmtpException {
        return "EHLO " + safe(domain);
    }

    public static String helo(String domain) throws SmtpException {
        return "HELO " + safe(domain);
    }

    public static String startTls() {
        return "STARTTLS";
    }

    /**
     * AUTH command.
     *
     * @param mechanism       SASL mechanism name.
     * @param initialResponse Base64 initial response or null.
     * @return Command string.
     * @throws SmtpException Unsafe argument.
     */
    public static String auth(String mechanism, String initialResponse) throws SmtpException {
        return "AUTH " + safe(mechanism) + (initialResponse != null ? " " + safe(initialResponse) : "");
    }

    /**
     * MAIL FROM command.
     *
     * @param address  Reverse path, may be empty for null sender.
     * @param size     Message size or -1 to omit.
     * @param eightBit Add BODY=8BITMIME.
     * @param smtpUtf8 Add SMTPUTF8.
     * @return Command string.
     * @throws SmtpException Unsafe argument.
     */
    public static String mailFrom(String address, long size, boolean eightBit, boolean smtpUtf8) throws SmtpException {
        StringBuilder command = new StringBuilder("MAIL FROM:<").append(safe(address)).append(">");
        if (size >= 0) {
            command.append(" SIZE=").append(size);
        }
        if (eightBit) {
            command.append(" BODY=8BITMIME");
        }
        if (smtpUtf8) {
            command.append(" SMTPUTF8");
        }
        return command.toString();
    }

    public static String rcptTo(String address) throws SmtpException {
        return "RCPT TO:<" + safe(address) + ">";
    }

    public static String data() {
        return "DATA";
    }

    public static String rset() {
        return "RSET";
    }

    public static String noop() {
        return "NOOP";
    }

    public static String quit() {
        return "QUIT";
    }

    public static String vrfy(String address) throws SmtpException {
        return "VRFY " + safe(address);
    }

    /**
     * Gets the verb of a rendered command for logging, AUTH payloads elided.
     *
     * @param command Command string.
     * @return Loggable string.
     */
    public static String loggable(String command) {
        if (command.regionMatches(true, 0, "AUTH ", 0, 5)) {
            int space = command.indexOf(' ', 5);
            return space > 0 ? command.substring(0, space) + " ***" : command;
        }
        return command;
    }

    private static String safe(String argument) throws SmtpException {
        if (argument == null) {
            return "";
        }
        if (argument.indexOf('\r') >= 0 || argument.indexOf('\n') >= 0) {
            throw new SmtpException(SmtpErrorKind.INVALID_COMMAND, "Command argument contains line break");
        }
        return argument;
    }
}
