package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured SMTP reply.
 *
 * <p>A reply is a three digit code, an optional enhanced status code and one or more text lines.
 * <br>Multiline replies use {@code NNN-text} for every line but the last which uses {@code NNN text}.
 *
 * @param code         Reply code.
 * @param enhancedCode Enhanced status code or null.
 * @param lines        Text lines without code prefix.
 * @see <a href="https://tools.ietf.org/html/rfc5321#section-4.2">RFC 5321 Section 4.2</a>
 * @see <a href="https://tools.ietf.org/html/rfc3463">RFC 3463</a>
 */
public record SmtpResponse(int code, String enhancedCode, List<String> lines) {

    private static final Pattern ENHANCED = Pattern.compile("^([245])\\.(\\d{1,3})\\.(\\d{1,3})(?:\\s|$)");

    public SmtpResponse {
        lines = lines != null ? Collections.unmodifiableList(new ArrayList<>(lines)) : Collections.emptyList();
    }

    /**
     * Constructs a single line reply.
     *
     * @param code Reply code.
     * @param text Reply text.
     */
    public SmtpResponse(int code, String text) {
        this(code, parseEnhanced(code, text), List.of(text));
    }

    /**
     * Parses raw reply lines as read from the wire, CRLF already stripped.
     *
     * @param raw Raw lines.
     * @return SmtpResponse instance.
     * @throws SmtpException Malformed reply.
     */
    public static SmtpResponse parse(List<String> raw) throws SmtpException {
        if (raw == null || raw.isEmpty()) {
            throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Empty response");
        }

        int code = -1;
        List<String> text = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            String line = raw.get(i);
            int lineCode = parseCode(line);
            if (code == -1) {
                code = lineCode;
            } else if (code != lineCode) {
                throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE,
                        "Inconsistent reply codes: " + code + " and " + lineCode);
            }

            boolean last = i == raw.size() - 1;
            if (line.length() > 3) {
                char separator = line.charAt(3);
                if (separator == '-' && last) {
                    throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Reply ends with continuation line");
                }
                if (separator == ' ' && !last) {
                    throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Final reply line before end of reply");
                }
                if (separator != '-' && separator != ' ') {
                    throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Malformed reply line: " + line);
                }
                text.add(line.substring(4));
            } else {
                text.add("");
            }
        }

        return new SmtpResponse(code, parseEnhanced(code, text.get(0)), text);
    }

    /**
     * Parses the reply code of a single line.
     *
     * @param line Reply line.
     * @return Code.
     * @throws SmtpException Malformed line.
     */
    public static int parseCode(String line) throws SmtpException {
        if (line == null || line.length() < 3) {
            throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Reply line too short: " + line);
        }
        for (int i = 0; i < 3; i++) {
            if (!Character.isDigit(line.charAt(i))) {
                throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Non-numeric reply code: " + line);
            }
        }
        int code = Integer.parseInt(line.substring(0, 3));
        if (code < 200 || code > 599) {
            throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Reply code out of range: " + code);
        }
        return code;
    }

    /**
     * Is the given line the last of a reply.
     *
     * @param line Reply line.
     * @return Boolean.
     */
    public static boolean isFinalLine(String line) {
        return line.length() <= 3 || line.charAt(3) != '-';
    }

    private static String parseEnhanced(int code, String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = ENHANCED.matcher(text);
        if (matcher.find() && matcher.group(1).charAt(0) - '0' == code / 100) {
            return matcher.group(1) + "." + matcher.group(2) + "." + matcher.group(3);
        }
        return null;
    }

    public boolean isSuccess() {
        return code >= 200 && code < 300;
    }

    public boolean isIntermediate() {
        return code >= 300 && code < 400;
    }

    public boolean isTemporaryFailure() {
        return code >= 400 && code < 500;
    }

    public boolean isPermanentFailure() {
        return code >= 500;
    }

    /**
     * Gets text of the first line.
     *
     * @return String.
     */
    public String getFirstLine() {
        return lines.isEmpty() ? "" : lines.get(0);
    }

    /**
     * Gets all text lines joined by LF.
     *
     * @return String.
     */
    public String getMessage() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return code + " " + getMessage();
    }
}
