package com.mimecast.dispatch.smtp.io;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Input stream with reply line reading capability.
 *
 * <p>Reads CRLF terminated lines, tolerating bare LF, and counts them.
 * <br>A bare CR is peeked past and pushed back when no LF follows.
 */
public class LineInputStream extends PushbackInputStream {

    /**
     * Carrige return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Longest reply line accepted, RFC 5321 allows 512 octets, be lenient.
     */
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Maximum line length.
     */
    private final int maxLineLength;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(256);

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        this(stream, DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * Constructs a new LineInputStream instance with line length limit.
     *
     * @param stream        InputStream instance.
     * @param maxLineLength Maximum line length without EOL.
     */
    public LineInputStream(InputStream stream, int maxLineLength) {
        super(new BufferedInputStream(stream), 1);
        this.maxLineLength = maxLineLength;
    }

    /**
     * Reads a line without EOL.
     *
     * @return Line string.
     * @throws EOFException  Stream ended before a complete line.
     * @throws SmtpException Line too long.
     * @throws IOException   Unable to read.
     */
    public String readLine() throws IOException {
        lineBuffer.reset();

        int b;
        while ((b = read()) != -1) {
            if (b == LF) {
                return completeLine();
            }
            if (b == CR) {
                int next = read();
                if (next == LF || next == -1) {
                    return completeLine();
                }
                unread(next);
            }

            lineBuffer.write(b);
            if (lineBuffer.size() > maxLineLength) {
                throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Reply line exceeds " + maxLineLength + " bytes");
            }
        }

        throw new EOFException("Connection closed by server" +
                (lineBuffer.size() > 0 ? " mid-line after " + lineBuffer.size() + " bytes" : ""));
    }

    private String completeLine() {
        lineNumber++;
        return lineBuffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
