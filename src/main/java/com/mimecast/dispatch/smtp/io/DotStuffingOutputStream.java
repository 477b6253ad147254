package com.mimecast.dispatch.smtp.io;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Output stream applying SMTP DATA framing.
 *
 * <p>Per RFC 5321 Section 4.5.2 a line beginning with a dot gets an additional dot prepended.
 * <br>Bare LF line endings are normalized to CRLF.
 * <br>{@link #finish()} ends the last line if needed and writes the end of data marker.
 * <br>Closing this stream does not close the underlying one.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321#section-4.5.2">RFC 5321 Section 4.5.2</a>
 */
public class DotStuffingOutputStream extends FilterOutputStream {

    private static final byte[] END_OF_DATA = {'.', '\r', '\n'};
    private static final byte[] CRLF = {'\r', '\n'};

    private boolean atLineStart = true;
    private boolean sawCr = false;
    private boolean finished = false;

    /**
     * Constructs a new DotStuffingOutputStream instance.
     *
     * @param out OutputStream instance.
     */
    public DotStuffingOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        if (finished) {
            throw new IOException("Message already finished");
        }

        if (b == '\n') {
            if (!sawCr) {
                out.write('\r');
            }
            out.write('\n');
            atLineStart = true;
            sawCr = false;
            return;
        }

        if (atLineStart && b == '.') {
            out.write('.');
        }
        out.write(b);
        atLineStart = false;
        sawCr = b == '\r';
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        for (int i = off; i < off + len; i++) {
            write(b[i]);
        }
    }

    /**
     * Ends the message with CRLF.CRLF and flushes.
     *
     * @throws IOException Unable to write.
     */
    public void finish() throws IOException {
        if (finished) {
            return;
        }
        if (!atLineStart) {
            if (sawCr) {
                out.write('\n');
            } else {
                out.write(CRLF);
            }
        }
        out.write(END_OF_DATA);
        out.flush();
        finished = true;
    }

    @Override
    public void close() throws IOException {
        finish();
    }

    /**
     * Frames a whole payload.
     *
     * @param payload Message bytes.
     * @param out     OutputStream instance.
     * @throws IOException Unable to write.
     */
    public static void writeFramed(byte[] payload, OutputStream out) throws IOException {
        DotStuffingOutputStream stuffing = new DotStuffingOutputStream(out);
        stuffing.write(payload, 0, payload.length);
        stuffing.finish();
    }

    /**
     * Message size as RFC 1870 counts it.
     * <p>Octets after line ending normalization, including the final line break,
     * <br>excluding stuffed dots and the end of data marker.
     *
     * @param payload Message bytes, not yet framed.
     * @return Size in octets.
     * @see <a href="https://tools.ietf.org/html/rfc1870#section-3">RFC 1870 Section 3</a>
     */
    public static long messageSize(byte[] payload) {
        long size = payload.length;
        boolean cr = false;
        for (byte b : payload) {
            if (b == '\n' && !cr) {
                size++;
            }
            cr = b == '\r';
        }
        if (payload.length > 0 && payload[payload.length - 1] != '\n') {
            size += cr ? 1 : 2;
        }
        return size;
    }
}
