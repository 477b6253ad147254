package com.mimecast.dispatch.smtp.io;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DotStuffingOutputStreamTest {

    private static String framed(String payload) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DotStuffingOutputStream.writeFramed(payload.getBytes(StandardCharsets.UTF_8), out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testLeadingDotsStuffed() throws IOException {
        assertEquals("Subject: x\r\n\r\n..hidden\r\nmid.dle\r\n...\r\n.\r\n",
                framed("Subject: x\r\n\r\n.hidden\r\nmid.dle\r\n..\r\n"));
    }

    @Test
    void testFirstLineDot() throws IOException {
        assertEquals("..\r\n.\r\n", framed(".\r\n"));
    }

    @Test
    void testBareLineFeedNormalized() throws IOException {
        assertEquals("one\r\ntwo\r\n.\r\n", framed("one\ntwo\n"));
    }

    @Test
    void testMissingTrailingLineBreak() throws IOException {
        assertEquals("body\r\n.\r\n", framed("body"));
        assertEquals("body\r\n.\r\n", framed("body\r"));
    }

    @Test
    void testEmptyPayload() throws IOException {
        assertEquals(".\r\n", framed(""));
    }

    @Test
    void testWriteAfterFinish() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DotStuffingOutputStream stream = new DotStuffingOutputStream(out);
        stream.write("x".getBytes(StandardCharsets.US_ASCII));
        stream.finish();
        stream.finish();

        assertEquals("x\r\n.\r\n", out.toString(StandardCharsets.US_ASCII));
        assertThrows(IOException.class, () -> stream.write('y'));
    }

    @Test
    void testMessageSizeCountsNormalizedLines() {
        assertEquals(7, DotStuffingOutputStream.messageSize("a\n.b".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(5, DotStuffingOutputStream.messageSize("one\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(6, DotStuffingOutputStream.messageSize("body\r".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(0, DotStuffingOutputStream.messageSize(new byte[0]));
    }

    @Test
    void testMessageSizeExcludesStuffingAndTerminator() throws IOException {
        String payload = "Subject: x\n\n.hidden\n..\n";
        int stuffed = 2;
        int terminator = 3;

        assertEquals(framed(payload).length() - stuffed - terminator,
                DotStuffingOutputStream.messageSize(payload.getBytes(StandardCharsets.US_ASCII)));
    }
}
