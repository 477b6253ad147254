package com.mimecast.dispatch.smtp.connection;

import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.config.client.TlsConfig;
import com.mimecast.dispatch.config.client.TlsMode;
import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.io.DotStuffingOutputStream;
import com.mimecast.dispatch.smtp.io.LineInputStream;
import com.mimecast.dispatch.smtp.security.DefaultTLSSocket;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLSocket;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking socket transport.
 *
 * <p>Reads use the command timeout as socket timeout.
 * <br>Runs on the client worker pool, never on a caller thread.
 */
public class SocketTransport extends AbstractTransport {
    private static final Logger log = LogManager.getLogger(SocketTransport.class);

    private static final byte[] CRLF = {'\r', '\n'};

    /**
     * Most lines accepted in one reply.
     */
    private static final int MAX_REPLY_LINES = 1000;

    private final String host;
    private final int port;
    private Socket socket;
    private LineInputStream inputStream;
    private OutputStream outputStream;
    private String tlsProtocol;

    /**
     * Constructs a new SocketTransport instance around a connected socket.
     *
     * @param socket Connected socket.
     * @param host   Server host.
     * @param port   Server port.
     * @throws IOException Unable to open streams.
     */
    public SocketTransport(Socket socket, String host, int port) throws IOException {
        this.socket = socket;
        this.host = host;
        this.port = port;
        buildStreams();
        this.state = TransactionState.CONNECTED;
    }

    /**
     * Connects to the configured server.
     *
     * @param config SmtpConfig instance.
     * @return SocketTransport instance.
     * @throws SmtpException Unable to connect.
     */
    public static SocketTransport connect(SmtpConfig config) throws SmtpException {
        String host = config.getHost();
        int port = config.getPort();
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) config.getConnectTimeout().toMillis());
            socket.setSoTimeout((int) config.getCommandTimeout().toMillis());
            socket.setTcpNoDelay(true);
            log.debug("Connected to {}:{}", host, port);

            SocketTransport transport = new SocketTransport(socket, host, port);
            if (config.getTls().getMode() == TlsMode.IMPLICIT) {
                transport.upgradeEncryption(config.getTls(), host);
                transport.state = TransactionState.CONNECTED;
            }
            return transport;
        } catch (IOException e) {
            closeQuietly(socket);
            throw SmtpException.fromIOException(e, "connect");
        }
    }

    private void buildStreams() throws IOException {
        inputStream = new LineInputStream(socket.getInputStream());
        outputStream = new BufferedOutputStream(socket.getOutputStream());
    }

    @Override
    public SmtpResponse sendCommand(String command) throws IOException {
        ensureOpen();
        try {
            log.trace("C: {}", SmtpCommands.loggable(command));
            outputStream.write(command.getBytes(StandardCharsets.UTF_8));
            outputStream.write(CRLF);
            outputStream.flush();
        } catch (IOException e) {
            throw failure(e, "write");
        }
        return readResponse();
    }

    @Override
    public SmtpResponse readResponse() throws IOException {
        ensureOpen();
        List<String> lines = new ArrayList<>();
        try {
            String line;
            do {
                line = inputStream.readLine();
                log.trace("S: {}", line);
                lines.add(line);
                if (lines.size() > MAX_REPLY_LINES) {
                    throw new SmtpException(SmtpErrorKind.INVALID_RESPONSE, "Reply exceeds " + MAX_REPLY_LINES + " lines");
                }
            } while (!SmtpResponse.isFinalLine(line));
        } catch (IOException e) {
            throw failure(e, "read");
        }
        return SmtpResponse.parse(lines);
    }

    @Override
    public void sendPayload(byte[] payload) throws IOException {
        ensureOpen();
        try {
            DotStuffingOutputStream.writeFramed(payload, outputStream);
            log.debug("Sent {} byte payload to {}:{}", payload.length, host, port);
        } catch (IOException e) {
            throw failure(e, "write");
        }
    }

    @Override
    public void upgradeEncryption(TlsConfig tlsConfig, String serverHost) throws IOException {
        ensureOpen();
        try {
            SSLSocket sslSocket = new DefaultTLSSocket(tlsConfig)
                    .setSocket(socket)
                    .setPeer(serverHost, port)
                    .startTLS();
            socket = sslSocket;
            tlsProtocol = sslSocket.getSession().getProtocol();
            buildStreams();
            encryptionEstablished();
            log.info("TLS established with {}:{} using {}", serverHost, port, tlsProtocol);
        } catch (IOException e) {
            SmtpException failure = SmtpException.fromIOException(e, "TLS handshake");
            if (failure.getCategory() == SmtpErrorKind.Category.UNKNOWN
                    || failure.getCategory() == SmtpErrorKind.Category.CONNECTION) {
                failure = new SmtpException(SmtpErrorKind.TLS_HANDSHAKE_FAILED, failure.getMessage(), e);
            }
            close();
            throw failure;
        }
    }

    @Override
    public String getTlsProtocol() {
        return tlsProtocol;
    }

    @Override
    public boolean isOpen() {
        return socket != null && !socket.isClosed() && state != TransactionState.CLOSED;
    }

    @Override
    public void close() {
        state = TransactionState.CLOSED;
        closeQuietly(socket);
    }

    private void ensureOpen() throws SmtpException {
        if (!isOpen()) {
            throw new SmtpException(SmtpErrorKind.CONNECTION_CLOSED, "Connection to " + host + ":" + port + " is closed");
        }
    }

    private SmtpException failure(IOException e, String context) {
        SmtpException failure = SmtpException.fromIOException(e, context);
        if (failure.getKind() == SmtpErrorKind.READ_TIMEOUT && "write".equals(context)) {
            failure = new SmtpException(SmtpErrorKind.WRITE_TIMEOUT, failure.getMessage(), e);
        }
        if (failure.getCategory() != SmtpErrorKind.Category.PROTOCOL) {
            close();
        }
        return failure;
    }

    private static void closeQuietly(Socket socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "SocketTransport{" + host + ":" + port + ", state=" + state + ", tls=" + encrypted + "}";
    }
}
