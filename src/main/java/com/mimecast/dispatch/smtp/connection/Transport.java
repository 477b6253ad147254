package com.mimecast.dispatch.smtp.connection;

import com.mimecast.dispatch.config.client.TlsConfig;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.session.Capabilities;
import com.mimecast.dispatch.smtp.session.TransactionState;

import java.io.Closeable;
import java.io.IOException;

/**
 * SMTP transport.
 *
 * <p>Owns one connection to a server and exchanges strictly sequential command/reply pairs over it.
 * <br>Tracks the negotiated capabilities and the dialogue state of that connection.
 * <br>Instances are not thread safe; the pool hands each one to a single caller at a time.
 */
public interface Transport extends Closeable {

    /**
     * Sends a command and reads its reply.
     *
     * @param command Command without CRLF.
     * @return SmtpResponse instance.
     * @throws IOException Unable to communicate.
     */
    SmtpResponse sendCommand(String command) throws IOException;

    /**
     * Reads one reply, used for the banner and the end of data reply.
     *
     * @return SmtpResponse instance.
     * @throws IOException Unable to communicate.
     */
    SmtpResponse readResponse() throws IOException;

    /**
     * Streams a message after a 354 go ahead, applying dot-stuffing and the end of data marker.
     * <p>Does not read the reply.
     *
     * @param payload Message bytes.
     * @throws IOException Unable to communicate.
     */
    void sendPayload(byte[] payload) throws IOException;

    /**
     * Upgrades the plaintext connection to TLS in place after a STARTTLS go ahead.
     * <p>Capabilities are discarded and must be re-negotiated.
     *
     * @param tlsConfig TlsConfig instance.
     * @param host      Server host name for SNI and verification.
     * @throws IOException Handshake failure.
     */
    void upgradeEncryption(TlsConfig tlsConfig, String host) throws IOException;

    /**
     * Is the channel encrypted.
     *
     * @return Boolean.
     */
    boolean isEncrypted();

    /**
     * Gets negotiated TLS protocol.
     *
     * @return Protocol name or null if plaintext.
     */
    String getTlsProtocol();

    /**
     * Gets negotiated capabilities.
     *
     * @return Capabilities or null before negotiation.
     */
    Capabilities getCapabilities();

    void setCapabilities(Capabilities capabilities);

    TransactionState getState();

    void setState(TransactionState state);

    /**
     * Gets the authenticated identity on this connection.
     *
     * @return Username or null.
     */
    String getAuthenticatedUser();

    void setAuthenticatedUser(String user);

    /**
     * Gets the banner received on connect.
     *
     * @return Banner or null if not read yet.
     */
    SmtpResponse getBanner();

    void setBanner(SmtpResponse banner);

    /**
     * Is the underlying connection open.
     *
     * @return Boolean.
     */
    boolean isOpen();

    /**
     * Closes the connection without QUIT.
     */
    @Override
    void close();
}
