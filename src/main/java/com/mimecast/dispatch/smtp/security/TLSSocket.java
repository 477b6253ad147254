package com.mimecast.dispatch.smtp.security;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.Socket;

/**
 * Client side TLS layer over an already connected socket.
 * <p>Used right after connect for implicit TLS and after the 220 go ahead for STARTTLS.
 */
public interface TLSSocket {

    TLSSocket setSocket(Socket socket);

    /**
     * Sets the peer used for SNI and hostname verification.
     *
     * @param host Host name as configured.
     * @param port Port.
     * @return Self.
     */
    TLSSocket setPeer(String host, int port);

    /**
     * Wraps the socket and completes the handshake.
     *
     * @return SSLSocket instance.
     * @throws IOException Handshake or trust failure.
     */
    SSLSocket startTLS() throws IOException;
}
