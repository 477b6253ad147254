package com.mimecast.dispatch.smtp.security;

import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.config.client.TlsConfig;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.trust.PermissiveTrustManager;
import com.mimecast.dispatch.trust.TrustManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;

/**
 * Default TLS socket implementation.
 * <p>Builds an SSLContext from the TLS configuration and wraps the socket.
 * <br>Protocols default to the configured minimum version and anything newer.
 * <br>Hostname verification uses the JSSE HTTPS endpoint identification algorithm.
 */
public class DefaultTLSSocket implements TLSSocket {
    private static final Logger log = LogManager.getLogger(DefaultTLSSocket.class);

    private final TlsConfig tlsConfig;
    private Socket socket;
    private String host;
    private int port;
    private final String[] protocols;

    /**
     * Constructs a new DefaultTLSSocket instance.
     *
     * @param tlsConfig TlsConfig instance.
     */
    public DefaultTLSSocket(TlsConfig tlsConfig) {
        this.tlsConfig = tlsConfig;
        this.protocols = tlsConfig.getMinVersion().getProtocolsFrom();
    }

    @Override
    public TLSSocket setSocket(Socket socket) {
        this.socket = socket;
        return this;
    }

    @Override
    public TLSSocket setPeer(String host, int port) {
        this.host = host;
        this.port = port;
        return this;
    }

    @Override
    public SSLSocket startTLS() throws IOException {
        SSLContext context;
        try {
            context = SSLContext.getInstance("TLS");
            context.init(null, new javax.net.ssl.TrustManager[]{buildTrustManager()}, null);
        } catch (GeneralSecurityException e) {
            throw new SmtpException(SmtpErrorKind.TLS_HANDSHAKE_FAILED, "Unable to initialise TLS context: " + e.getMessage(), e);
        }

        String sniHost = tlsConfig.getSniOverride() != null ? tlsConfig.getSniOverride() : host;
        SSLSocket sslSocket = (SSLSocket) context.getSocketFactory().createSocket(socket, sniHost, port, true);
        sslSocket.setUseClientMode(true);

        SSLParameters parameters = sslSocket.getSSLParameters();
        parameters.setProtocols(getEnabledProtocols(sslSocket));
        if (sniHost != null && !sniHost.isEmpty() && !Character.isDigit(sniHost.charAt(sniHost.length() - 1))) {
            parameters.setServerNames(List.of(new SNIHostName(sniHost)));
        }
        if (tlsConfig.isVerifyCertificates() && tlsConfig.isVerifyHostname()) {
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
        }
        sslSocket.setSSLParameters(parameters);

        sslSocket.startHandshake();
        log.debug("TLS handshake complete with {}:{} using {} {}", host, port,
                sslSocket.getSession().getProtocol(), sslSocket.getSession().getCipherSuite());
        return sslSocket;
    }

    /**
     * Gets configured protocols the JVM supports.
     *
     * @param sslSocket SSLSocket instance.
     * @return Protocols list.
     * @throws SmtpException No acceptable protocol supported.
     */
    String[] getEnabledProtocols(SSLSocket sslSocket) throws SmtpException {
        List<String> supported = Arrays.asList(sslSocket.getSupportedProtocols());
        String[] enabled = Arrays.stream(protocols).filter(supported::contains).toArray(String[]::new);
        if (enabled.length == 0) {
            throw new SmtpException(SmtpErrorKind.TLS_VERSION_MISMATCH,
                    "No supported TLS protocol among " + Arrays.toString(protocols));
        }
        return enabled;
    }

    private X509TrustManager buildTrustManager() throws GeneralSecurityException, IOException {
        if (!tlsConfig.isVerifyCertificates()) {
            if (!Boolean.getBoolean(SmtpConfig.INSECURE_ALLOWED_PROPERTY)) {
                throw new SmtpException(SmtpErrorKind.CONFIGURATION_INVALID,
                        "Certificate verification may only be disabled in test builds");
            }
            log.warn("Certificate verification disabled for {}", host);
            return new PermissiveTrustManager();
        }
        return new TrustManager(tlsConfig.getCaCertPath());
    }
}
