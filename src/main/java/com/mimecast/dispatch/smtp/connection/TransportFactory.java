package com.mimecast.dispatch.smtp.connection;

import com.mimecast.dispatch.config.client.SmtpConfig;

import java.io.IOException;

/**
 * Opens new transports.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * Connects to the configured server.
     * <p>Implicit TLS is established here; the banner is left for the engine to read.
     *
     * @param config SmtpConfig instance.
     * @return Transport in CONNECTED state.
     * @throws IOException Unable to connect.
     */
    Transport connect(SmtpConfig config) throws IOException;
}
