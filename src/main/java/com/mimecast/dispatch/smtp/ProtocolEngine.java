package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.config.client.TlsConfig;
import com.mimecast.dispatch.config.client.TlsMode;
import com.mimecast.dispatch.smtp.auth.Authenticator;
import com.mimecast.dispatch.smtp.auth.CredentialProvider;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.extension.client.ClientAuth;
import com.mimecast.dispatch.smtp.extension.client.ClientData;
import com.mimecast.dispatch.smtp.extension.client.ClientEhlo;
import com.mimecast.dispatch.smtp.extension.client.ClientMail;
import com.mimecast.dispatch.smtp.extension.client.ClientNoop;
import com.mimecast.dispatch.smtp.extension.client.ClientQuit;
import com.mimecast.dispatch.smtp.extension.client.ClientRcpt;
import com.mimecast.dispatch.smtp.extension.client.ClientRset;
import com.mimecast.dispatch.smtp.extension.client.ClientStartTls;
import com.mimecast.dispatch.smtp.io.DotStuffingOutputStream;
import com.mimecast.dispatch.smtp.metrics.ClientMetrics;
import com.mimecast.dispatch.smtp.session.Capabilities;
import com.mimecast.dispatch.smtp.session.TransactionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SMTP protocol engine.
 *
 * <p>Sequences banner, greeting, optional STARTTLS with re-greeting, optional authentication
 * <br>and the MAIL, RCPT, DATA transaction over a single transport.
 * <p>Setup is done once per connection; later transactions on a ready connection go straight to MAIL.
 * <p>Stateless between calls; the transport carries the session state.
 */
public class ProtocolEngine {
    private static final Logger log = LogManager.getLogger(ProtocolEngine.class);

    private static final Pattern QUEUED_AS = Pattern.compile("(?i)queued as\\s+<?([A-Za-z0-9._@-]+)>?");
    private static final Pattern ID_TOKEN = Pattern.compile("(?i)\\bid=<?([A-Za-z0-9._@-]+)>?");

    private final SmtpConfig config;
    private final TlsConfig tlsConfig;
    private final CredentialProvider credentialProvider;
    private final Authenticator authenticator;
    private final ClientMetrics metrics;

    /**
     * Constructs a new ProtocolEngine instance.
     *
     * @param config             SmtpConfig instance.
     * @param credentialProvider CredentialProvider instance or null to skip authentication.
     * @param metrics            ClientMetrics instance.
     */
    public ProtocolEngine(SmtpConfig config, CredentialProvider credentialProvider, ClientMetrics metrics) {
        this.config = config;
        this.tlsConfig = config.getTls();
        this.credentialProvider = credentialProvider;
        this.metrics = metrics;
        this.authenticator = new Authenticator(config.getAuthMethod(),
                tlsConfig.isAllowPlaintextAuth() && tlsConfig.getMode() == TlsMode.NONE,
                config.getHost(), config.getPort());
    }

    /**
     * Brings a connection to a state where MAIL may be sent.
     * <p>Does nothing for a connection that is already ready.
     *
     * @param transport Transport instance.
     * @throws IOException Negotiation, TLS or authentication failure.
     */
    public void ensureReady(Transport transport) throws IOException {
        TransactionState state = transport.getState();
        if (state.isReady()) {
            return;
        }
        if (state != TransactionState.CONNECTED) {
            throw new SmtpException(SmtpErrorKind.CONNECTION_UNHEALTHY,
                    "Connection left in state " + state + " cannot be prepared");
        }

        negotiate(transport);
        authenticate(transport);
        log.debug("Connection ready: {}", transport);
    }

    /**
     * Reads the banner, greets and upgrades to TLS as the policy asks, greeting again after an upgrade.
     *
     * @param transport Transport instance in CONNECTED state.
     * @throws IOException Negotiation or TLS failure.
     */
    public void negotiate(Transport transport) throws IOException {
        readBanner(transport);

        String clientId = config.getClientId();
        new ClientEhlo(clientId).process(transport);

        if (new ClientStartTls(tlsConfig, config.getHost()).process(transport)) {
            metrics.recordTlsUpgrade();
            // Plaintext capabilities are discarded by the upgrade.
            new ClientEhlo(clientId).process(transport);
        }
    }

    /**
     * Authenticates if credentials are configured.
     *
     * @param transport Transport instance in GREETED state.
     * @return True if authenticated.
     * @throws IOException Authentication failure.
     */
    public boolean authenticate(Transport transport) throws IOException {
        if (credentialProvider == null) {
            return false;
        }
        return new ClientAuth(authenticator, credentialProvider, metrics).process(transport);
    }

    public boolean hasCredentials() {
        return credentialProvider != null;
    }

    private void readBanner(Transport transport) throws IOException {
        if (transport.getBanner() != null) {
            return;
        }
        SmtpResponse banner = transport.readResponse();
        transport.setBanner(banner);
        if (banner.code() != SmtpResponses.SERVICE_READY_220) {
            SmtpErrorKind kind = banner.code() == SmtpResponses.SERVICE_UNAVAILABLE_421
                    ? SmtpErrorKind.SERVER_SHUTDOWN
                    : SmtpErrorKind.UNEXPECTED_RESPONSE;
            throw new SmtpException(kind, "Server banner: " + banner, banner.code(), banner.enhancedCode(), null);
        }
        log.debug("Banner: {}", banner.getFirstLine());
    }

    /**
     * Runs one mail transaction on a ready connection.
     * <p>Rejected recipients are reported in the outcome; the transaction only fails when none is accepted.
     *
     * @param transport  Transport instance.
     * @param from       Envelope sender.
     * @param recipients Envelope recipients.
     * @param payload    Message bytes.
     * @return TransactionOutcome instance.
     * @throws IOException Transaction failure or unable to communicate.
     */
    public TransactionOutcome runTransaction(Transport transport, String from, List<String> recipients, byte[] payload) throws IOException {
        if (recipients == null || recipients.isEmpty()) {
            throw new SmtpException(SmtpErrorKind.INVALID_RECIPIENT, "At least one recipient is required");
        }
        long size = DotStuffingOutputStream.messageSize(payload);
        checkSize(transport.getCapabilities(), size);
        if (!transport.getState().canStartMail()) {
            throw new SmtpException(SmtpErrorKind.ILLEGAL_STATE, "MAIL not permitted in state " + transport.getState());
        }

        boolean smtpUtf8 = !isAscii(from) || recipients.stream().anyMatch(r -> !isAscii(r));
        try {
            new ClientMail(from, size, hasEightBit(payload), smtpUtf8).process(transport);

            ClientRcpt rcpt = new ClientRcpt(recipients);
            if (!rcpt.process(transport)) {
                abortQuietly(transport);
                throw new SmtpException(SmtpErrorKind.ALL_RECIPIENTS_REJECTED,
                        "All " + recipients.size() + " recipients rejected: " + rcpt.getRejected());
            }

            ClientData data = new ClientData(payload);
            data.process(transport);

            SmtpResponse response = data.getResponse();
            String serverId = parseServerId(response);
            log.debug("Message accepted by server{}: {} accepted, {} rejected",
                    serverId != null ? " as " + serverId : "", rcpt.getAccepted().size(), rcpt.getRejected().size());
            return new TransactionOutcome(rcpt.getAccepted(), rcpt.getRejected(), response, serverId);

        } catch (SmtpException e) {
            // A reply level failure inside the transaction leaves the session usable once reset.
            if (e.getSmtpCode() > 0 && e.getKind() != SmtpErrorKind.SERVER_SHUTDOWN
                    && transport.isOpen() && transport.getState().isInTransaction()) {
                abortQuietly(transport);
            }
            throw e;
        }
    }

    private void checkSize(Capabilities capabilities, long size) throws SmtpException {
        if (size > config.getMaxMessageSize()) {
            throw new SmtpException(SmtpErrorKind.MESSAGE_TOO_LARGE,
                    "Message size " + size + " exceeds configured maximum " + config.getMaxMessageSize());
        }
        if (capabilities != null && capabilities.getMaxSize() > 0 && size > capabilities.getMaxSize()) {
            throw new SmtpException(SmtpErrorKind.MESSAGE_TOO_LARGE,
                    "Message size " + size + " exceeds server maximum " + capabilities.getMaxSize());
        }
    }

    /**
     * Aborts the open transaction with RSET.
     *
     * @param transport Transport instance.
     * @throws IOException Unable to communicate.
     */
    public void abort(Transport transport) throws IOException {
        new ClientRset().process(transport);
    }

    private void abortQuietly(Transport transport) {
        try {
            abort(transport);
        } catch (IOException e) {
            log.warn("RSET after failed transaction failed: {}", e.getMessage());
        }
    }

    /**
     * Verifies an address with VRFY.
     *
     * @param transport Transport instance.
     * @param address   Address to verify.
     * @return SmtpResponse instance, 250/251 verified, 252 cannot verify.
     * @throws IOException Unable to communicate.
     */
    public SmtpResponse verify(Transport transport, String address) throws IOException {
        TransactionState state = transport.getState();
        if (!state.isOpen() || state.isInTransaction()) {
            throw new SmtpException(SmtpErrorKind.ILLEGAL_STATE, "VRFY not permitted in state " + state);
        }
        return transport.sendCommand(SmtpCommands.vrfy(address));
    }

    /**
     * Probes a connection with NOOP.
     *
     * @param transport Transport instance.
     * @return True if open and the server replied 250.
     */
    public boolean isHealthy(Transport transport) {
        if (!transport.isOpen()) {
            return false;
        }
        try {
            return new ClientNoop().process(transport);
        } catch (IOException e) {
            log.warn("Health probe failed for {}: {}", transport, e.getMessage());
            return false;
        }
    }

    /**
     * Sends QUIT best effort and closes the connection.
     *
     * @param transport Transport instance.
     */
    public void close(Transport transport) {
        new ClientQuit().process(transport);
    }

    /**
     * Extracts the server queue identifier from the final reply.
     *
     * @param response Final reply.
     * @return Identifier or null if not recognisable.
     */
    static String parseServerId(SmtpResponse response) {
        if (response == null) {
            return null;
        }
        String text = response.getMessage();
        Matcher matcher = QUEUED_AS.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        matcher = ID_TOKEN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return null;
    }

    static boolean hasEightBit(byte[] payload) {
        for (byte b : payload) {
            if (b < 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAscii(String value) {
        return value == null || StandardCharsets.US_ASCII.newEncoder().canEncode(value);
    }
}
