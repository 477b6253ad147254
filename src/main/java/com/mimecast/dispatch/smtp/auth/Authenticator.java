package com.mimecast.dispatch.smtp.auth;

import com.mimecast.dispatch.smtp.SmtpCommands;
import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.SmtpResponses;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.session.Capabilities;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;

/**
 * SASL mechanism selection and exchange.
 *
 * <p>Selection intersects the advertised mechanisms with the ones the credentials support,
 * <br>drops mechanisms sending a plaintext secret over an unencrypted channel unless explicitly permitted,
 * <br>and picks the strongest remaining one. The order is stable for a given input.
 * <p>A pinned mechanism must be advertised and usable or selection fails.
 * <p>Any non-success reply ends the exchange with an authentication error; there is no fallback to another mechanism.
 */
public class Authenticator {
    private static final Logger log = LogManager.getLogger(Authenticator.class);

    /**
     * Most 334 challenges answered in one exchange.
     */
    private static final int MAX_CHALLENGES = 5;

    private final AuthMethod pinned;
    private final boolean allowPlaintextAuth;
    private final String host;
    private final int port;

    /**
     * Constructs a new Authenticator instance.
     *
     * @param pinned             Pinned mechanism or null to negotiate.
     * @param allowPlaintextAuth Permit PLAIN/LOGIN without TLS.
     * @param host               Server host used by OAUTHBEARER.
     * @param port               Server port used by OAUTHBEARER.
     */
    public Authenticator(AuthMethod pinned, boolean allowPlaintextAuth, String host, int port) {
        this.pinned = pinned;
        this.allowPlaintextAuth = allowPlaintextAuth;
        this.host = host;
        this.port = port;
    }

    /**
     * Selects a mechanism.
     *
     * @param capabilities Negotiated capabilities.
     * @param credentials  Credentials instance.
     * @param encrypted    Is the channel encrypted.
     * @return AuthMethod instance.
     * @throws SmtpException No usable mechanism.
     */
    public AuthMethod select(Capabilities capabilities, Credentials credentials, boolean encrypted) throws SmtpException {
        Set<String> advertised = capabilities != null ? capabilities.getAuthMechanisms() : Set.of();
        if (advertised.isEmpty()) {
            throw new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED, "Server does not advertise AUTH");
        }
        Set<AuthMethod> supported = credentials.getSupportedMethods();

        if (pinned != null) {
            if (!advertised.contains(pinned.getMechanism())) {
                throw new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED,
                        "Pinned mechanism " + pinned.getMechanism() + " not advertised, server offers " + advertised);
            }
            if (!supported.contains(pinned)) {
                throw new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED,
                        "Pinned mechanism " + pinned.getMechanism() + " not usable with " + credentials.getClass().getSimpleName() + " credentials");
            }
            if (!isChannelAcceptable(pinned, encrypted)) {
                throw new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED,
                        "Pinned mechanism " + pinned.getMechanism() + " requires an encrypted channel");
            }
            return pinned;
        }

        Optional<AuthMethod> selected = Arrays.stream(AuthMethod.values())
                .sorted(Comparator.comparingInt(AuthMethod::getPriority).reversed())
                .filter(m -> advertised.contains(m.getMechanism()))
                .filter(supported::contains)
                .filter(m -> isChannelAcceptable(m, encrypted))
                .findFirst();

        return selected.orElseThrow(() -> new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED,
                "No usable mechanism among " + advertised + (encrypted ? "" : " over a plaintext channel")));
    }

    private boolean isChannelAcceptable(AuthMethod method, boolean encrypted) {
        return !method.isRequiresTls() || encrypted || allowPlaintextAuth;
    }

    /**
     * Builds the mechanism implementation.
     *
     * @param method      AuthMethod instance.
     * @param credentials Credentials instance.
     * @return SaslMechanism instance.
     * @throws SmtpException Credentials do not fit the mechanism.
     */
    public SaslMechanism mechanism(AuthMethod method, Credentials credentials) throws SmtpException {
        if (credentials instanceof Credentials.Plain plain) {
            switch (method) {
                case PLAIN:
                    return new Plain(plain.username(), plain.password());
                case LOGIN:
                    return new Login(plain.username(), plain.password());
                case CRAM_MD5:
                    return new CramMd5(plain.username(), plain.password());
                default:
                    break;
            }
        } else if (credentials instanceof Credentials.XOAuth2 xoauth2 && method == AuthMethod.XOAUTH2) {
            return new XOAuth2(xoauth2.username(), xoauth2.token());
        } else if (credentials instanceof Credentials.OAuthBearer bearer && method == AuthMethod.OAUTHBEARER) {
            return new OAuthBearer(bearer.token(), host, port);
        }
        throw new SmtpException(SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED,
                method.getMechanism() + " not usable with " + credentials.getClass().getSimpleName() + " credentials");
    }

    /**
     * Selects a mechanism and runs its exchange.
     *
     * @param transport   Transport instance.
     * @param credentials Credentials instance.
     * @return Mechanism used.
     * @throws IOException Authentication failed or unable to communicate.
     */
    public AuthMethod authenticate(Transport transport, Credentials credentials) throws IOException {
        AuthMethod method = select(transport.getCapabilities(), credentials, transport.isEncrypted());
        exchange(transport, mechanism(method, credentials));
        return method;
    }

    /**
     * Runs the AUTH command and its challenge/response sequence.
     *
     * @param transport Transport instance.
     * @param mechanism SaslMechanism instance.
     * @throws IOException Authentication failed or unable to communicate.
     */
    public void exchange(Transport transport, SaslMechanism mechanism) throws IOException {
        String name = mechanism.getMethod().getMechanism();
        log.debug("Authenticating with {}", name);

        SmtpResponse response = transport.sendCommand(SmtpCommands.auth(name, mechanism.getInitialResponse()));
        int challenges = 0;
        while (response.code() == SmtpResponses.AUTH_CONTINUE_334) {
            if (++challenges > MAX_CHALLENGES) {
                throw new SmtpException(SmtpErrorKind.AUTHENTICATION_FAILED,
                        name + " exceeded " + MAX_CHALLENGES + " challenges", response.code(), response.enhancedCode(), null);
            }
            response = transport.sendCommand(mechanism.evaluateChallenge(response.getFirstLine()));
        }

        if (response.code() != SmtpResponses.AUTH_SUCCESS_235) {
            throw failure(name, response);
        }
        log.debug("Authenticated with {}", name);
    }

    private static SmtpException failure(String mechanism, SmtpResponse response) {
        SmtpErrorKind kind = switch (response.code()) {
            case 421 -> SmtpErrorKind.SERVER_SHUTDOWN;
            case 534, 535 -> SmtpErrorKind.CREDENTIALS_INVALID;
            case 504 -> SmtpErrorKind.AUTH_METHOD_NOT_SUPPORTED;
            case 530 -> SmtpErrorKind.AUTHENTICATION_REQUIRED;
            default -> SmtpErrorKind.AUTHENTICATION_FAILED;
        };
        return new SmtpException(kind, mechanism + " authentication failed: " + response,
                response.code(), response.enhancedCode(), null);
    }
}
