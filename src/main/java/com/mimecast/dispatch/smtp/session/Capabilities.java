package com.mimecast.dispatch.smtp.session;

import com.mimecast.dispatch.smtp.SmtpResponse;
import com.mimecast.dispatch.smtp.auth.AuthMethod;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ESMTP capabilities advertised in an EHLO reply.
 *
 * <p>Discarded and re-derived after a STARTTLS upgrade.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321#section-4.1.1.1">RFC 5321 Section 4.1.1.1</a>
 */
public final class Capabilities {
    private static final Logger log = LogManager.getLogger(Capabilities.class);

    private final Set<String> authMechanisms;
    private final boolean startTls;
    private final long maxSize;
    private final boolean eightBitMime;
    private final boolean pipelining;
    private final boolean smtpUtf8;
    private final boolean chunking;
    private final boolean enhancedStatusCodes;
    private final boolean dsn;
    private final List<String> raw;

    private Capabilities(Set<String> authMechanisms, boolean startTls, long maxSize, boolean eightBitMime,
                         boolean pipelining, boolean smtpUtf8, boolean chunking, boolean enhancedStatusCodes,
                         boolean dsn, List<String> raw) {
        this.authMechanisms = Collections.unmodifiableSet(authMechanisms);
        this.startTls = startTls;
        this.maxSize = maxSize;
        this.eightBitMime = eightBitMime;
        this.pipelining = pipelining;
        this.smtpUtf8 = smtpUtf8;
        this.chunking = chunking;
        this.enhancedStatusCodes = enhancedStatusCodes;
        this.dsn = dsn;
        this.raw = Collections.unmodifiableList(raw);
    }

    /**
     * Capabilities of a HELO session, nothing advertised.
     *
     * @return Capabilities instance.
     */
    public static Capabilities none() {
        return new Capabilities(new LinkedHashSet<>(), false, 0, false, false, false, false, false, false, new ArrayList<>());
    }

    /**
     * Parses an EHLO reply.
     * <p>The first line is the server greeting and carries no extension.
     *
     * @param response EHLO reply.
     * @return Capabilities instance.
     */
    public static Capabilities fromEhlo(SmtpResponse response) {
        Set<String> auth = new LinkedHashSet<>();
        boolean startTls = false;
        long maxSize = 0;
        boolean eightBitMime = false;
        boolean pipelining = false;
        boolean smtpUtf8 = false;
        boolean chunking = false;
        boolean enhanced = false;
        boolean dsn = false;
        List<String> raw = new ArrayList<>();

        List<String> lines = response.lines();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            raw.add(line);

            String[] parts = line.toUpperCase(Locale.ROOT).split("[\\s=]+");
            switch (parts[0]) {
                case "AUTH" -> {
                    for (int j = 1; j < parts.length; j++) {
                        auth.add(parts[j]);
                    }
                }
                case "STARTTLS" -> startTls = true;
                case "SIZE" -> {
                    if (parts.length > 1) {
                        try {
                            maxSize = Long.parseLong(parts[1]);
                        } catch (NumberFormatException e) {
                            log.warn("Ignoring malformed SIZE extension: {}", line);
                        }
                    }
                }
                case "8BITMIME" -> eightBitMime = true;
                case "PIPELINING" -> pipelining = true;
                case "SMTPUTF8" -> smtpUtf8 = true;
                case "CHUNKING" -> chunking = true;
                case "ENHANCEDSTATUSCODES" -> enhanced = true;
                case "DSN" -> dsn = true;
                default -> log.trace("Unhandled extension: {}", line);
            }
        }

        return new Capabilities(auth, startTls, maxSize, eightBitMime, pipelining, smtpUtf8, chunking, enhanced, dsn, raw);
    }

    /**
     * Gets advertised SASL mechanism names, uppercased.
     *
     * @return Set of names.
     */
    public Set<String> getAuthMechanisms() {
        return authMechanisms;
    }

    /**
     * Is the given mechanism advertised.
     *
     * @param method AuthMethod instance.
     * @return Boolean.
     */
    public boolean supportsAuth(AuthMethod method) {
        return authMechanisms.contains(method.getMechanism());
    }

    public boolean isStartTls() {
        return startTls;
    }

    /**
     * Gets the advertised SIZE limit.
     *
     * @return Size in bytes, 0 when not advertised or unlimited.
     */
    public long getMaxSize() {
        return maxSize;
    }

    public boolean isSizeAdvertised() {
        return raw.stream().anyMatch(l -> l.toUpperCase(Locale.ROOT).startsWith("SIZE"));
    }

    public boolean isEightBitMime() {
        return eightBitMime;
    }

    public boolean isPipelining() {
        return pipelining;
    }

    public boolean isSmtpUtf8() {
        return smtpUtf8;
    }

    public boolean isChunking() {
        return chunking;
    }

    public boolean isEnhancedStatusCodes() {
        return enhancedStatusCodes;
    }

    public boolean isDsn() {
        return dsn;
    }

    /**
     * Gets extension lines as advertised.
     *
     * @return List of lines.
     */
    public List<String> getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return "Capabilities" + raw;
    }
}
