package com.mimecast.dispatch.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Collection;

/**
 * Verifying trust manager for SMTP server certificates.
 * <p>Trusts the JVM default store, or only the PEM certificates of a configured CA bundle.
 */
public class TrustManager implements X509TrustManager {
    private static final Logger log = LogManager.getLogger(TrustManager.class);

    private final X509TrustManager delegate;

    /**
     * Constructs a new TrustManager instance.
     *
     * @param caCertPath Path to PEM CA bundle or null for the JVM default trust store.
     * @throws GeneralSecurityException If the trust store cannot be initialized.
     * @throws IOException              If the CA bundle cannot be read.
     */
    public TrustManager(String caCertPath) throws GeneralSecurityException, IOException {
        KeyStore trustStore = null;

        if (caCertPath != null && !caCertPath.isBlank()) {
            trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);

            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            try (InputStream is = Files.newInputStream(Paths.get(caCertPath))) {
                Collection<? extends Certificate> certificates = factory.generateCertificates(is);
                int i = 0;
                for (Certificate certificate : certificates) {
                    trustStore.setCertificateEntry("ca-" + i++, certificate);
                }
                log.debug("Loaded {} CA certificates from {}", i, caCertPath);
            }
        }

        // A null KeyStore selects the JVM default trust store.
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        this.delegate = Arrays.stream(tmf.getTrustManagers())
                .filter(X509TrustManager.class::isInstance)
                .map(X509TrustManager.class::cast)
                .findFirst()
                .orElseThrow(() -> new GeneralSecurityException("No X509TrustManager available"));
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        delegate.checkClientTrusted(chain, authType);
    }

    /**
     * Validates the server chain; hostname checks happen in the TLS layer.
     */
    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        delegate.checkServerTrusted(chain, authType);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return delegate.getAcceptedIssuers();
    }
}
