package com.mimecast.dispatch.trust;

import javax.net.ssl.X509TrustManager;
import java.security.cert.X509Certificate;

/**
 * Trust manager accepting any certificate.
 * <p>Only handed out when certificate verification is disabled in a test build.
 */
public class PermissiveTrustManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        // Accept all.
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        // Accept all.
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }
}
