/**
 * Certificate trust.
 *
 * <p>The {@link com.mimecast.dispatch.trust.TrustManager} verifies server certificates
 * <br>against the JVM trust store or a PEM bundle.
 *
 * @see com.mimecast.dispatch.trust.TrustManager
 */
package com.mimecast.dispatch.trust;
