/**
 * TLS socket creation for STARTTLS and implicit TLS.
 *
 * <p>{@link com.mimecast.dispatch.smtp.security.DefaultTLSSocket} enforces the minimum protocol version,
 * <br>sets SNI and enables hostname verification when certificates are verified.
 */
package com.mimecast.dispatch.smtp.security;
