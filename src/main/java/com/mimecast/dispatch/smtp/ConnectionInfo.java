package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.smtp.session.Capabilities;

/**
 * Connectivity probe snapshot.
 *
 * @param host              Server host.
 * @param port              Server port.
 * @param encrypted         Is the channel encrypted.
 * @param tlsVersion        Negotiated TLS protocol or null.
 * @param capabilities      Capabilities advertised on the final greeting.
 * @param banner            Banner text.
 * @param authenticatedUser Authenticated identity, null without credentials or on authentication failure.
 */
public record ConnectionInfo(String host,
                             int port,
                             boolean encrypted,
                             String tlsVersion,
                             Capabilities capabilities,
                             String banner,
                             String authenticatedUser) {
}
