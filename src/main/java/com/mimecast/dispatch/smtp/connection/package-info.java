/**
 * SMTP transport and error taxonomy.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link com.mimecast.dispatch.smtp.connection.Transport} - One connection, sequential command/reply exchange</li>
 *   <li>{@link com.mimecast.dispatch.smtp.connection.SocketTransport} - Blocking socket implementation with in place TLS upgrade</li>
 *   <li>{@link com.mimecast.dispatch.smtp.connection.SmtpException} - Classified failures with retry eligibility</li>
 * </ul>
 *
 * <h2>Retry Eligibility</h2>
 * <ul>
 *   <li>Connection, timeout and pool failures are retryable</li>
 *   <li>Replies 421, 450, 451 and 452 are retryable</li>
 *   <li>Configuration, TLS policy, authentication and protocol failures are not</li>
 *   <li>Nothing raised after the payload transfer started is retryable</li>
 * </ul>
 *
 * @see <a href="https://tools.ietf.org/html/rfc3207">RFC 3207 - STARTTLS</a>
 */
package com.mimecast.dispatch.smtp.connection;
