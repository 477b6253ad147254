/**
 * SMTP submission client library.
 *
 * <p>The {@link com.mimecast.dispatch.smtp.SmtpClient} is the entry point.
 * <br>It composes a bounded connection pool, a resilience layer and the protocol engine.
 */
package com.mimecast.dispatch;
