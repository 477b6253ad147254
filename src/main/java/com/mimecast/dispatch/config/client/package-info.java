/**
 * SMTP client configuration.
 *
 * <p>{@link com.mimecast.dispatch.config.client.SmtpConfig} is the root; each sub-object has its own typed view:
 * <ul>
 *     <li><b>tls</b>: {@link com.mimecast.dispatch.config.client.TlsConfig}</li>
 *     <li><b>pool</b>: {@link com.mimecast.dispatch.config.client.PoolConfig}</li>
 *     <li><b>retry</b>: {@link com.mimecast.dispatch.config.client.RetryConfig}</li>
 *     <li><b>circuitBreaker</b>: {@link com.mimecast.dispatch.config.client.CircuitBreakerConfig}</li>
 *     <li><b>rateLimit</b>: {@link com.mimecast.dispatch.config.client.RateLimitConfig}</li>
 * </ul>
 *
 * <p>Durations are whole seconds unless the key documents milliseconds.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   host: "smtp.example.com",
 *   port: 587,
 *   tls: { mode: "starttls_required", minVersion: "TLSv1.2" },
 *   pool: { maxConnections: 10, acquireTimeout: 30 },
 *   retry: { maxAttempts: 3, initialDelay: 500 }
 * }
 * </pre>
 */
package com.mimecast.dispatch.config.client;
