/**
 * SMTP client façade, protocol engine and wire model.
 *
 * <p>The {@link com.mimecast.dispatch.smtp.ProtocolEngine} drives one connection through
 * <br>banner, EHLO, STARTTLS with re-greeting, AUTH and the MAIL, RCPT, DATA transaction.
 * <br>Recipient rejections are collected, not raised, unless every recipient is rejected.
 *
 * <p>The {@link com.mimecast.dispatch.smtp.SmtpClient} wraps the engine with pooling, rate limiting,
 * <br>circuit breaking and retry, and exposes single, raw and batch sends plus a connectivity probe.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321">RFC 5321 - SMTP</a>
 */
package com.mimecast.dispatch.smtp;
