/**
 * Per connection SMTP session state.
 *
 * <p>{@link com.mimecast.dispatch.smtp.session.TransactionState} decides which commands are legal next.
 * <br>{@link com.mimecast.dispatch.smtp.session.Capabilities} holds the extensions advertised by EHLO.
 */
package com.mimecast.dispatch.smtp.session;
