/**
 * Client side SMTP verb processors.
 *
 * <p>Each processor drives one verb over a {@link com.mimecast.dispatch.smtp.connection.Transport}
 * <br>and moves the session state on success.
 */
package com.mimecast.dispatch.smtp.extension.client;
