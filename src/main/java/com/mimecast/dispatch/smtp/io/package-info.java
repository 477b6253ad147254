/**
 * Handles the low-level input and output streams for SMTP communication.
 *
 * <p>The following streams are available:
 * <ul>
 *     <li>{@link com.mimecast.dispatch.smtp.io.LineInputStream} - Reads reply lines from the socket.</li>
 *     <li>{@link com.mimecast.dispatch.smtp.io.DotStuffingOutputStream} - Dot-stuffs the payload and writes the end of data marker.</li>
 * </ul>
 */
package com.mimecast.dispatch.smtp.io;
