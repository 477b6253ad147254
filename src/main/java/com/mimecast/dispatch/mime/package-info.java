/**
 * Minimal MIME message model and encoder.
 *
 * <p>{@link com.mimecast.dispatch.mime.EmailBuilder} writes text, html and attachments
 * <br>as single part, multipart/alternative or multipart/mixed messages.
 */
package com.mimecast.dispatch.mime;
