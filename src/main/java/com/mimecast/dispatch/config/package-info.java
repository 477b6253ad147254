/**
 * Configuration foundation.
 *
 * <p>Provides the map backed {@link com.mimecast.dispatch.config.ConfigFoundation} and its JSON5 reader.
 * <br>JSON5 is read with a lenient Gson reader, so comments, single quotes and unquoted keys are accepted.
 */
package com.mimecast.dispatch.config;
