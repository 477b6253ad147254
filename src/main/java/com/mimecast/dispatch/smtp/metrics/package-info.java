/**
 * Client metrics sink.
 *
 * <p>{@link com.mimecast.dispatch.smtp.metrics.MicrometerClientMetrics} records to a Micrometer registry.
 */
package com.mimecast.dispatch.smtp.metrics;
