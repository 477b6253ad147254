package com.mimecast.dispatch.smtp.metrics;

import com.mimecast.dispatch.smtp.auth.AuthMethod;

/**
 * Client metrics sink.
 *
 * <p>Recording is fire-and-forget: implementations must never throw or block the send path.
 */
public interface ClientMetrics {

    void recordSendSuccess();

    void recordSendFailure();

    void recordAuthSuccess(AuthMethod method);

    void recordAuthFailure(AuthMethod method);

    void recordTlsUpgrade();

    void recordConnectionCreated();

    void recordRetry();

    void recordCircuitOpenRejection();

    /**
     * Gets point-in-time counter values.
     *
     * @return MetricsSnapshot instance.
     */
    MetricsSnapshot snapshot();
}
