package com.mimecast.dispatch.smtp.metrics;

import com.mimecast.dispatch.smtp.auth.AuthMethod;

/**
 * Metrics sink discarding everything.
 */
public class NoopClientMetrics implements ClientMetrics {

    @Override
    public void recordSendSuccess() {
    }

    @Override
    public void recordSendFailure() {
    }

    @Override
    public void recordAuthSuccess(AuthMethod method) {
    }

    @Override
    public void recordAuthFailure(AuthMethod method) {
    }

    @Override
    public void recordTlsUpgrade() {
    }

    @Override
    public void recordConnectionCreated() {
    }

    @Override
    public void recordRetry() {
    }

    @Override
    public void recordCircuitOpenRejection() {
    }

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
