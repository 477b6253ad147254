package com.mimecast.dispatch.smtp.metrics;

/**
 * Point-in-time client counters.
 */
public record MetricsSnapshot(long sendSuccess,
                              long sendFailure,
                              long authSuccess,
                              long authFailure,
                              long tlsUpgrades,
                              long connectionsCreated,
                              long retries,
                              long circuitOpenRejections) {

    /**
     * Gets total completed sends.
     *
     * @return Count.
     */
    public long sendTotal() {
        return sendSuccess + sendFailure;
    }
}
