package com.mimecast.dispatch.smtp.metrics;

import com.mimecast.dispatch.smtp.auth.AuthMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SMTP client Micrometer metrics.
 *
 * <p>Provides counters for sends, authentication attempts per mechanism, TLS upgrades,
 * connections opened, retries and circuit breaker rejections.
 * <p>Every increment is guarded so a registry failure is logged and never reaches the send path.
 */
public class MicrometerClientMetrics implements ClientMetrics {
    private static final Logger log = LogManager.getLogger(MicrometerClientMetrics.class);

    static final String SEND = "dispatch.smtp.send";
    static final String AUTH = "dispatch.smtp.auth";
    static final String TLS_UPGRADE = "dispatch.smtp.tls.upgrade";
    static final String CONNECTION_CREATED = "dispatch.smtp.connection.created";
    static final String RETRY = "dispatch.smtp.retry";
    static final String CIRCUIT_OPEN = "dispatch.smtp.circuit.open.rejection";

    private final MeterRegistry registry;
    private final Counter sendSuccessCounter;
    private final Counter sendFailureCounter;
    private final Counter tlsUpgradeCounter;
    private final Counter connectionCreatedCounter;
    private final Counter retryCounter;
    private final Counter circuitOpenCounter;

    /**
     * Constructs a new MicrometerClientMetrics instance and registers counters with zero values.
     *
     * @param registry MeterRegistry instance.
     */
    public MicrometerClientMetrics(MeterRegistry registry) {
        this.registry = registry;

        sendSuccessCounter = Counter.builder(SEND)
                .description("Messages accepted by the server")
                .tag("result", "success")
                .register(registry);

        sendFailureCounter = Counter.builder(SEND)
                .description("Messages that failed terminally")
                .tag("result", "failure")
                .register(registry);

        tlsUpgradeCounter = Counter.builder(TLS_UPGRADE)
                .description("STARTTLS upgrades completed")
                .register(registry);

        connectionCreatedCounter = Counter.builder(CONNECTION_CREATED)
                .description("Connections opened")
                .register(registry);

        retryCounter = Counter.builder(RETRY)
                .description("Send attempts retried")
                .register(registry);

        circuitOpenCounter = Counter.builder(CIRCUIT_OPEN)
                .description("Sends rejected by an open circuit breaker")
                .register(registry);

        log.info("SMTP client metrics initialized");
    }

    @Override
    public void recordSendSuccess() {
        increment(sendSuccessCounter, "send success");
    }

    @Override
    public void recordSendFailure() {
        increment(sendFailureCounter, "send failure");
    }

    @Override
    public void recordAuthSuccess(AuthMethod method) {
        recordAuth(method, "success");
    }

    @Override
    public void recordAuthFailure(AuthMethod method) {
        recordAuth(method, "failure");
    }

    private void recordAuth(AuthMethod method, String result) {
        try {
            Counter.builder(AUTH)
                    .description("Authentication attempts")
                    .tag("mechanism", method != null ? method.getMechanism() : "NONE")
                    .tag("result", result)
                    .register(registry)
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment auth {} counter: {}", result, e.getMessage());
        }
    }

    @Override
    public void recordTlsUpgrade() {
        increment(tlsUpgradeCounter, "TLS upgrade");
    }

    @Override
    public void recordConnectionCreated() {
        increment(connectionCreatedCounter, "connection created");
    }

    @Override
    public void recordRetry() {
        increment(retryCounter, "retry");
    }

    @Override
    public void recordCircuitOpenRejection() {
        increment(circuitOpenCounter, "circuit open");
    }

    private static void increment(Counter counter, String name) {
        try {
            counter.increment();
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                (long) sendSuccessCounter.count(),
                (long) sendFailureCounter.count(),
                authCount("success"),
                authCount("failure"),
                (long) tlsUpgradeCounter.count(),
                (long) connectionCreatedCounter.count(),
                (long) retryCounter.count(),
                (long) circuitOpenCounter.count()
        );
    }

    private long authCount(String result) {
        return (long) registry.find(AUTH).tag("result", result).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
