package com.mimecast.dispatch.resilience;

import com.mimecast.dispatch.config.client.CircuitBreakerConfig;
import com.mimecast.dispatch.config.client.RateLimitConfig;
import com.mimecast.dispatch.config.client.RetryConfig;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.metrics.MicrometerClientMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceOrchestratorTest {

    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private MicrometerClientMetrics metrics;
    private RateLimiter limiter;
    private CircuitBreaker breaker;
    private ResilienceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new MutableClock();
        metrics = new MicrometerClientMetrics(new SimpleMeterRegistry());
        limiter = new RateLimiter(new RateLimitConfig(Map.of("enabled", true, "maxEmails", 100)), clock);
        breaker = new CircuitBreaker(new CircuitBreakerConfig(Map.of("failureThreshold", 2, "recoveryTimeout", 30)), clock);
        RetryPolicy retry = new RetryPolicy(new RetryConfig(Map.of("maxAttempts", 3, "initialDelay", 10, "jitter", false)));
        orchestrator = new ResilienceOrchestrator(limiter, breaker, retry, scheduler, metrics);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static SmtpException busy() {
        return new SmtpException(SmtpErrorKind.SERVER_SHUTDOWN, "421 busy", 421, "4.3.2", null);
    }

    @Test
    void testFirstAttemptSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = orchestrator.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }).get(5, TimeUnit.SECONDS);

        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertEquals(0, metrics.snapshot().retries());
        assertEquals(0, limiter.getInFlight());
        assertEquals(1, limiter.getAdmittedInWindow());
    }

    @Test
    void testRetriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = orchestrator.execute(() -> calls.incrementAndGet() < 2
                ? CompletableFuture.<String>failedFuture(busy())
                : CompletableFuture.completedFuture("ok")).get(5, TimeUnit.SECONDS);

        assertEquals("ok", result);
        assertEquals(2, calls.get());
        assertEquals(1, metrics.snapshot().retries());
        assertEquals(CircuitState.CLOSED, breaker.getState());
        // One logical send consumes one rate limit admission.
        assertEquals(1, limiter.getAdmittedInWindow());
    }

    @Test
    void testStopsAtMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        ResilienceOrchestrator lenient = new ResilienceOrchestrator(limiter,
                new CircuitBreaker(new CircuitBreakerConfig(Map.of("enabled", false)), clock),
                new RetryPolicy(new RetryConfig(Map.of("maxAttempts", 3, "initialDelay", 10, "jitter", false))),
                scheduler, metrics);

        CompletableFuture<String> future = lenient.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(busy());
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.SERVER_SHUTDOWN, ((SmtpException) e.getCause()).getKind());
        assertEquals(3, calls.get());
        assertEquals(2, metrics.snapshot().retries());
    }

    @Test
    void testNonRetryableFailsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> future = orchestrator.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new SmtpException(SmtpErrorKind.CREDENTIALS_INVALID, "535"));
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.CREDENTIALS_INVALID, ((SmtpException) e.getCause()).getKind());
        assertEquals(1, calls.get());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testOpenCircuitSkipsOperation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> first = orchestrator.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(busy());
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.CIRCUIT_BREAKER_OPEN, ((SmtpException) e.getCause()).getKind());
        assertEquals(2, calls.get());
        assertEquals(CircuitState.OPEN, breaker.getState());

        CompletableFuture<String> second = orchestrator.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });
        e = assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.CIRCUIT_BREAKER_OPEN, ((SmtpException) e.getCause()).getKind());
        assertEquals(2, calls.get());
        assertEquals(2, metrics.snapshot().circuitOpenRejections());

        orchestrator.reset();
        assertEquals("ok", orchestrator.execute(() -> CompletableFuture.completedFuture("ok")).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testRateLimitRejectionSkipsOperation() {
        RateLimiter strict = new RateLimiter(new RateLimitConfig(Map.of("enabled", true, "maxEmails", 0)), clock);
        ResilienceOrchestrator limited = new ResilienceOrchestrator(strict, breaker,
                new RetryPolicy(new RetryConfig(Map.of())), scheduler, metrics);
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> future = limited.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.LOCAL_RATE_LIMIT_EXCEEDED, ((SmtpException) e.getCause()).getKind());
        assertEquals(0, calls.get());
    }

    @Test
    void testSupplierExceptionIsFailure() {
        CompletableFuture<String> future = orchestrator.execute(() -> {
            throw new IllegalStateException("boom");
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testCancellationPropagates() throws Exception {
        CompletableFuture<String> inFlight = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> future = orchestrator.execute(() -> {
            calls.incrementAndGet();
            return inFlight;
        });
        assertEquals(1, calls.get());

        future.cancel(true);

        assertTrue(inFlight.isCancelled());
        assertEquals(1, calls.get());
        assertEquals(0, limiter.getInFlight());
    }

    @Test
    void testUnwrap() {
        IllegalStateException cause = new IllegalStateException("x");
        assertSame(cause, ResilienceOrchestrator.unwrap(new CompletionException(new ExecutionException(cause))));
        assertSame(cause, ResilienceOrchestrator.unwrap(cause));
    }
}
