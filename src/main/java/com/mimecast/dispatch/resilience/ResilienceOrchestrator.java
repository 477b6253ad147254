package com.mimecast.dispatch.resilience;

import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.metrics.ClientMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Wraps one logical send with rate limiting, circuit breaking and retry.
 *
 * <p>The rate limiter admits the send once. Each attempt then asks the circuit breaker,
 * <br>and failed attempts are retried with backoff while the failure is retryable.
 * <p>This is the only layer that retries. Backoff waits are scheduler timers.
 * <p>Cancelling the returned future cancels the attempt in flight and stops further retries.
 */
public class ResilienceOrchestrator {
    private static final Logger log = LogManager.getLogger(ResilienceOrchestrator.class);

    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final ClientMetrics metrics;

    /**
     * Constructs a new ResilienceOrchestrator instance.
     *
     * @param rateLimiter    RateLimiter instance.
     * @param circuitBreaker CircuitBreaker instance.
     * @param retryPolicy    RetryPolicy instance.
     * @param scheduler      Scheduler for waits.
     * @param metrics        ClientMetrics instance.
     */
    public ResilienceOrchestrator(RateLimiter rateLimiter, CircuitBreaker circuitBreaker, RetryPolicy retryPolicy,
                                  ScheduledExecutorService scheduler, ClientMetrics metrics) {
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    /**
     * Executes an operation.
     *
     * @param operation Supplier starting one attempt.
     * @param <T>       Result type.
     * @return Future with the first successful result or the terminal failure.
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> admission = rateLimiter.acquire(scheduler);

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                admission.cancel(false);
            }
        });

        admission.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            result.whenComplete((value, failure) -> rateLimiter.release());
            attempt(operation, 1, result);
        });
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }
        if (!circuitBreaker.tryAcquire()) {
            metrics.recordCircuitOpenRejection();
            log.warn("Circuit breaker {}, failing fast", circuitBreaker.getState());
            result.completeExceptionally(new SmtpException(SmtpErrorKind.CIRCUIT_BREAKER_OPEN,
                    "Circuit breaker is " + circuitBreaker.getState() + ", not attempting delivery"));
            return;
        }

        CompletableFuture<T> current;
        try {
            current = operation.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> inFlight = current;
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                inFlight.cancel(true);
            }
        });

        inFlight.whenComplete((value, error) -> {
            if (error == null) {
                circuitBreaker.onSuccess();
                result.complete(value);
                return;
            }

            Throwable cause = unwrap(error);
            circuitBreaker.onFailure(cause);
            if (!result.isDone() && retryPolicy.shouldRetry(cause, attempt)) {
                Duration delay = retryPolicy.delayFor(attempt);
                metrics.recordRetry();
                log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, retryPolicy.getMaxAttempts(), cause.getMessage(), delay.toMillis());
                try {
                    scheduler.schedule(() -> attempt(operation, attempt + 1, result), delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    result.completeExceptionally(cause);
                }
            } else {
                result.completeExceptionally(cause);
            }
        });
    }

    /**
     * Resets the circuit breaker and the rate limiter window.
     */
    public void reset() {
        circuitBreaker.reset();
        rateLimiter.reset();
        log.info("Resilience state reset");
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * Unwraps CompletableFuture wrappers.
     *
     * @param error Throwable instance.
     * @return Cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
