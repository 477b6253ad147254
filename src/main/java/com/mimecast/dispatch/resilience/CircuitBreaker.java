package com.mimecast.dispatch.resilience;

import com.mimecast.dispatch.config.client.CircuitBreakerConfig;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Circuit breaker shared by every send against one destination.
 *
 * <p>Backed by a resilience4j time based state machine:
 * <ul>
 *     <li>Closed opens once the last failure window holds at least failure threshold calls, all of them counted failures.</li>
 *     <li>Open rejects every call until the recovery timeout elapses, then turns half open.</li>
 *     <li>Half open lets at most success threshold trial calls through;
 *     that many successes close it again and any counted failure reopens it.</li>
 * </ul>
 * <p>Only failures pointing at an unavailable destination are counted.
 * <br>Anything else is ignored and hands back its permission, so a rejected recipient
 * <br>or bad credentials never move the breaker.
 */
public class CircuitBreaker {
    private static final Logger log = LogManager.getLogger(CircuitBreaker.class);

    private static final Set<SmtpErrorKind> COUNTED = EnumSet.of(
            SmtpErrorKind.CONNECTION_REFUSED,
            SmtpErrorKind.CONNECTION_TIMEOUT,
            SmtpErrorKind.CONNECTION_RESET,
            SmtpErrorKind.SERVER_SHUTDOWN,
            SmtpErrorKind.READ_TIMEOUT,
            SmtpErrorKind.WRITE_TIMEOUT,
            SmtpErrorKind.COMMAND_TIMEOUT
    );

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private volatile Instant openedAt;

    /**
     * Constructs a new CircuitBreaker instance.
     *
     * @param config CircuitBreakerConfig instance.
     * @param clock  Clock instance.
     */
    public CircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        io.github.resilience4j.circuitbreaker.CircuitBreakerConfig breakerConfig =
                io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.custom()
                        .slidingWindowType(io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
                        .slidingWindowSize(Math.toIntExact(config.getFailureWindow().getSeconds()))
                        .minimumNumberOfCalls(config.getFailureThreshold())
                        .failureRateThreshold(100)
                        .waitDurationInOpenState(config.getRecoveryTimeout())
                        .permittedNumberOfCallsInHalfOpenState(config.getSuccessThreshold())
                        .recordException(CircuitBreaker::isCounted)
                        .ignoreException(error -> !isCounted(error))
                        .build();

        this.delegate = new CircuitBreakerStateMachine("smtp", breakerConfig, clock);
        this.delegate.getEventPublisher().onStateTransition(event -> {
            io.github.resilience4j.circuitbreaker.CircuitBreaker.StateTransition transition = event.getStateTransition();
            if (transition.getToState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.OPEN) {
                openedAt = clock.instant();
            }
            log.info("Circuit breaker {} -> {} (failed calls: {})", transition.getFromState(), transition.getToState(),
                    delegate.getMetrics().getNumberOfFailedCalls());
        });
    }

    /**
     * Asks permission for one call.
     * <p>Every permitted call must be followed by {@link #onSuccess()} or {@link #onFailure(Throwable)}.
     *
     * @return True if the call may proceed.
     */
    public synchronized boolean tryAcquire() {
        if (!config.isEnabled()) {
            return true;
        }
        currentState();
        return delegate.tryAcquirePermission();
    }

    /**
     * Records a successful call.
     */
    public synchronized void onSuccess() {
        if (!config.isEnabled()) {
            return;
        }
        delegate.onSuccess(0, TimeUnit.MILLISECONDS);
    }

    /**
     * Records a failed call.
     *
     * @param error Failure cause.
     */
    public synchronized void onFailure(Throwable error) {
        if (!config.isEnabled()) {
            return;
        }
        Throwable cause = error != null ? error : new IllegalStateException("Unknown failure");
        delegate.onError(0, TimeUnit.MILLISECONDS, cause);

        // One failed trial is enough to give up on recovery.
        if (isCounted(cause) && delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.HALF_OPEN) {
            delegate.transitionToOpenState();
        }
    }

    /**
     * Gets state, moving from open to half open once the recovery timeout elapsed.
     *
     * @return CircuitState instance.
     */
    public synchronized CircuitState getState() {
        if (!config.isEnabled()) {
            return CircuitState.CLOSED;
        }
        return currentState();
    }

    /**
     * Forces the breaker closed and clears counters.
     */
    public synchronized void reset() {
        if (delegate.getState() != io.github.resilience4j.circuitbreaker.CircuitBreaker.State.CLOSED) {
            log.info("Circuit breaker reset from {}", delegate.getState());
        }
        delegate.reset();
        openedAt = null;
    }

    /**
     * Gets counted failures in the current window.
     *
     * @return Integer.
     */
    public synchronized int getFailureCount() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }

    /**
     * Does this failure count towards opening the circuit.
     *
     * @param error Failure cause.
     * @return Boolean.
     */
    public static boolean isCounted(Throwable error) {
        return error instanceof SmtpException smtpException && COUNTED.contains(smtpException.getKind());
    }

    private CircuitState currentState() {
        if (delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.OPEN
                && openedAt != null
                && Duration.between(openedAt, clock.instant()).compareTo(config.getRecoveryTimeout()) >= 0) {
            delegate.transitionToHalfOpenState();
        }

        switch (delegate.getState()) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }
}
