package com.mimecast.dispatch.resilience;

import com.mimecast.dispatch.config.client.OnLimitBehavior;
import com.mimecast.dispatch.config.client.RateLimitConfig;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Local admission control applied before any network I/O.
 *
 * <p>Caps sends per fixed window and, optionally, sends in flight at once.
 * <br>Over the limit a send is rejected, or waits on a scheduler timer until the window rolls over
 * <br>or an in flight send completes, bounded by the wait timeout when configured so.
 * <p>Every admitted send must call {@link #release()} once it completes.
 */
public class RateLimiter {
    private static final Logger log = LogManager.getLogger(RateLimiter.class);

    /**
     * Recheck interval while waiting for an in flight send to complete.
     */
    static final long IN_FLIGHT_POLL_MILLIS = 50;

    private final RateLimitConfig config;
    private final Clock clock;

    private Instant windowStart;
    private int admittedInWindow;
    private int inFlight;

    /**
     * Constructs a new RateLimiter instance.
     *
     * @param config RateLimitConfig instance.
     * @param clock  Clock instance.
     */
    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.windowStart = clock.instant();
    }

    /**
     * Tries to admit one send without waiting.
     *
     * @return 0 if admitted, otherwise a hint in milliseconds before trying again.
     */
    public synchronized long tryAcquire() {
        if (!config.isEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        Duration elapsed = Duration.between(windowStart, now);
        if (elapsed.compareTo(config.getWindow()) >= 0) {
            windowStart = now;
            admittedInWindow = 0;
            elapsed = Duration.ZERO;
        }

        Integer maxEmails = config.getMaxEmails();
        if (maxEmails != null && admittedInWindow >= maxEmails) {
            return Math.max(1, config.getWindow().minus(elapsed).toMillis());
        }
        Integer maxConnections = config.getMaxConnections();
        if (maxConnections != null && inFlight >= maxConnections) {
            return IN_FLIGHT_POLL_MILLIS;
        }

        admittedInWindow++;
        inFlight++;
        return 0;
    }

    /**
     * Admits one send, applying the configured over limit behavior.
     *
     * @param scheduler Scheduler used for waits.
     * @return Future completed on admission or failed with LOCAL_RATE_LIMIT_EXCEEDED.
     */
    public CompletableFuture<Void> acquire(ScheduledExecutorService scheduler) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        OnLimitBehavior behavior = config.getOnLimit();
        Instant deadline = behavior == OnLimitBehavior.WAIT_WITH_TIMEOUT ? clock.instant().plus(config.getWaitTimeout()) : null;
        attempt(future, behavior, deadline, scheduler);
        return future;
    }

    private void attempt(CompletableFuture<Void> future, OnLimitBehavior behavior, Instant deadline, ScheduledExecutorService scheduler) {
        if (future.isDone()) {
            return;
        }
        long wait = tryAcquire();
        if (wait == 0) {
            if (!future.complete(null)) {
                // Caller cancelled while waiting.
                release();
            }
            return;
        }

        if (behavior == OnLimitBehavior.REJECT) {
            log.warn("Rate limit exceeded, rejecting send");
            future.completeExceptionally(exceeded());
            return;
        }
        if (deadline != null) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            if (remaining <= 0) {
                log.warn("Rate limit wait timed out after {}ms", config.getWaitTimeout().toMillis());
                future.completeExceptionally(exceeded());
                return;
            }
            wait = Math.min(wait, remaining);
        }

        log.debug("Rate limit reached, waiting {}ms", wait);
        try {
            scheduler.schedule(() -> attempt(future, behavior, deadline, scheduler), wait, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new SmtpException(SmtpErrorKind.CANCELLED, "Rate limiter wait abandoned, scheduler stopped", e));
        }
    }

    private SmtpException exceeded() {
        return new SmtpException(SmtpErrorKind.LOCAL_RATE_LIMIT_EXCEEDED,
                "Local rate limit exceeded (maxEmails: " + config.getMaxEmails() +
                        ", maxConnections: " + config.getMaxConnections() + ", window: " + config.getWindow().toMillis() + "ms)");
    }

    /**
     * Releases the in flight slot of an admitted send.
     */
    public synchronized void release() {
        if (config.isEnabled() && inFlight > 0) {
            inFlight--;
        }
    }

    /**
     * Starts a fresh window.
     * <p>Sends still in flight keep their slots.
     */
    public synchronized void reset() {
        windowStart = clock.instant();
        admittedInWindow = 0;
    }

    public synchronized int getInFlight() {
        return inFlight;
    }

    public synchronized int getAdmittedInWindow() {
        return admittedInWindow;
    }
}
