package com.mimecast.dispatch.resilience;

import com.mimecast.dispatch.config.client.RetryConfig;
import com.mimecast.dispatch.smtp.connection.SmtpException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff retry policy.
 *
 * <p>The delay before retry n is initialDelay * multiplier^(n-1), capped at maxDelay.
 * <br>Jitter adds up to 30% on top of the capped delay.
 */
public class RetryPolicy {

    /**
     * Largest jitter as a fraction of the delay.
     */
    static final double JITTER_FACTOR = 0.3;

    private final RetryConfig config;
    private final DoubleSupplier random;

    /**
     * Constructs a new RetryPolicy instance.
     *
     * @param config RetryConfig instance.
     */
    public RetryPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Constructs a new RetryPolicy instance with a random source.
     *
     * @param config RetryConfig instance.
     * @param random Supplier of values in [0, 1).
     */
    RetryPolicy(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Gets total attempts including the first one.
     *
     * @return 1 when retries are disabled.
     */
    public int getMaxAttempts() {
        return config.isEnabled() ? config.getMaxAttempts() : 1;
    }

    /**
     * Should a failed attempt be retried.
     *
     * @param error   Failure cause.
     * @param attempt Attempt that failed, starting at 1.
     * @return Boolean.
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        return attempt < getMaxAttempts()
                && error instanceof SmtpException smtpException
                && smtpException.isRetryable();
    }

    /**
     * Gets the delay before a retry.
     *
     * @param retry Retry number, starting at 1.
     * @return Duration instance.
     */
    public Duration delayFor(int retry) {
        double delay = config.getInitialDelay().toMillis() * Math.pow(config.getMultiplier(), retry - 1);
        delay = Math.min(delay, config.getMaxDelay().toMillis());
        if (config.isJitter()) {
            delay += random.getAsDouble() * JITTER_FACTOR * delay;
        }
        return Duration.ofMillis((long) delay);
    }
}
