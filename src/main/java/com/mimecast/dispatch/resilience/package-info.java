/**
 * Failure handling around a send.
 *
 * <p>Applied in this order:
 * <ol>
 *     <li>{@link com.mimecast.dispatch.resilience.RateLimiter} - admission before any I/O</li>
 *     <li>{@link com.mimecast.dispatch.resilience.CircuitBreaker} - fail fast while the destination is down</li>
 *     <li>{@link com.mimecast.dispatch.resilience.RetryPolicy} - exponential backoff with jitter</li>
 * </ol>
 */
package com.mimecast.dispatch.resilience;
