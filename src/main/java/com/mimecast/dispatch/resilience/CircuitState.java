package com.mimecast.dispatch.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
