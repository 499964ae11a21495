package com.phillippitts.edgekeeper.service.resilience;

/**
 * Circuit breaker states as seen by callers.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
