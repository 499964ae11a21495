package com.phillippitts.edgekeeper.service.resilience;

/**
 * Minimal circuit breaker contract used by the telemetry send path.
 *
 * <p>Callers ask {@link #mayAttempt()} before every attempt and report the outcome of every
 * attempt they made through {@link #recordSuccess()} or {@link #recordFailure(Throwable)}.
 */
public interface CircuitBreakerGate {

    /**
     * Returns true if a call may be attempted now. May move an expired OPEN circuit to HALF_OPEN.
     */
    boolean mayAttempt();

    void recordSuccess();

    void recordFailure(Throwable error);

    CircuitState state();
}
