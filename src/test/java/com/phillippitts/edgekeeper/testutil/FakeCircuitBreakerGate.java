package com.phillippitts.edgekeeper.testutil;

import com.phillippitts.edgekeeper.service.resilience.CircuitBreakerGate;
import com.phillippitts.edgekeeper.service.resilience.CircuitState;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Circuit breaker whose state is set by the test. Admits calls unless OPEN and counts outcomes.
 */
public class FakeCircuitBreakerGate implements CircuitBreakerGate {

    private volatile CircuitState state = CircuitState.CLOSED;
    private final AtomicInteger successes = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();

    public void setState(CircuitState state) {
        this.state = state;
    }

    @Override
    public boolean mayAttempt() {
        return state != CircuitState.OPEN;
    }

    @Override
    public void recordSuccess() {
        successes.incrementAndGet();
    }

    @Override
    public void recordFailure(Throwable error) {
        failures.incrementAndGet();
    }

    @Override
    public CircuitState state() {
        return state;
    }

    public int successes() {
        return successes.get();
    }

    public int failures() {
        return failures.get();
    }
}
