package com.phillippitts.edgekeeper.exception;

/**
 * Signals that the circuit breaker refused a delivery attempt. Never retried:
 * the payload goes straight to the local buffer.
 */
public class CircuitOpenException extends EdgeKeeperException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super("Circuit " + circuitName + " is open");
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
