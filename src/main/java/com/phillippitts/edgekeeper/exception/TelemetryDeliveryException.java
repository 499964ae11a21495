package com.phillippitts.edgekeeper.exception;

/**
 * Transient failure while delivering a telemetry payload (connection refused, timeout,
 * collector rejected the payload). Retried with backoff and reported to the circuit breaker.
 */
public class TelemetryDeliveryException extends EdgeKeeperException {

    public TelemetryDeliveryException(String message) {
        super(message);
    }

    public TelemetryDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
