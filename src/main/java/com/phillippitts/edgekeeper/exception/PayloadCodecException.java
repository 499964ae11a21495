package com.phillippitts.edgekeeper.exception;

/**
 * Thrown when a persisted telemetry record cannot be decoded back into a payload.
 */
public class PayloadCodecException extends EdgeKeeperException {

    public PayloadCodecException(String message) {
        super(message);
    }

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
