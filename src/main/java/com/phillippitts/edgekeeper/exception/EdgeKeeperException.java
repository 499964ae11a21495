package com.phillippitts.edgekeeper.exception;

/**
 * Base exception for all EdgeKeeper runtime errors.
 * All domain exceptions extend this class so callers can handle them uniformly.
 */
public class EdgeKeeperException extends RuntimeException {

    public EdgeKeeperException(String message) {
        super(message);
    }

    public EdgeKeeperException(String message, Throwable cause) {
        super(message, cause);
    }

    public EdgeKeeperException(Throwable cause) {
        super(cause);
    }
}
