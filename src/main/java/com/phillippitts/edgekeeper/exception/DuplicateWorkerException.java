package com.phillippitts.edgekeeper.exception;

/**
 * Thrown when a worker is registered under a name that is already taken.
 */
public class DuplicateWorkerException extends EdgeKeeperException {

    private final String workerName;

    public DuplicateWorkerException(String workerName) {
        super("Worker '" + workerName + "' is already registered");
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
