package com.phillippitts.edgekeeper.exception;

import com.phillippitts.edgekeeper.domain.WorkerState;

/**
 * Thrown when a worker is asked to move along an edge its state machine does not have,
 * e.g. pausing an essential worker or leaving the terminal FAILED state.
 */
public class IllegalWorkerTransitionException extends EdgeKeeperException {

    private final String workerName;
    private final WorkerState from;
    private final WorkerState to;

    public IllegalWorkerTransitionException(String workerName, WorkerState from, WorkerState to) {
        super("Illegal transition " + from + " -> " + to + " (worker: " + workerName + ")");
        this.workerName = workerName;
        this.from = from;
        this.to = to;
    }

    public String getWorkerName() {
        return workerName;
    }

    public WorkerState getFrom() {
        return from;
    }

    public WorkerState getTo() {
        return to;
    }
}
