package com.phillippitts.edgekeeper.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a supervised worker process.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * STOPPED    → RUNNING (start) | FAILED (spawn error)
 * RUNNING    → PAUSED | RESTARTING (death or zombie) | STOPPED
 * PAUSED     → RUNNING | STOPPED
 * RESTARTING → RUNNING (respawn) | FAILED (restart ceiling or spawn error) | STOPPED
 * FAILED     → (terminal)
 * </pre>
 */
public enum WorkerState {
    STOPPED,
    RUNNING,
    PAUSED,
    RESTARTING,
    FAILED;

    /**
     * Returns true if the state machine has an edge from this state to {@code target}.
     *
     * @param target requested next state
     * @return whether the edge exists
     */
    public boolean canTransitionTo(WorkerState target) {
        return successors().contains(target);
    }

    /**
     * Returns true while the worker owns an OS process handle.
     */
    public boolean holdsProcess() {
        return this == RUNNING || this == PAUSED || this == RESTARTING;
    }

    private Set<WorkerState> successors() {
        return switch (this) {
            case STOPPED -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(PAUSED, RESTARTING, STOPPED);
            case PAUSED -> EnumSet.of(RUNNING, STOPPED);
            case RESTARTING -> EnumSet.of(RUNNING, FAILED, STOPPED);
            case FAILED -> EnumSet.noneOf(WorkerState.class);
        };
    }
}
