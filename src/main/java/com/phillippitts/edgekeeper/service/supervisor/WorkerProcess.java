package com.phillippitts.edgekeeper.service.supervisor;

import com.phillippitts.edgekeeper.domain.WorkerState;
import com.phillippitts.edgekeeper.domain.WorkerStatus;
import com.phillippitts.edgekeeper.exception.IllegalWorkerTransitionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One supervised worker: its definition plus mutable runtime state.
 *
 * <p>Mutated only by {@link WorkerSupervisor} while it holds its table lock. Every state change
 * goes through {@link #transitionTo(WorkerState)}; the process handle is attached when the
 * worker enters RUNNING and released when it enters STOPPED or FAILED.
 */
final class WorkerProcess {

    private final String name;
    private final List<String> command;
    private final boolean essential;
    private final int maxRestarts;
    private final boolean heartbeatEnabled;
    private final Path heartbeatFile;
    private final Path stopSignalFile;

    private WorkerState state = WorkerState.STOPPED;
    private int restartCount;
    private Process process;
    private final List<Thread> drainers = new ArrayList<>(2);

    WorkerProcess(String name,
                  List<String> command,
                  boolean essential,
                  int maxRestarts,
                  boolean heartbeatEnabled,
                  Path heartbeatFile,
                  Path stopSignalFile) {
        this.name = Objects.requireNonNull(name, "name");
        this.command = List.copyOf(command);
        this.essential = essential;
        this.maxRestarts = maxRestarts;
        this.heartbeatEnabled = heartbeatEnabled;
        this.heartbeatFile = heartbeatEnabled ? heartbeatFile : null;
        this.stopSignalFile = stopSignalFile;
    }

    /**
     * Moves the worker to {@code target}.
     *
     * @throws IllegalWorkerTransitionException if the edge does not exist or would pause an
     *         essential worker
     */
    void transitionTo(WorkerState target) {
        if (!state.canTransitionTo(target) || (essential && target == WorkerState.PAUSED)) {
            throw new IllegalWorkerTransitionException(name, state, target);
        }
        state = target;
    }

    void markRunning(Process started, List<Thread> outputDrainers) {
        transitionTo(WorkerState.RUNNING);
        process = started;
        drainers.clear();
        drainers.addAll(outputDrainers);
    }

    void markStopped() {
        transitionTo(WorkerState.STOPPED);
        release();
    }

    void markFailed() {
        transitionTo(WorkerState.FAILED);
        release();
    }

    private void release() {
        process = null;
        drainers.clear();
    }

    int incrementRestarts() {
        return ++restartCount;
    }

    boolean restartCeilingReached() {
        return restartCount >= maxRestarts;
    }

    WorkerStatus snapshot() {
        return new WorkerStatus(state, pid(), restartCount, essential);
    }

    /** True while the attached process handle is still alive. */
    boolean hasLiveProcess() {
        Process p = process;
        return p != null && p.isAlive();
    }

    Long pid() {
        Process p = process;
        return p == null ? null : p.pid();
    }

    String name() {
        return name;
    }

    List<String> command() {
        return command;
    }

    boolean essential() {
        return essential;
    }

    int maxRestarts() {
        return maxRestarts;
    }

    boolean heartbeatEnabled() {
        return heartbeatEnabled;
    }

    /** Heartbeat marker, or null when heartbeat is disabled. */
    Path heartbeatFile() {
        return heartbeatFile;
    }

    Path stopSignalFile() {
        return stopSignalFile;
    }

    WorkerState state() {
        return state;
    }

    int restartCount() {
        return restartCount;
    }

    Process process() {
        return process;
    }

    List<Thread> drainers() {
        return List.copyOf(drainers);
    }
}
