package com.phillippitts.edgekeeper.domain;

/**
 * Point-in-time view of one worker, as reported by the supervisor.
 *
 * @param state current lifecycle state
 * @param pid OS process id, or {@code null} when no process is held
 * @param restartCount number of deaths detected so far (monotonic)
 * @param essential whether the worker is exempt from overheat pausing
 */
public record WorkerStatus(WorkerState state, Long pid, int restartCount, boolean essential) {
}
