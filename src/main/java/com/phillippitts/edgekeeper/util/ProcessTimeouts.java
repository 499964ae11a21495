package com.phillippitts.edgekeeper.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and background thread management.
 *
 * <p>Used by {@link com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor} when
 * stopping workers and by the background loops when joining their threads.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time a worker gets to exit after {@link Process#destroy()} before it is killed.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Time to wait for the OS to reap a worker after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Extra time granted to a background loop on top of its interval when joining it on stop.
     */
    public static final Duration LOOP_JOIN_GRACE = Duration.ofSeconds(2);

    /**
     * Timeout for output drainer threads during cleanup (best-effort, daemon threads).
     */
    public static final Duration DRAINER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for the external signalling command ({@code kill -STOP}/{@code -CONT}).
     */
    public static final Duration SIGNAL_COMMAND_TIMEOUT = Duration.ofSeconds(2);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }

    /**
     * Join timeout for a loop that sleeps {@code interval} between passes.
     */
    public static Duration loopJoinTimeout(Duration interval) {
        return interval.plus(LOOP_JOIN_GRACE);
    }
}
