package com.phillippitts.edgekeeper.service.supervisor.event;

import java.time.Instant;

/**
 * Published when a worker reaches its restart ceiling (or cannot be respawned) and enters the
 * terminal FAILED state.
 */
public record WorkerFailedEvent(
        String worker,
        int restartCount,
        String reason,
        Instant at
) {
    public WorkerFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
