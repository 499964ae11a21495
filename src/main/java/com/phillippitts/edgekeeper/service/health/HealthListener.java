package com.phillippitts.edgekeeper.service.health;

import com.phillippitts.edgekeeper.domain.HealthStatus;

/**
 * Receives overheat transitions from {@link HealthMonitor}. Called on the sampling thread.
 */
public interface HealthListener {

    /** Normal → overheating. */
    default void onOverheat(HealthStatus status) {
    }

    /** Overheating → normal. */
    default void onRecover(HealthStatus status) {
    }
}
