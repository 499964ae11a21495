package com.phillippitts.edgekeeper.domain;

import java.time.Instant;

/**
 * Immutable snapshot of host health produced once per sampling tick.
 *
 * @param cpuPercent system CPU usage (0-100)
 * @param memoryPercent physical memory usage (0-100)
 * @param diskPercent usage of the monitored file store (0-100)
 * @param temperatureCelsius CPU temperature, {@code 0.0} when no sensor is available
 * @param overheating whether the temperature reached the configured threshold
 * @param timestamp sampling time
 */
public record HealthStatus(
        double cpuPercent,
        double memoryPercent,
        double diskPercent,
        double temperatureCelsius,
        boolean overheating,
        Instant timestamp
) {

    /**
     * Builds a snapshot and derives the overheating flag. A zero reading means "no sensor"
     * and never counts as overheating.
     */
    public static HealthStatus of(double cpuPercent,
                                  double memoryPercent,
                                  double diskPercent,
                                  double temperatureCelsius,
                                  double tempThreshold,
                                  Instant timestamp) {
        boolean overheating = temperatureCelsius > 0 && temperatureCelsius >= tempThreshold;
        return new HealthStatus(cpuPercent, memoryPercent, diskPercent, temperatureCelsius,
                overheating, timestamp);
    }
}
