package com.phillippitts.edgekeeper.service.health;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Source of raw host metrics sampled by {@link HealthMonitor}.
 */
public interface SystemMetricsProvider {

    /** System-wide CPU usage, 0-100. */
    double cpuPercent();

    /** Physical memory usage, 0-100. */
    double memoryPercent();

    /** Usage of the file store containing {@code path}, 0-100. */
    double diskPercent(Path path);

    /**
     * Temperature readings in degrees Celsius keyed by sensor name (e.g. {@code coretemp},
     * {@code thermal_zone0}). Empty when the host exposes no sensors.
     */
    Map<String, List<Double>> temperatures();
}
