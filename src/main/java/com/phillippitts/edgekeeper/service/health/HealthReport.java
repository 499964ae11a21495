package com.phillippitts.edgekeeper.service.health;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured health report: current values (null before the first sample) plus thresholds.
 */
public record HealthReport(
        String status,
        Double cpuPercent,
        Double memoryPercent,
        Double temperatureCelsius,
        Double diskUsagePercent,
        double tempThreshold,
        double cpuThreshold,
        double memoryThreshold
) {

    public static final String HEALTHY = "healthy";
    public static final String OVERHEATING = "overheating";

    public Map<String, Object> toMap() {
        Map<String, Object> thresholds = new LinkedHashMap<>();
        thresholds.put("temperature", tempThreshold);
        thresholds.put("cpu", cpuThreshold);
        thresholds.put("memory", memoryThreshold);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status);
        map.put("cpu_percent", cpuPercent);
        map.put("memory_percent", memoryPercent);
        map.put("temperature_celsius", temperatureCelsius);
        map.put("disk_usage_percent", diskUsagePercent);
        map.put("thresholds", thresholds);
        return map;
    }
}
