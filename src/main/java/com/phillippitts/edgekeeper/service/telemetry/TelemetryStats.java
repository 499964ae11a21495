package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.service.resilience.CircuitState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the telemetry channel.
 */
public record TelemetryStats(
        String deviceId,
        String endpoint,
        CircuitState circuitState,
        long bufferedCount,
        String bufferPath,
        long sentOk,
        long sendFailed,
        long circuitOpen,
        long buffered,
        long flushed
) {

    /**
     * Flat view used inside telemetry events.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("device_id", deviceId);
        map.put("endpoint", endpoint);
        map.put("circuit_state", circuitState.name());
        map.put("buffered_count", bufferedCount);
        map.put("buffer_path", bufferPath);
        map.put("sent_ok", sentOk);
        map.put("send_failed", sendFailed);
        map.put("circuit_open", circuitOpen);
        map.put("buffered", buffered);
        map.put("flushed", flushed);
        return map;
    }
}
