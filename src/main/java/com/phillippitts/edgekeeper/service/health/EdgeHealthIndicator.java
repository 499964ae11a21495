package com.phillippitts.edgekeeper.service.health;

import com.phillippitts.edgekeeper.service.resilience.CircuitState;
import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Actuator health indicator for the edge runtime.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: not overheating, no FAILED worker, telemetry circuit CLOSED</li>
 *   <li>DEGRADED: overheating, a worker FAILED, or the circuit not CLOSED</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
public class EdgeHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final HealthMonitor monitor;
    private final WorkerSupervisor supervisor;
    private final TelemetryClient telemetry;

    public EdgeHealthIndicator(HealthMonitor monitor, WorkerSupervisor supervisor, TelemetryClient telemetry) {
        this.monitor = monitor;
        this.supervisor = supervisor;
        this.telemetry = telemetry;
    }

    @Override
    public Health health() {
        boolean overheating = monitor.isOverheating();
        List<String> failed = supervisor.failedNames();
        CircuitState circuit = telemetry.circuitState();

        Health.Builder builder = new Health.Builder();
        if (!overheating && failed.isEmpty() && circuit == CircuitState.CLOSED) {
            builder.up();
        } else {
            builder.status(DEGRADED);
        }
        monitor.lastStatus().ifPresent(s -> builder.withDetail("temperatureCelsius", s.temperatureCelsius()));
        return builder
                .withDetail("overheating", overheating)
                .withDetail("failedWorkers", failed)
                .withDetail("circuitState", circuit.name())
                .withDetail("bufferedPayloads", telemetry.bufferedCount())
                .build();
    }
}
