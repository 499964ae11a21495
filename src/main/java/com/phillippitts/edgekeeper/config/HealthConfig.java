package com.phillippitts.edgekeeper.config;

import com.phillippitts.edgekeeper.config.properties.HealthProperties;
import com.phillippitts.edgekeeper.service.health.EdgeHealthIndicator;
import com.phillippitts.edgekeeper.service.health.HealthMonitor;
import com.phillippitts.edgekeeper.service.health.HostMetricsProvider;
import com.phillippitts.edgekeeper.service.health.SystemMetricsProvider;
import com.phillippitts.edgekeeper.service.health.TemperatureReader;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires host health sampling and the actuator indicator.
 */
@Configuration
public class HealthConfig {

    @Bean
    public SystemMetricsProvider systemMetricsProvider() {
        return new HostMetricsProvider(new TemperatureReader());
    }

    @Bean
    public HealthMonitor healthMonitor(HealthProperties props,
                                       SystemMetricsProvider provider,
                                       RuntimeMetrics metrics) {
        return new HealthMonitor(props, provider, metrics);
    }

    @Bean
    public EdgeHealthIndicator edgeHealthIndicator(HealthMonitor monitor,
                                                   WorkerSupervisor supervisor,
                                                   TelemetryClient telemetryClient) {
        return new EdgeHealthIndicator(monitor, supervisor, telemetryClient);
    }
}
