package com.phillippitts.edgekeeper.config;

import com.phillippitts.edgekeeper.config.properties.HealthProperties;
import com.phillippitts.edgekeeper.config.properties.RuntimeProperties;
import com.phillippitts.edgekeeper.config.properties.SupervisorProperties;
import com.phillippitts.edgekeeper.config.properties.TelemetryProperties;
import com.phillippitts.edgekeeper.service.health.HealthMonitor;
import com.phillippitts.edgekeeper.service.migration.LegacyBufferMigrator;
import com.phillippitts.edgekeeper.service.runtime.EdgeRuntime;
import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

/**
 * Wires the runtime glue that starts and stops everything.
 */
@Configuration
public class RuntimeConfig {

    @Bean
    public EdgeRuntime edgeRuntime(RuntimeProperties runtimeProperties,
                                   HealthProperties healthProperties,
                                   SupervisorProperties supervisorProperties,
                                   TelemetryProperties telemetryProperties,
                                   WorkerSupervisor supervisor,
                                   HealthMonitor healthMonitor,
                                   TelemetryClient telemetryClient,
                                   LegacyBufferMigrator legacyBufferMigrator,
                                   TaskScheduler taskScheduler) {
        return new EdgeRuntime(runtimeProperties, healthProperties, supervisorProperties, telemetryProperties,
                supervisor, healthMonitor, telemetryClient, legacyBufferMigrator, taskScheduler);
    }
}
