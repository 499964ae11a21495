package com.phillippitts.edgekeeper.config;

import com.phillippitts.edgekeeper.config.properties.TelemetryProperties;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.migration.LegacyBufferMigrator;
import com.phillippitts.edgekeeper.service.resilience.CircuitBreakerGate;
import com.phillippitts.edgekeeper.service.resilience.Resilience4jCircuitBreakerGate;
import com.phillippitts.edgekeeper.service.telemetry.LoggingTransport;
import com.phillippitts.edgekeeper.service.telemetry.RetryBackoff;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryBuffer;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryClient;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the telemetry channel: buffer, circuit breaker, transport and client.
 *
 * <p>The transport only logs; a network transport is plugged in by replacing
 * {@link #telemetryTransport()}.
 */
@Configuration
public class TelemetryConfig {

    private final TelemetryProperties props;

    public TelemetryConfig(TelemetryProperties props) {
        this.props = props;
    }

    /**
     * Closed by {@link TelemetryClient#stop()} when the runtime stops; closing twice is harmless.
     */
    @Bean(destroyMethod = "close")
    public TelemetryBuffer telemetryBuffer() {
        return new TelemetryBuffer(props.getBufferPath(), props.getMaxBufferRows());
    }

    @Bean
    public CircuitBreakerGate telemetryCircuitBreaker() {
        TelemetryProperties.Circuit circuit = props.getCircuit();
        return new Resilience4jCircuitBreakerGate("telemetry-" + props.getDeviceId(),
                circuit.getFailureThreshold(), circuit.getSuccessThreshold(), circuit.getTimeout());
    }

    @Bean
    public TelemetryTransport telemetryTransport() {
        return new LoggingTransport(props.getEndpoint());
    }

    @Bean
    public TelemetryClient telemetryClient(TelemetryBuffer buffer,
                                           TelemetryTransport transport,
                                           CircuitBreakerGate telemetryCircuitBreaker,
                                           RuntimeMetrics metrics) {
        TelemetryProperties.Retry retry = props.getRetry();
        return new TelemetryClient(props.getDeviceId(), props.getEndpoint(), buffer, transport,
                telemetryCircuitBreaker, metrics,
                new RetryBackoff(retry.getMaxAttempts(), retry.getInitialDelay()),
                props.getFlushInterval(), props.getFlushBatchSize());
    }

    @Bean
    public LegacyBufferMigrator legacyBufferMigrator(TelemetryBuffer buffer) {
        return new LegacyBufferMigrator(buffer, props.getDeviceId(),
                LegacyBufferMigrator.defaultQuarantineDir(props.getBufferPath()));
    }
}
