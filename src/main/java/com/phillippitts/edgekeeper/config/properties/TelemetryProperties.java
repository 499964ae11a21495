package com.phillippitts.edgekeeper.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the telemetry channel, its buffer, circuit breaker and retry.
 */
@ConfigurationProperties(prefix = "edge.telemetry")
@Validated
public class TelemetryProperties {

    @NotBlank
    private String deviceId = "edge-001";

    @NotBlank
    private String endpoint = "https://localhost/telemetry";

    /** SQLite file holding undelivered payloads. */
    @NotNull
    private Path bufferPath = Path.of("data", "buffer.db");

    @Positive(message = "Max buffer rows must be positive")
    private int maxBufferRows = 10_000;

    @NotNull
    private Duration flushInterval = Duration.ofSeconds(30);

    @Positive(message = "Flush batch size must be positive")
    private int flushBatchSize = 10;

    /** Directory of legacy one-file-per-payload JSON buffers imported at startup (optional). */
    private Path legacyDir;

    @Valid
    private Circuit circuit = new Circuit();

    @Valid
    private Retry retry = new Retry();

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public Path getBufferPath() {
        return bufferPath;
    }

    public void setBufferPath(Path bufferPath) {
        this.bufferPath = bufferPath;
    }

    public int getMaxBufferRows() {
        return maxBufferRows;
    }

    public void setMaxBufferRows(int maxBufferRows) {
        this.maxBufferRows = maxBufferRows;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public int getFlushBatchSize() {
        return flushBatchSize;
    }

    public void setFlushBatchSize(int flushBatchSize) {
        this.flushBatchSize = flushBatchSize;
    }

    public Path getLegacyDir() {
        return legacyDir;
    }

    public void setLegacyDir(Path legacyDir) {
        this.legacyDir = legacyDir;
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public void setCircuit(Circuit circuit) {
        this.circuit = circuit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /** Circuit breaker guarding the collector. */
    public static class Circuit {

        /** Consecutive failures that open the circuit. */
        @Positive
        private int failureThreshold = 3;

        /** Successful half-open probes that close the circuit. */
        @Positive
        private int successThreshold = 2;

        /** Time the circuit stays open before admitting probes. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Retry {

        @Positive
        private int maxAttempts = 3;

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }
    }
}
