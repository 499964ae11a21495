package com.phillippitts.edgekeeper.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed properties for host health sampling.
 */
@Validated
@ConfigurationProperties(prefix = "edge.health")
public class HealthProperties {

    private final boolean enabled;

    @NotNull
    private final Duration interval;

    /** Overheat threshold in degrees Celsius (inclusive). */
    @DecimalMin(value = "0.0", inclusive = false)
    private final double tempThreshold;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double cpuThreshold;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double memoryThreshold;

    /** File system whose usage is reported as disk percent. */
    @NotNull
    private final Path diskPath;

    @ConstructorBinding
    public HealthProperties(Boolean enabled,
                            Duration interval,
                            Double tempThreshold,
                            Double cpuThreshold,
                            Double memoryThreshold,
                            Path diskPath) {
        this.enabled = enabled == null || enabled;
        this.interval = interval == null ? Duration.ofSeconds(5) : interval;
        this.tempThreshold = tempThreshold == null ? 75.0 : tempThreshold;
        this.cpuThreshold = cpuThreshold == null ? 95.0 : cpuThreshold;
        this.memoryThreshold = memoryThreshold == null ? 90.0 : memoryThreshold;
        this.diskPath = diskPath == null ? Path.of("/") : diskPath;
    }

    /**
     * Defaults for everything; tests override individual values through the full constructor.
     */
    public HealthProperties() {
        this(null, null, null, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public double getTempThreshold() {
        return tempThreshold;
    }

    public double getCpuThreshold() {
        return cpuThreshold;
    }

    public double getMemoryThreshold() {
        return memoryThreshold;
    }

    public Path getDiskPath() {
        return diskPath;
    }
}
