package com.phillippitts.edgekeeper.testutil;

import com.phillippitts.edgekeeper.service.health.SystemMetricsProvider;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Host metrics with values set by the test.
 */
public class StubMetricsProvider implements SystemMetricsProvider {

    private volatile double cpu = 10.0;
    private volatile double memory = 20.0;
    private volatile double disk = 30.0;
    private volatile Map<String, List<Double>> temperatures = Map.of();

    public StubMetricsProvider cpu(double value) {
        this.cpu = value;
        return this;
    }

    public StubMetricsProvider memory(double value) {
        this.memory = value;
        return this;
    }

    public StubMetricsProvider disk(double value) {
        this.disk = value;
        return this;
    }

    /** Single reading on the {@code cpu_thermal} sensor. */
    public StubMetricsProvider temperature(double celsius) {
        return sensors(Map.of("cpu_thermal", List.of(celsius)));
    }

    public StubMetricsProvider noSensors() {
        return sensors(Map.of());
    }

    public StubMetricsProvider sensors(Map<String, List<Double>> readings) {
        this.temperatures = new LinkedHashMap<>(readings);
        return this;
    }

    @Override
    public double cpuPercent() {
        return cpu;
    }

    @Override
    public double memoryPercent() {
        return memory;
    }

    @Override
    public double diskPercent(Path path) {
        return disk;
    }

    @Override
    public Map<String, List<Double>> temperatures() {
        return temperatures;
    }
}
