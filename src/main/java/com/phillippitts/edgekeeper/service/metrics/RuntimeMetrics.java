package com.phillippitts.edgekeeper.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counter and gauge sink shared by the supervisor, the health monitor and the telemetry client.
 *
 * <p>Metric names are given in snake_case ({@code worker_restarts}) and registered under the
 * {@code edgekeeper.} prefix. Gauges are backed by an {@link AtomicReference} per name so the
 * latest value wins.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RuntimeMetrics {

    private static final String METRIC_PREFIX = "edgekeeper.";

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

    public RuntimeMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Increments the named counter by one.
     *
     * @param name counter name without prefix
     */
    public void increment(String name) {
        Counter.builder(METRIC_PREFIX + name)
                .register(registry)
                .increment();
    }

    /**
     * Sets the named gauge to {@code value}, registering it on first use.
     *
     * @param name gauge name without prefix
     * @param value new value
     */
    public void gauge(String name, double value) {
        gauges.computeIfAbsent(name, this::registerGauge).set(value);
    }

    /**
     * Current count of the named counter; 0 when it was never incremented.
     */
    public long counter(String name) {
        Counter counter = registry.find(METRIC_PREFIX + name).counter();
        return counter == null ? 0L : (long) counter.count();
    }

    /**
     * Last value set on the named gauge, or {@code NaN} when it was never set.
     */
    public double gaugeValue(String name) {
        AtomicReference<Double> ref = gauges.get(name);
        return ref == null ? Double.NaN : ref.get();
    }

    private AtomicReference<Double> registerGauge(String name) {
        AtomicReference<Double> ref = new AtomicReference<>(0.0);
        Gauge.builder(METRIC_PREFIX + name, ref, r -> r.get())
                .register(registry);
        return ref;
    }
}
