package com.phillippitts.edgekeeper.service.health;

import com.phillippitts.edgekeeper.config.properties.HealthProperties;
import com.phillippitts.edgekeeper.domain.HealthStatus;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples host health on a fixed interval and reports overheat transitions.
 *
 * <p>Each tick reads CPU, memory, disk and temperature, publishes the values as gauges and
 * compares the temperature with the threshold. Listeners are notified only when the overheating
 * flag flips, never while it stays the same. CPU and memory breaches are logged but trigger no
 * action.
 *
 * <p>Temperature selection: the first preferred sensor with a reading wins
 * ({@link #PREFERRED_SENSORS}); otherwise the highest reading of any sensor; otherwise 0.0, which
 * means "unavailable" and never counts as overheating.
 */
public class HealthMonitor {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    public static final List<String> PREFERRED_SENSORS =
            List.of("cpu_thermal", "thermal_zone0", "coretemp", "k10temp");

    static final String OVERHEAT_EVENTS = "overheat_events";
    static final String RECOVERY_EVENTS = "recovery_events";

    private final HealthProperties props;
    private final SystemMetricsProvider provider;
    private final RuntimeMetrics metrics;
    private final Clock clock;
    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock stateLock = new ReentrantLock();
    private HealthStatus lastStatus;
    private boolean overheating;
    private volatile boolean sensorWarningLogged;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private Thread samplerThread;

    public HealthMonitor(HealthProperties props, SystemMetricsProvider provider, RuntimeMetrics metrics) {
        this(props, provider, metrics, Clock.systemUTC());
    }

    HealthMonitor(HealthProperties props, SystemMetricsProvider provider, RuntimeMetrics metrics, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(HealthListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(HealthListener listener) {
        listeners.remove(listener);
    }

    /**
     * Takes one sample, stores it and fires transition callbacks.
     *
     * @return the new snapshot
     */
    public HealthStatus sampleOnce() {
        HealthStatus status = collect();
        boolean becameOverheating;
        boolean recovered;
        stateLock.lock();
        try {
            lastStatus = status;
            becameOverheating = status.overheating() && !overheating;
            recovered = !status.overheating() && overheating;
            overheating = status.overheating();
        } finally {
            stateLock.unlock();
        }
        if (becameOverheating) {
            metrics.increment(OVERHEAT_EVENTS);
            LOG.warn("Overheat protection: temperature {}°C >= {}°C; pausing non-essential workers",
                    format(status.temperatureCelsius()), format(props.getTempThreshold()));
            notifyListeners(status, true);
        } else if (recovered) {
            metrics.increment(RECOVERY_EVENTS);
            LOG.info("Temperature recovered: {}°C; resuming workers", format(status.temperatureCelsius()));
            notifyListeners(status, false);
        }
        checkLoadThresholds(status);
        LOG.debug("Health: CPU={}% RAM={}% Temp={}°C Disk={}%",
                format(status.cpuPercent()), format(status.memoryPercent()),
                format(status.temperatureCelsius()), format(status.diskPercent()));
        return status;
    }

    private HealthStatus collect() {
        double cpu = provider.cpuPercent();
        double memory = provider.memoryPercent();
        double disk = provider.diskPercent(props.getDiskPath());
        double temperature = cpuTemperature();

        metrics.gauge("system_cpu_percent", cpu);
        metrics.gauge("system_memory_percent", memory);
        metrics.gauge("system_disk_percent", disk);
        metrics.gauge("system_temperature_celsius", temperature);

        return HealthStatus.of(cpu, memory, disk, temperature, props.getTempThreshold(), clock.instant());
    }

    /**
     * Applies the sensor selection policy to the provider's readings.
     */
    double cpuTemperature() {
        Map<String, List<Double>> readings;
        try {
            readings = provider.temperatures();
        } catch (RuntimeException e) {
            LOG.debug("Temperature read failed: {}", e.toString());
            return noSensor();
        }
        if (readings == null || readings.isEmpty()) {
            return noSensor();
        }
        for (String sensor : PREFERRED_SENSORS) {
            List<Double> values = readings.get(sensor);
            if (values != null && !values.isEmpty()) {
                return values.get(0);
            }
        }
        double max = readings.values().stream()
                .flatMap(List::stream)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
        return max > 0 ? max : noSensor();
    }

    private double noSensor() {
        if (!sensorWarningLogged) {
            sensorWarningLogged = true;
            LOG.warn("No temperature sensor found (VM/container/unsupported hardware); using 0.0°C");
        }
        return 0.0;
    }

    private void notifyListeners(HealthStatus status, boolean overheat) {
        for (HealthListener listener : listeners) {
            try {
                if (overheat) {
                    listener.onOverheat(status);
                } else {
                    listener.onRecover(status);
                }
            } catch (RuntimeException e) {
                LOG.error("Health listener {} failed: {}", listener.getClass().getSimpleName(), e.toString(), e);
            }
        }
    }

    private void checkLoadThresholds(HealthStatus status) {
        if (status.cpuPercent() >= props.getCpuThreshold()) {
            LOG.warn("CPU at {}% (threshold {}%)", format(status.cpuPercent()), format(props.getCpuThreshold()));
        }
        if (status.memoryPercent() >= props.getMemoryThreshold()) {
            LOG.warn("Memory at {}% (threshold {}%)",
                    format(status.memoryPercent()), format(props.getMemoryThreshold()));
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * Starts the sampling thread. Idempotent.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                LOG.warn("Health monitor already running");
                return;
            }
            running = true;
            samplerThread = new Thread(this::sampleLoop, "edge-health");
            samplerThread.setDaemon(true);
            samplerThread.start();
        }
        LOG.info("Health monitor started (interval {}, temp threshold {}°C)",
                props.getInterval(), format(props.getTempThreshold()));
    }

    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            running = false;
            thread = samplerThread;
            samplerThread = null;
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(ProcessTimeouts.loopJoinTimeout(props.getInterval()).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Health monitor stopped");
    }

    private void sampleLoop() {
        while (running) {
            try {
                sampleOnce();
            } catch (RuntimeException e) {
                LOG.error("Health sampling failed: {}", e.toString(), e);
            }
            try {
                Thread.sleep(props.getInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    public Optional<HealthStatus> lastStatus() {
        stateLock.lock();
        try {
            return Optional.ofNullable(lastStatus);
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isOverheating() {
        stateLock.lock();
        try {
            return overheating;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public HealthReport report() {
        HealthStatus status;
        boolean hot;
        stateLock.lock();
        try {
            status = lastStatus;
            hot = overheating;
        } finally {
            stateLock.unlock();
        }
        return new HealthReport(
                hot ? HealthReport.OVERHEATING : HealthReport.HEALTHY,
                status == null ? null : status.cpuPercent(),
                status == null ? null : status.memoryPercent(),
                status == null ? null : status.temperatureCelsius(),
                status == null ? null : status.diskPercent(),
                props.getTempThreshold(),
                props.getCpuThreshold(),
                props.getMemoryThreshold());
    }
}
