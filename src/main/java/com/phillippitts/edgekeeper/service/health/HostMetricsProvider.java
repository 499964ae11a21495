package com.phillippitts.edgekeeper.service.health;

import com.sun.management.OperatingSystemMXBean;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * {@link SystemMetricsProvider} for the local host: JMX for CPU and memory, NIO file stores for
 * disk usage and sysfs for temperatures.
 */
public class HostMetricsProvider implements SystemMetricsProvider {

    private final OperatingSystemMXBean os;
    private final TemperatureReader temperatureReader;

    public HostMetricsProvider(TemperatureReader temperatureReader) {
        this.os = ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class);
        this.temperatureReader = temperatureReader;
    }

    @Override
    public double cpuPercent() {
        double load = os.getCpuLoad();
        // negative means "not yet available" (first call on some platforms)
        return load < 0 ? 0.0 : load * 100.0;
    }

    @Override
    public double memoryPercent() {
        long total = os.getTotalMemorySize();
        if (total <= 0) {
            return 0.0;
        }
        long free = os.getFreeMemorySize();
        return (total - free) * 100.0 / total;
    }

    @Override
    public double diskPercent(Path path) {
        try {
            FileStore store = Files.getFileStore(path);
            long total = store.getTotalSpace();
            if (total <= 0) {
                return 0.0;
            }
            return (total - store.getUnallocatedSpace()) * 100.0 / total;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read file store of " + path, e);
        }
    }

    @Override
    public Map<String, List<Double>> temperatures() {
        return temperatureReader.read();
    }
}
