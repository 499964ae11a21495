package com.phillippitts.edgekeeper.service.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads CPU temperature sensors from Linux sysfs.
 *
 * <p>Two sources, values in millidegrees Celsius:
 * <ul>
 *   <li>{@code class/hwmon/hwmonN/name} + {@code tempK_input}: keyed by the driver name
 *       ({@code coretemp}, {@code k10temp}, {@code cpu_thermal})</li>
 *   <li>{@code class/thermal/thermal_zoneN/temp}: keyed by the zone directory name</li>
 * </ul>
 * Hosts without sysfs (macOS, containers, VMs) yield an empty map.
 */
public class TemperatureReader {

    private static final Logger LOG = LogManager.getLogger(TemperatureReader.class);

    private final Path sysRoot;

    public TemperatureReader() {
        this(Path.of("/sys"));
    }

    public TemperatureReader(Path sysRoot) {
        this.sysRoot = sysRoot;
    }

    public Map<String, List<Double>> read() {
        Map<String, List<Double>> readings = new LinkedHashMap<>();
        readHwmon(readings);
        readThermalZones(readings);
        return readings;
    }

    private void readHwmon(Map<String, List<Double>> readings) {
        Path hwmonRoot = sysRoot.resolve("class/hwmon");
        for (Path device : sortedChildren(hwmonRoot, "hwmon*")) {
            String name = readTrimmed(device.resolve("name"));
            if (name == null || name.isEmpty()) {
                continue;
            }
            List<Double> values = new ArrayList<>();
            for (Path input : sortedChildren(device, "temp*_input")) {
                Double celsius = readMillidegrees(input);
                if (celsius != null) {
                    values.add(celsius);
                }
            }
            if (!values.isEmpty()) {
                readings.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
            }
        }
    }

    private void readThermalZones(Map<String, List<Double>> readings) {
        Path thermalRoot = sysRoot.resolve("class/thermal");
        for (Path zone : sortedChildren(thermalRoot, "thermal_zone*")) {
            Double celsius = readMillidegrees(zone.resolve("temp"));
            if (celsius != null) {
                readings.computeIfAbsent(zone.getFileName().toString(), k -> new ArrayList<>()).add(celsius);
            }
        }
    }

    private static List<Path> sortedChildren(Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        Map<String, Path> sorted = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path child : stream) {
                sorted.put(child.getFileName().toString(), child);
            }
        } catch (IOException e) {
            LOG.debug("Cannot list {}: {}", dir, e.toString());
        }
        return new ArrayList<>(sorted.values());
    }

    private static Double readMillidegrees(Path file) {
        String text = readTrimmed(file);
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text) / 1000.0;
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable sensor value in {}: {}", file, text);
            return null;
        }
    }

    private static String readTrimmed(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            return null;
        }
    }
}
