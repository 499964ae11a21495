package com.phillippitts.edgekeeper.service.health;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemperatureReaderTest {

    @TempDir
    Path sys;

    private void write(String relative, String content) throws IOException {
        Path file = sys.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void readsHwmonAndThermalZones() throws IOException {
        write("class/hwmon/hwmon0/name", "coretemp\n");
        write("class/hwmon/hwmon0/temp1_input", "55000\n");
        write("class/hwmon/hwmon0/temp2_input", "61500\n");
        write("class/hwmon/hwmon1/name", "nvme\n");
        write("class/hwmon/hwmon1/temp1_input", "garbage\n");
        write("class/thermal/thermal_zone0/temp", "48000\n");

        Map<String, List<Double>> readings = new TemperatureReader(sys).read();

        assertThat(readings).containsOnlyKeys("coretemp", "thermal_zone0");
        assertThat(readings.get("coretemp")).containsExactly(55.0, 61.5);
        assertThat(readings.get("thermal_zone0")).containsExactly(48.0);
    }

    @Test
    void hwmonWithoutNameIsIgnored() throws IOException {
        write("class/hwmon/hwmon0/temp1_input", "40000");

        assertThat(new TemperatureReader(sys).read()).isEmpty();
    }

    @Test
    void missingSysfsYieldsEmptyMap() {
        assertThat(new TemperatureReader(sys.resolve("does-not-exist")).read()).isEmpty();
    }
}
