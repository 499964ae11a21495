package com.phillippitts.edgekeeper.sdk;

import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EdgeWorkerTest {

    @TempDir
    Path tmp;

    @Test
    void heartbeatCreatesThenTouchesMarker() throws Exception {
        Path beat = tmp.resolve("sensor.beat");
        EdgeWorker worker = new EdgeWorker("sensor", Map.of(EdgeWorker.HEARTBEAT_ENV, beat.toString()));

        worker.heartbeat();
        assertThat(beat).exists();

        Instant old = Instant.now().minusSeconds(300);
        Files.setLastModifiedTime(beat, FileTime.from(old));
        worker.heartbeat();

        assertThat(Files.getLastModifiedTime(beat).toInstant()).isAfter(old.plusSeconds(60));
    }

    @Test
    void heartbeatNeverThrows() {
        EdgeWorker worker = new EdgeWorker("sensor",
                Map.of(EdgeWorker.HEARTBEAT_ENV, tmp.resolve("missing/dir/sensor.beat").toString()));

        worker.heartbeat();

        assertThat(worker.shouldRun()).isTrue();
    }

    @Test
    void stopFileEndsTheLoop() throws Exception {
        Path stop = tmp.resolve("sensor.stop");
        EdgeWorker worker = new EdgeWorker("sensor", Map.of(EdgeWorker.STOP_SIGNAL_ENV, stop.toString()));
        assertThat(worker.shouldRun()).isTrue();

        Files.createFile(stop);

        assertThat(worker.shouldRun()).isFalse();
        Files.delete(stop);
        assertThat(worker.shouldRun()).isFalse();
    }

    @Test
    void stopEndsTheLoop() {
        EdgeWorker worker = new EdgeWorker("sensor", Map.of());

        worker.stop();

        assertThat(worker.shouldRun()).isFalse();
    }

    @Test
    void fallsBackToTempDirectoryMarker() {
        EdgeWorker worker = new EdgeWorker("sensor", Map.of());

        assertThat(worker.getHeartbeatPath())
                .isEqualTo(Path.of(System.getProperty("java.io.tmpdir"), "edgekeeper_sensor.beat"));
        assertThat(worker.getStopPath()).isNull();
    }

    @Test
    void envNamesMatchWhatTheSupervisorSets() {
        assertThat(EdgeWorker.HEARTBEAT_ENV)
                .isEqualTo(WorkerSupervisor.HEARTBEAT_ENV);
        assertThat(EdgeWorker.STOP_SIGNAL_ENV)
                .isEqualTo(WorkerSupervisor.STOP_SIGNAL_ENV);
    }
}
