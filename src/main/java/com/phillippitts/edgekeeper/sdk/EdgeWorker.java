package com.phillippitts.edgekeeper.sdk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;

/**
 * Helper for JVM-based workers run under the supervisor.
 *
 * <p>Typical loop:
 * <pre>{@code
 * EdgeWorker worker = new EdgeWorker("sensor-temp");
 * while (worker.shouldRun()) {
 *     readSensor();
 *     worker.heartbeat();
 *     Thread.sleep(2000);
 * }
 * }</pre>
 *
 * <p>The heartbeat marker comes from {@code EDGE_HEARTBEAT_FILE} (falling back to
 * {@code <tmp>/edgekeeper_<name>.beat}); the stop signal from {@code EDGE_STOP_SIGNAL}.
 */
public class EdgeWorker {

    private static final Logger LOG = LogManager.getLogger(EdgeWorker.class);

    public static final String HEARTBEAT_ENV = "EDGE_HEARTBEAT_FILE";
    public static final String STOP_SIGNAL_ENV = "EDGE_STOP_SIGNAL";

    private final String name;
    private final Path heartbeatPath;
    private final Path stopPath;
    private volatile boolean stopped;

    public EdgeWorker(String name) {
        this(name, System.getenv());
    }

    EdgeWorker(String name, Map<String, String> env) {
        this.name = name;
        String beat = env.get(HEARTBEAT_ENV);
        this.heartbeatPath = beat != null && !beat.isBlank()
                ? Path.of(beat)
                : Path.of(System.getProperty("java.io.tmpdir"), "edgekeeper_" + name + ".beat");
        String stop = env.get(STOP_SIGNAL_ENV);
        this.stopPath = stop != null && !stop.isBlank() ? Path.of(stop) : null;
        LOG.debug("EdgeWorker '{}' initialized (heartbeat={}, stop={})", name, heartbeatPath, stopPath);
    }

    /**
     * Signals liveness by updating the marker's modification time. Never throws.
     */
    public void heartbeat() {
        try {
            if (Files.exists(heartbeatPath)) {
                Files.setLastModifiedTime(heartbeatPath, FileTime.from(Instant.now()));
            } else {
                Files.createFile(heartbeatPath);
            }
        } catch (IOException e) {
            LOG.debug("Heartbeat for '{}' failed: {}", name, e.toString());
        }
    }

    /**
     * Returns false once {@link #stop()} was called or the supervisor created the stop file.
     */
    public boolean shouldRun() {
        if (stopped) {
            return false;
        }
        if (stopPath != null && Files.exists(stopPath)) {
            LOG.info("EdgeWorker '{}': stop signal detected", name);
            stopped = true;
            return false;
        }
        return true;
    }

    public void stop() {
        stopped = true;
        LOG.info("EdgeWorker '{}' stopped via stop()", name);
    }

    public String getName() {
        return name;
    }

    public Path getHeartbeatPath() {
        return heartbeatPath;
    }

    public Path getStopPath() {
        return stopPath;
    }
}
