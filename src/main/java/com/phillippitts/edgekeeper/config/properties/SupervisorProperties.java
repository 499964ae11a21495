package com.phillippitts.edgekeeper.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the worker supervisor and the workers it manages.
 *
 * <pre>
 * edge.supervisor.workers[0].name=sensor-temp
 * edge.supervisor.workers[0].command=python3,sensor.py
 * edge.supervisor.workers[0].essential=true
 * </pre>
 */
@ConfigurationProperties(prefix = "edge.supervisor")
@Validated
public class SupervisorProperties {

    /** Time between watchdog passes. */
    @NotNull
    private Duration watchdogInterval = Duration.ofSeconds(5);

    /** A heartbeat marker older than this marks a live worker as hung. */
    @NotNull
    private Duration heartbeatStaleness = Duration.ofSeconds(30);

    /** Directory for heartbeat markers and stop-signal files. */
    @NotNull
    private Path heartbeatDir = Path.of(System.getProperty("java.io.tmpdir"), "edgekeeper");

    /** Working directory for spawned workers; inherits the runtime's when unset. */
    private Path workingDir;

    /** Restart ceiling for workers that do not set their own. */
    @Min(value = 0, message = "Default max restarts must not be negative")
    private int defaultMaxRestarts = 10;

    @Valid
    private List<WorkerDefinition> workers = new ArrayList<>();

    public Duration getWatchdogInterval() {
        return watchdogInterval;
    }

    public void setWatchdogInterval(Duration watchdogInterval) {
        this.watchdogInterval = watchdogInterval;
    }

    public Duration getHeartbeatStaleness() {
        return heartbeatStaleness;
    }

    public void setHeartbeatStaleness(Duration heartbeatStaleness) {
        this.heartbeatStaleness = heartbeatStaleness;
    }

    public Path getHeartbeatDir() {
        return heartbeatDir;
    }

    public void setHeartbeatDir(Path heartbeatDir) {
        this.heartbeatDir = heartbeatDir;
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    public void setWorkingDir(Path workingDir) {
        this.workingDir = workingDir;
    }

    public int getDefaultMaxRestarts() {
        return defaultMaxRestarts;
    }

    public void setDefaultMaxRestarts(int defaultMaxRestarts) {
        this.defaultMaxRestarts = defaultMaxRestarts;
    }

    public List<WorkerDefinition> getWorkers() {
        return workers;
    }

    public void setWorkers(List<WorkerDefinition> workers) {
        this.workers = workers;
    }

    /**
     * One worker declared in configuration.
     */
    public static class WorkerDefinition {

        @NotBlank(message = "Worker name must not be blank")
        private String name;

        /** argv list; never interpreted by a shell. */
        @NotEmpty(message = "Worker command must not be empty")
        private List<String> command = new ArrayList<>();

        /** Essential workers are never paused on overheat. */
        private boolean essential;

        /** Overrides {@code edge.supervisor.default-max-restarts} when set. */
        @Min(value = 0, message = "Max restarts must not be negative")
        private Integer maxRestarts;

        private boolean heartbeatEnabled;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public boolean isEssential() {
            return essential;
        }

        public void setEssential(boolean essential) {
            this.essential = essential;
        }

        public Integer getMaxRestarts() {
            return maxRestarts;
        }

        public void setMaxRestarts(Integer maxRestarts) {
            this.maxRestarts = maxRestarts;
        }

        public boolean isHeartbeatEnabled() {
            return heartbeatEnabled;
        }

        public void setHeartbeatEnabled(boolean heartbeatEnabled) {
            this.heartbeatEnabled = heartbeatEnabled;
        }
    }
}
