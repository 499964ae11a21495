package com.phillippitts.edgekeeper.service.runtime;

import com.phillippitts.edgekeeper.config.properties.HealthProperties;
import com.phillippitts.edgekeeper.config.properties.RuntimeProperties;
import com.phillippitts.edgekeeper.config.properties.SupervisorProperties;
import com.phillippitts.edgekeeper.config.properties.SupervisorProperties.WorkerDefinition;
import com.phillippitts.edgekeeper.config.properties.TelemetryProperties;
import com.phillippitts.edgekeeper.domain.HealthStatus;
import com.phillippitts.edgekeeper.domain.WorkerStatus;
import com.phillippitts.edgekeeper.exception.DuplicateWorkerException;
import com.phillippitts.edgekeeper.service.health.HealthListener;
import com.phillippitts.edgekeeper.service.health.HealthMonitor;
import com.phillippitts.edgekeeper.service.migration.LegacyBufferMigrator;
import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import com.phillippitts.edgekeeper.service.supervisor.event.WorkerFailedEvent;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryClient;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Composes the supervisor, the health monitor and the telemetry client into one runtime.
 *
 * <p>Startup (in order): import the legacy buffer if configured, register configured workers,
 * start telemetry, health sampling and the supervisor, schedule heartbeat events.
 *
 * <p>Overheat protection: non-essential workers are paused on overheat and resumed on recovery;
 * both transitions, terminal worker failures and shutdown are reported as telemetry events.
 *
 * <p>Shutdown (in order): stop workers, stop health sampling, send the shutdown event, stop
 * telemetry.
 */
public class EdgeRuntime implements SmartLifecycle, HealthListener {

    private static final Logger LOG = LogManager.getLogger(EdgeRuntime.class);

    private final RuntimeProperties runtimeProps;
    private final HealthProperties healthProps;
    private final SupervisorProperties supervisorProps;
    private final TelemetryProperties telemetryProps;
    private final WorkerSupervisor supervisor;
    private final HealthMonitor healthMonitor;
    private final TelemetryClient telemetry;
    private final LegacyBufferMigrator migrator;
    private final TaskScheduler scheduler;

    private volatile boolean running;
    private ScheduledFuture<?> heartbeatTask;

    public EdgeRuntime(RuntimeProperties runtimeProps,
                       HealthProperties healthProps,
                       SupervisorProperties supervisorProps,
                       TelemetryProperties telemetryProps,
                       WorkerSupervisor supervisor,
                       HealthMonitor healthMonitor,
                       TelemetryClient telemetry,
                       LegacyBufferMigrator migrator,
                       TaskScheduler scheduler) {
        this.runtimeProps = Objects.requireNonNull(runtimeProps, "runtimeProps");
        this.healthProps = Objects.requireNonNull(healthProps, "healthProps");
        this.supervisorProps = Objects.requireNonNull(supervisorProps, "supervisorProps");
        this.telemetryProps = Objects.requireNonNull(telemetryProps, "telemetryProps");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.migrator = Objects.requireNonNull(migrator, "migrator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public boolean isAutoStartup() {
        return runtimeProps.isEnabled();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        LOG.info("Starting edge runtime (device {})", telemetry.deviceId());
        warnOnLoopbackEndpoint(telemetry.endpoint());

        if (telemetryProps.getLegacyDir() != null) {
            LOG.info("Legacy buffer migration: {}", migrator.migrate(telemetryProps.getLegacyDir()));
        }
        registerConfiguredWorkers();

        telemetry.start();
        healthMonitor.addListener(this);
        if (healthProps.isEnabled()) {
            healthMonitor.start();
        } else {
            LOG.info("Health sampling disabled");
        }
        Map<String, Boolean> results = supervisor.startAll();
        results.forEach((name, ok) -> {
            if (ok) {
                LOG.info("Worker '{}' started", name);
            } else {
                LOG.error("Worker '{}' failed to start", name);
            }
        });

        heartbeatTask = scheduler.scheduleAtFixedRate(this::emitHeartbeat,
                Instant.now().plus(runtimeProps.getHeartbeatInterval()),
                runtimeProps.getHeartbeatInterval());
        running = true;
        LOG.info("Edge runtime started: {} workers, heartbeat every {}",
                results.size(), runtimeProps.getHeartbeatInterval());
    }

    private void registerConfiguredWorkers() {
        for (WorkerDefinition def : supervisorProps.getWorkers()) {
            int maxRestarts = def.getMaxRestarts() != null
                    ? def.getMaxRestarts()
                    : supervisorProps.getDefaultMaxRestarts();
            try {
                supervisor.register(def.getName(), def.getCommand(), def.isEssential(), maxRestarts,
                        def.isHeartbeatEnabled());
            } catch (DuplicateWorkerException e) {
                LOG.warn("Skipping configured worker: {}", e.getMessage());
            }
        }
    }

    static boolean isLoopback(String endpoint) {
        return endpoint != null && (endpoint.contains("localhost") || endpoint.contains("127.0.0.1"));
    }

    private static void warnOnLoopbackEndpoint(String endpoint) {
        if (isLoopback(endpoint)) {
            LOG.warn("Telemetry endpoint is local ({}); this will not reach a real collector", endpoint);
        }
    }

    @Override
    public void onOverheat(HealthStatus status) {
        List<String> candidates = supervisor.nonEssentialRunningNames();
        for (String name : candidates) {
            if (supervisor.pause(name)) {
                LOG.warn("Worker '{}' paused for overheat protection", name);
            }
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "overheat_protection");
        event.put("temperature", status.temperatureCelsius());
        event.put("paused_workers", candidates);
        telemetry.send(event);
    }

    @Override
    public void onRecover(HealthStatus status) {
        for (String name : supervisor.pausedNames()) {
            if (supervisor.resume(name)) {
                LOG.info("Worker '{}' resumed after recovery", name);
            }
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "temperature_recovered");
        event.put("temperature", status.temperatureCelsius());
        telemetry.send(event);
    }

    @EventListener
    public void onWorkerFailed(WorkerFailedEvent failure) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "worker_failed");
        event.put("worker", failure.worker());
        event.put("restart_count", failure.restartCount());
        event.put("reason", failure.reason());
        telemetry.send(event);
    }

    /**
     * Sends the periodic heartbeat event. Skipped until the first health sample exists.
     */
    void emitHeartbeat() {
        try {
            healthMonitor.lastStatus().ifPresent(status -> telemetry.send(heartbeatEvent(status)));
        } catch (RuntimeException e) {
            LOG.error("Heartbeat failed: {}", e.toString(), e);
        }
    }

    Map<String, Object> heartbeatEvent(HealthStatus status) {
        Map<String, Object> workers = new LinkedHashMap<>();
        for (Map.Entry<String, WorkerStatus> entry : supervisor.status().entrySet()) {
            WorkerStatus ws = entry.getValue();
            Map<String, Object> w = new LinkedHashMap<>();
            w.put("state", ws.state().name().toLowerCase(Locale.ROOT));
            w.put("pid", ws.pid());
            w.put("restart_count", ws.restartCount());
            w.put("essential", ws.essential());
            workers.put(entry.getKey(), w);
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "heartbeat");
        event.put("device_id", telemetry.deviceId());
        event.put("cpu_percent", status.cpuPercent());
        event.put("memory_percent", status.memoryPercent());
        event.put("temperature_celsius", status.temperatureCelsius());
        event.put("disk_usage_percent", status.diskPercent());
        event.put("workers", workers);
        event.put("telemetry_stats", telemetry.stats().toMap());
        return event;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.warn("Graceful shutdown started");
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        supervisor.stopAll();
        healthMonitor.stop();
        healthMonitor.removeListener(this);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", "shutdown");
        event.put("reason", "graceful_shutdown");
        telemetry.send(event);

        TelemetryStats stats = telemetry.stats();
        telemetry.stop();
        running = false;
        LOG.info("Edge runtime stopped: sent_ok={} send_failed={} circuit_open={} buffered={} flushed={}",
                stats.sentOk(), stats.sendFailed(), stats.circuitOpen(), stats.buffered(), stats.flushed());
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
