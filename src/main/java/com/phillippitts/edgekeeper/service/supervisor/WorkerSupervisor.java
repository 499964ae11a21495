package com.phillippitts.edgekeeper.service.supervisor;

import com.phillippitts.edgekeeper.config.properties.SupervisorProperties;
import com.phillippitts.edgekeeper.domain.WorkerState;
import com.phillippitts.edgekeeper.domain.WorkerStatus;
import com.phillippitts.edgekeeper.exception.DuplicateWorkerException;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.supervisor.event.WorkerFailedEvent;
import com.phillippitts.edgekeeper.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owns a table of named worker processes and keeps them alive.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Spawn workers from argv lists (no shell) and drain their output</li>
 *   <li>Watchdog loop: detect dead or hung ("zombie") workers and respawn them up to their
 *       restart ceiling, then mark them FAILED and publish {@link WorkerFailedEvent}</li>
 *   <li>Pause/resume non-essential workers with SIGSTOP/SIGCONT</li>
 *   <li>Graceful stop: stop-signal file, destroy, wait, destroyForcibly</li>
 * </ul>
 *
 * <p>Hang detection: a worker with heartbeat enabled gets {@code EDGE_HEARTBEAT_FILE} pointing at
 * {@code <heartbeat-dir>/<name>.beat} and must touch it more often than the staleness window.
 * Every worker gets {@code EDGE_STOP_SIGNAL} pointing at {@code <heartbeat-dir>/<name>.stop},
 * which is created when the worker is asked to stop.
 *
 * <p>Thread-safety: one {@link ReentrantLock} guards the whole table; the watchdog holds it for
 * a full pass, so restarts of one worker are strictly sequential. Events are published after
 * the lock is released.
 */
public class WorkerSupervisor {

    private static final Logger LOG = LogManager.getLogger(WorkerSupervisor.class);

    public static final String HEARTBEAT_ENV = "EDGE_HEARTBEAT_FILE";
    public static final String STOP_SIGNAL_ENV = "EDGE_STOP_SIGNAL";

    static final String WORKERS_ACTIVE = "workers_active";
    static final String WORKER_RESTARTS = "worker_restarts";

    private final Duration watchdogInterval;
    private final Duration heartbeatStaleness;
    private final Path heartbeatDir;
    private final Path workingDir;
    private final ProcessFactory processFactory;
    private final ProcessSignaller signaller;
    private final RuntimeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, WorkerProcess> workers = new LinkedHashMap<>();

    private volatile boolean running;
    private Thread watchdogThread;

    public WorkerSupervisor(SupervisorProperties props,
                            ProcessFactory processFactory,
                            ProcessSignaller signaller,
                            RuntimeMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this(props, processFactory, signaller, metrics, publisher, Clock.systemUTC());
    }

    WorkerSupervisor(SupervisorProperties props,
                     ProcessFactory processFactory,
                     ProcessSignaller signaller,
                     RuntimeMetrics metrics,
                     ApplicationEventPublisher publisher,
                     Clock clock) {
        Objects.requireNonNull(props, "props");
        this.watchdogInterval = Objects.requireNonNull(props.getWatchdogInterval(), "watchdogInterval");
        this.heartbeatStaleness = Objects.requireNonNull(props.getHeartbeatStaleness(), "heartbeatStaleness");
        this.heartbeatDir = Objects.requireNonNull(props.getHeartbeatDir(), "heartbeatDir");
        this.workingDir = props.getWorkingDir();
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.signaller = Objects.requireNonNull(signaller, "signaller");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a worker in STOPPED state.
     *
     * @param name unique worker name (also used for marker file names)
     * @param command argv list, executable first
     * @param essential essential workers are never paused
     * @param maxRestarts restart ceiling; reaching it marks the worker FAILED
     * @param heartbeatEnabled whether hang detection via heartbeat marker applies
     * @throws DuplicateWorkerException if a worker with this name exists
     * @throws IllegalArgumentException on blank name, empty command or negative ceiling
     */
    public void register(String name, List<String> command, boolean essential, int maxRestarts,
                         boolean heartbeatEnabled) {
        validate(name, command, maxRestarts);
        lock.lock();
        try {
            if (workers.containsKey(name)) {
                throw new DuplicateWorkerException(name);
            }
            workers.put(name, new WorkerProcess(name, command, essential, maxRestarts, heartbeatEnabled,
                    heartbeatDir.resolve(name + ".beat"), heartbeatDir.resolve(name + ".stop")));
            LOG.info("Worker registered: {} -> {} (essential={}, maxRestarts={}, heartbeat={})",
                    name, String.join(" ", command), essential, maxRestarts, heartbeatEnabled);
        } finally {
            lock.unlock();
        }
    }

    private static void validate(String name, List<String> command, int maxRestarts) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Worker name must not be blank");
        }
        if (name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Worker name must not contain path elements: " + name);
        }
        if (command == null || command.isEmpty() || command.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Worker command must be a non-empty argv list");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative");
        }
    }

    /**
     * Starts every STOPPED worker and the watchdog (once).
     *
     * @return start result per worker that was attempted
     */
    public Map<String, Boolean> startAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        List<WorkerFailedEvent> failures = new ArrayList<>();
        lock.lock();
        try {
            for (WorkerProcess worker : workers.values()) {
                if (worker.state() == WorkerState.STOPPED) {
                    boolean started = spawn(worker);
                    results.put(worker.name(), started);
                    if (!started) {
                        failures.add(new WorkerFailedEvent(worker.name(), worker.restartCount(),
                                "spawn failed", clock.instant()));
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        failures.forEach(publisher::publishEvent);
        startWatchdog();
        return results;
    }

    private synchronized void startWatchdog() {
        if (watchdogThread != null && watchdogThread.isAlive()) {
            return;
        }
        running = true;
        watchdogThread = new Thread(this::watchdogLoop, "edge-watchdog");
        watchdogThread.setDaemon(true);
        watchdogThread.start();
        LOG.info("Watchdog started (interval {})", watchdogInterval);
    }

    /**
     * Spawns the worker's process and moves it to RUNNING. On failure the worker goes FAILED.
     * A worker whose previous process is still alive is left untouched, so its handle is never
     * replaced. Caller holds the lock.
     */
    private boolean spawn(WorkerProcess worker) {
        SupervisorLogging.enter(worker.name());
        try {
            if (worker.hasLiveProcess()) {
                LOG.error("Worker '{}' still owns live PID {}; not spawning", worker.name(), worker.pid());
                return false;
            }
            Map<String, String> env = prepareMarkers(worker);
            Process process = processFactory.start(worker.command(), workingDir, env);
            List<Thread> drainers = List.of(
                    OutputDrainer.start(process.getInputStream(), worker.name(), "stdout"),
                    OutputDrainer.start(process.getErrorStream(), worker.name(), "stderr"));
            worker.markRunning(process, drainers);
            updateActiveGauge();
            LOG.info("Worker '{}' started with PID {}", worker.name(), process.pid());
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to start worker '{}': {}", worker.name(), e.toString(), e);
            worker.markFailed();
            updateActiveGauge();
            return false;
        } finally {
            SupervisorLogging.leave();
        }
    }

    private Map<String, String> prepareMarkers(WorkerProcess worker) throws IOException {
        Files.createDirectories(heartbeatDir);
        Map<String, String> env = new LinkedHashMap<>();
        Files.deleteIfExists(worker.stopSignalFile());
        env.put(STOP_SIGNAL_ENV, worker.stopSignalFile().toAbsolutePath().toString());
        if (worker.heartbeatEnabled()) {
            Path beat = worker.heartbeatFile();
            Files.deleteIfExists(beat);
            Files.createFile(beat);
            env.put(HEARTBEAT_ENV, beat.toAbsolutePath().toString());
        }
        return env;
    }

    /**
     * Returns whether the named worker's process is alive and, if heartbeat is enabled, not hung.
     * A hung worker is force-stopped as a side effect.
     */
    public boolean isAlive(String name) {
        lock.lock();
        try {
            WorkerProcess worker = workers.get(name);
            return worker != null && isAlive(worker);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Alive iff the OS reports the process alive and the heartbeat marker (when enabled) was
     * touched less than the staleness window ago. A missing or unreadable marker counts as alive.
     * Caller holds the lock.
     */
    boolean isAlive(WorkerProcess worker) {
        Process process = worker.process();
        if (process == null || !process.isAlive()) {
            return false;
        }
        if (!worker.heartbeatEnabled()) {
            return true;
        }
        Path beat = worker.heartbeatFile();
        try {
            Instant lastBeat = Files.getLastModifiedTime(beat).toInstant();
            Duration silence = Duration.between(lastBeat, clock.instant());
            if (silence.compareTo(heartbeatStaleness) >= 0) {
                LOG.error("Zombie detected: worker '{}' (PID {}) silent for {}s; killing",
                        worker.name(), process.pid(), silence.toSeconds());
                terminate(process);
                return false;
            }
        } catch (NoSuchFileException e) {
            LOG.debug("Heartbeat marker missing for '{}'; assuming alive", worker.name());
        } catch (IOException e) {
            LOG.debug("Heartbeat marker unreadable for '{}': {}", worker.name(), e.toString());
        }
        return true;
    }

    private void watchdogLoop() {
        while (running) {
            try {
                Thread.sleep(watchdogInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running) {
                break;
            }
            try {
                runWatchdogPass();
            } catch (RuntimeException e) {
                LOG.error("Watchdog pass failed: {}", e.toString(), e);
            }
        }
        LOG.debug("Watchdog loop exited");
    }

    /**
     * One watchdog pass over all RUNNING workers, plus RESTARTING workers awaiting a respawn.
     * No respawn happens once shutdown has begun.
     */
    void runWatchdogPass() {
        List<WorkerFailedEvent> failures = new ArrayList<>();
        lock.lock();
        try {
            for (WorkerProcess worker : workers.values()) {
                WorkerState state = worker.state();
                if (state != WorkerState.RUNNING && state != WorkerState.RESTARTING) {
                    continue;
                }
                SupervisorLogging.enter(worker.name());
                try {
                    if (state == WorkerState.RESTARTING) {
                        retryRespawn(worker, failures);
                    } else if (!isAlive(worker)) {
                        handleDeath(worker, failures);
                    }
                } finally {
                    SupervisorLogging.leave();
                }
            }
        } finally {
            lock.unlock();
        }
        failures.forEach(publisher::publishEvent);
    }

    private void handleDeath(WorkerProcess worker, List<WorkerFailedEvent> failures) {
        int restarts = worker.incrementRestarts();
        metrics.increment(WORKER_RESTARTS);
        LOG.warn("Worker '{}' (PID {}) died; restart {}/{}",
                worker.name(), worker.pid(), restarts, worker.maxRestarts());
        worker.transitionTo(WorkerState.RESTARTING);
        if (worker.restartCeilingReached()) {
            worker.markFailed();
            updateActiveGauge();
            LOG.error("Worker '{}' reached its restart limit ({}); marked FAILED",
                    worker.name(), worker.maxRestarts());
            failures.add(new WorkerFailedEvent(worker.name(), restarts, "restart limit reached", clock.instant()));
            return;
        }
        if (shuttingDown()) {
            // left RESTARTING with its handle; stopAll reaps it
            LOG.info("Supervisor shutting down; not respawning '{}'", worker.name());
            return;
        }
        if (!spawn(worker)) {
            failures.add(new WorkerFailedEvent(worker.name(), restarts, "respawn failed", clock.instant()));
        }
    }

    private boolean shuttingDown() {
        return !running || Thread.currentThread().isInterrupted();
    }

    /**
     * Respawns a worker left RESTARTING by an earlier pass once its old process is gone.
     * Does not count as another restart.
     */
    private void retryRespawn(WorkerProcess worker, List<WorkerFailedEvent> failures) {
        if (shuttingDown() || worker.hasLiveProcess()) {
            return;
        }
        if (!spawn(worker)) {
            failures.add(new WorkerFailedEvent(worker.name(), worker.restartCount(), "respawn failed",
                    clock.instant()));
        }
    }

    /**
     * Sends SIGSTOP to a RUNNING non-essential worker.
     *
     * @return true if the worker is now PAUSED
     */
    public boolean pause(String name) {
        lock.lock();
        try {
            WorkerProcess worker = workers.get(name);
            if (worker == null) {
                LOG.warn("Worker '{}' not found", name);
                return false;
            }
            if (worker.essential()) {
                LOG.warn("Worker '{}' is essential and cannot be paused", name);
                return false;
            }
            if (worker.state() != WorkerState.RUNNING || worker.pid() == null) {
                return false;
            }
            signaller.send(worker.pid(), ProcessSignaller.Signal.STOP);
            worker.transitionTo(WorkerState.PAUSED);
            updateActiveGauge();
            LOG.info("Worker '{}' paused (PID {})", name, worker.pid());
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to pause '{}': {}", name, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends SIGCONT to a PAUSED worker. The heartbeat marker is refreshed so the time spent
     * paused does not count as a hang.
     *
     * @return true if the worker is RUNNING again
     */
    public boolean resume(String name) {
        lock.lock();
        try {
            WorkerProcess worker = workers.get(name);
            if (worker == null || worker.state() != WorkerState.PAUSED || worker.pid() == null) {
                return false;
            }
            signaller.send(worker.pid(), ProcessSignaller.Signal.CONT);
            worker.transitionTo(WorkerState.RUNNING);
            refreshHeartbeat(worker);
            updateActiveGauge();
            LOG.info("Worker '{}' resumed (PID {})", name, worker.pid());
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to resume '{}': {}", name, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void refreshHeartbeat(WorkerProcess worker) {
        if (!worker.heartbeatEnabled()) {
            return;
        }
        try {
            Files.setLastModifiedTime(worker.heartbeatFile(), FileTime.from(clock.instant()));
        } catch (IOException e) {
            LOG.debug("Could not refresh heartbeat of '{}': {}", worker.name(), e.toString());
        }
    }

    /**
     * Stops one worker. Never throws.
     *
     * @return false if the worker is unknown
     */
    public boolean stop(String name) {
        lock.lock();
        try {
            WorkerProcess worker = workers.get(name);
            if (worker == null) {
                return false;
            }
            stopWorker(worker);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the watchdog and every worker.
     */
    public void stopAll() {
        Thread watchdog;
        synchronized (this) {
            running = false;
            watchdog = watchdogThread;
            watchdogThread = null;
        }
        if (watchdog != null) {
            watchdog.interrupt();
        }
        lock.lock();
        try {
            workers.values().forEach(this::stopWorker);
        } finally {
            lock.unlock();
        }
        if (watchdog != null) {
            try {
                watchdog.join(ProcessTimeouts.loopJoinTimeout(watchdogInterval).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("All workers stopped");
    }

    /**
     * Signals, terminates and forgets the worker's process; live states end in STOPPED.
     * Caller holds the lock.
     */
    private void stopWorker(WorkerProcess worker) {
        SupervisorLogging.enter(worker.name());
        try {
            Process process = worker.process();
            if (process != null && process.isAlive()) {
                touchStopSignal(worker);
                if (worker.state() == WorkerState.PAUSED) {
                    // a stopped process does not act on SIGTERM until continued
                    continueQuietly(worker);
                }
                terminate(process);
            }
            if (worker.state().holdsProcess()) {
                worker.markStopped();
                updateActiveGauge();
                LOG.info("Worker '{}' stopped", worker.name());
            }
            joinDrainers(worker);
        } catch (RuntimeException e) {
            LOG.warn("Error while stopping '{}': {}", worker.name(), e.toString());
        } finally {
            deleteQuietly(worker.heartbeatFile());
            deleteQuietly(worker.stopSignalFile());
            SupervisorLogging.leave();
        }
    }

    private void touchStopSignal(WorkerProcess worker) {
        try {
            Files.createDirectories(heartbeatDir);
            if (!Files.exists(worker.stopSignalFile())) {
                Files.createFile(worker.stopSignalFile());
            }
        } catch (IOException e) {
            LOG.debug("Could not write stop signal for '{}': {}", worker.name(), e.toString());
        }
    }

    private void continueQuietly(WorkerProcess worker) {
        try {
            signaller.send(worker.pid(), ProcessSignaller.Signal.CONT);
        } catch (IOException e) {
            LOG.debug("SIGCONT before stop failed for '{}': {}", worker.name(), e.getMessage());
        }
    }

    private void joinDrainers(WorkerProcess worker) {
        for (Thread drainer : worker.drainers()) {
            try {
                drainer.join(ProcessTimeouts.DRAINER_CLEANUP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", path, e.toString());
        }
    }

    private void terminate(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process {} still alive after destroyForcibly", process.pid());
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process {}; sent SIGKILL", process.pid());
        }
    }

    private void updateActiveGauge() {
        long active = workers.values().stream()
                .filter(w -> w.state() == WorkerState.RUNNING)
                .count();
        metrics.gauge(WORKERS_ACTIVE, active);
    }

    /**
     * Names of non-essential workers currently RUNNING (candidates for overheat pausing).
     */
    public List<String> nonEssentialRunningNames() {
        return namesMatching(w -> !w.essential() && w.state() == WorkerState.RUNNING);
    }

    public List<String> pausedNames() {
        return namesMatching(w -> w.state() == WorkerState.PAUSED);
    }

    public List<String> failedNames() {
        return namesMatching(w -> w.state() == WorkerState.FAILED);
    }

    private List<String> namesMatching(Predicate<WorkerProcess> filter) {
        lock.lock();
        try {
            return workers.values().stream()
                    .filter(filter)
                    .map(WorkerProcess::name)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of every worker, in registration order.
     */
    public Map<String, WorkerStatus> status() {
        lock.lock();
        try {
            Map<String, WorkerStatus> snapshot = new LinkedHashMap<>();
            workers.forEach((name, worker) -> snapshot.put(name, worker.snapshot()));
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public boolean isWatchdogRunning() {
        return running;
    }
}
