package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.BufferedRecord;
import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import com.phillippitts.edgekeeper.exception.CircuitOpenException;
import com.phillippitts.edgekeeper.exception.PayloadCodecException;
import com.phillippitts.edgekeeper.exception.TelemetryDeliveryException;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.resilience.CircuitBreakerGate;
import com.phillippitts.edgekeeper.service.resilience.CircuitState;
import com.phillippitts.edgekeeper.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Store-and-forward telemetry channel.
 *
 * <p>{@link #send(Map)} delivers a payload through the circuit breaker with exponential retry.
 * When the circuit is open or every attempt failed, the payload goes to the
 * {@link TelemetryBuffer}; a background flush loop re-delivers buffered payloads oldest first
 * once the circuit admits calls again.
 *
 * <p>Counters: {@code telemetry_sent_ok}, {@code telemetry_send_failed},
 * {@code telemetry_circuit_open}, {@code telemetry_buffered}, {@code telemetry_flushed}.
 */
public class TelemetryClient {

    private static final Logger LOG = LogManager.getLogger(TelemetryClient.class);

    static final String SENT_OK = "telemetry_sent_ok";
    static final String SEND_FAILED = "telemetry_send_failed";
    static final String CIRCUIT_OPEN = "telemetry_circuit_open";
    static final String BUFFERED = "telemetry_buffered";
    static final String FLUSHED = "telemetry_flushed";

    private final String deviceId;
    private final String endpoint;
    private final TelemetryBuffer buffer;
    private final TelemetryTransport transport;
    private final CircuitBreakerGate circuit;
    private final RuntimeMetrics metrics;
    private final RetryBackoff backoff;
    private final Duration flushInterval;
    private final int flushBatchSize;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private Thread flushThread;

    public TelemetryClient(String deviceId,
                           String endpoint,
                           TelemetryBuffer buffer,
                           TelemetryTransport transport,
                           CircuitBreakerGate circuit,
                           RuntimeMetrics metrics,
                           RetryBackoff backoff,
                           Duration flushInterval,
                           int flushBatchSize) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.circuit = Objects.requireNonNull(circuit, "circuit");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushBatchSize <= 0) {
            throw new IllegalArgumentException("flushBatchSize must be positive");
        }
        this.flushBatchSize = flushBatchSize;
    }

    /**
     * Sends telemetry data, buffering it locally if it cannot be delivered now.
     *
     * @param data telemetry content
     * @return true if delivered, false if buffered
     */
    public boolean send(Map<String, Object> data) {
        TelemetryPayload payload = TelemetryPayload.create(deviceId, data);
        try {
            deliver(payload);
            metrics.increment(SENT_OK);
            LOG.debug("Telemetry sent: {}", payload.payloadId());
            return true;
        } catch (CircuitOpenException e) {
            store(payload);
            metrics.increment(CIRCUIT_OPEN);
            LOG.warn("{}; telemetry buffered: {}", e.getMessage(), payload.payloadId());
            return false;
        } catch (TelemetryDeliveryException e) {
            store(payload);
            metrics.increment(SEND_FAILED);
            LOG.warn("Telemetry delivery failed; buffered {}: {}", payload.payloadId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            store(payload);
            metrics.increment(SEND_FAILED);
            LOG.error("Telemetry send aborted; buffered {}: {}", payload.payloadId(), e.toString(), e);
            return false;
        }
    }

    /**
     * Delivers one payload with retry. Each attempt asks the breaker first and reports its outcome.
     *
     * @throws CircuitOpenException if the breaker rejects an attempt (never retried)
     * @throws TelemetryDeliveryException if every attempt failed transiently
     */
    void deliver(TelemetryPayload payload) {
        Exception last = null;
        for (int attempt = 1; attempt <= backoff.maxAttempts(); attempt++) {
            if (!circuit.mayAttempt()) {
                throw new CircuitOpenException(circuitName());
            }
            try {
                if (transport.send(payload)) {
                    circuit.recordSuccess();
                    return;
                }
                last = new TelemetryDeliveryException("Collector rejected payload " + payload.payloadId());
            } catch (IOException | TimeoutException | UncheckedIOException | TelemetryDeliveryException e) {
                last = e;
            }
            circuit.recordFailure(last);
            if (backoff.hasNext(attempt)) {
                Duration delay = backoff.delayAfter(attempt);
                LOG.info("Attempt {}/{} failed: {}. Retrying in {} ms",
                        attempt, backoff.maxAttempts(), last.getMessage(), delay.toMillis());
                if (!sleep(delay)) {
                    throw new TelemetryDeliveryException("Interrupted while retrying " + payload.payloadId(), last);
                }
            }
        }
        throw new TelemetryDeliveryException(
                "All " + backoff.maxAttempts() + " attempts failed for " + payload.payloadId(), last);
    }

    private String circuitName() {
        return "telemetry-" + deviceId;
    }

    private void store(TelemetryPayload payload) {
        if (buffer.insert(PayloadCodec.encode(payload))) {
            metrics.increment(BUFFERED);
            LOG.debug("Payload buffered: {}", payload.payloadId());
        }
    }

    /**
     * Re-delivers up to one batch of buffered payloads, oldest first.
     *
     * <p>Skipped while the circuit is OPEN. A delivered record is deleted; an open circuit ends
     * the batch; any other failure (including an undecodable record) leaves the record in place.
     *
     * @return number of payloads delivered
     */
    public int flush() {
        if (circuit.state() == CircuitState.OPEN) {
            LOG.debug("Flush skipped: circuit open");
            return 0;
        }
        List<BufferedRecord> batch = buffer.oldest(flushBatchSize);
        if (batch.isEmpty()) {
            return 0;
        }
        int flushed = 0;
        for (BufferedRecord record : batch) {
            try {
                deliver(PayloadCodec.decode(record.payloadJson()));
                buffer.delete(record.id());
                metrics.increment(FLUSHED);
                flushed++;
            } catch (CircuitOpenException e) {
                LOG.info("Flush interrupted: {}", e.getMessage());
                break;
            } catch (PayloadCodecException e) {
                LOG.warn("Buffered record {} is undecodable: {}", record.id(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Flush failed for buffered record {}: {}", record.id(), e.getMessage());
            }
        }
        if (flushed > 0) {
            LOG.info("Flushed {} buffered payloads", flushed);
        }
        return flushed;
    }

    /**
     * Starts the background flush loop. Idempotent.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            running = true;
            flushThread = new Thread(this::flushLoop, "telemetry-flush");
            flushThread.setDaemon(true);
            flushThread.start();
            LOG.info("Telemetry client started: device={} endpoint={} flushInterval={}",
                    deviceId, endpoint, flushInterval);
        }
    }

    /**
     * Stops the flush loop and closes the buffer.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            running = false;
            thread = flushThread;
            flushThread = null;
        }
        if (thread != null) {
            thread.interrupt();
            joinQuietly(thread, ProcessTimeouts.loopJoinTimeout(flushInterval));
        }
        buffer.close();
        LOG.info("Telemetry client stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void flushLoop() {
        while (running) {
            if (!sleep(flushInterval) || !running) {
                break;
            }
            try {
                flush();
            } catch (RuntimeException e) {
                LOG.error("Flush loop error: {}", e.toString(), e);
            }
        }
    }

    public TelemetryStats stats() {
        return new TelemetryStats(
                deviceId,
                endpoint,
                circuit.state(),
                buffer.count(),
                buffer.path().toString(),
                metrics.counter(SENT_OK),
                metrics.counter(SEND_FAILED),
                metrics.counter(CIRCUIT_OPEN),
                metrics.counter(BUFFERED),
                metrics.counter(FLUSHED));
    }

    public CircuitState circuitState() {
        return circuit.state();
    }

    public long bufferedCount() {
        return buffer.count();
    }

    public String endpoint() {
        return endpoint;
    }

    public String deviceId() {
        return deviceId;
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
