package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.BufferedRecord;
import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.resilience.CircuitBreakerGate;
import com.phillippitts.edgekeeper.service.resilience.CircuitState;
import com.phillippitts.edgekeeper.service.resilience.Resilience4jCircuitBreakerGate;
import com.phillippitts.edgekeeper.testutil.FakeCircuitBreakerGate;
import com.phillippitts.edgekeeper.testutil.RecordingTransport;
import com.phillippitts.edgekeeper.testutil.RecordingTransport.Outcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelemetryClientTest {

    private static final RetryBackoff NO_DELAY = new RetryBackoff(3, Duration.ZERO);

    @TempDir
    Path tmp;

    private TelemetryBuffer buffer;
    private RuntimeMetrics metrics;
    private FakeCircuitBreakerGate gate;

    @BeforeEach
    void setUp() {
        buffer = new TelemetryBuffer(tmp.resolve("buffer.db"), 100);
        metrics = new RuntimeMetrics(new SimpleMeterRegistry());
        gate = new FakeCircuitBreakerGate();
    }

    @AfterEach
    void tearDown() {
        buffer.close();
    }

    private TelemetryClient client(TelemetryTransport transport, CircuitBreakerGate circuit, RetryBackoff backoff) {
        return client(buffer, transport, circuit, backoff, 10);
    }

    private TelemetryClient client(TelemetryBuffer store, TelemetryTransport transport, CircuitBreakerGate circuit,
                                   RetryBackoff backoff, int batchSize) {
        return new TelemetryClient("edge-test", "https://collector.example/telemetry", store, transport,
                circuit, metrics, backoff, Duration.ofMillis(50), batchSize);
    }

    private static Map<String, Object> reading(double value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sensor", "temp");
        data.put("value", value);
        return data;
    }

    @Test
    void deliversWhenCollectorAccepts() {
        RecordingTransport transport = RecordingTransport.accepting();
        TelemetryClient client = client(transport, gate, NO_DELAY);

        boolean sent = client.send(reading(21.5));

        assertThat(sent).isTrue();
        assertThat(transport.calls()).isEqualTo(1);
        assertThat(transport.received().get(0).deviceId()).isEqualTo("edge-test");
        assertThat(buffer.count()).isZero();
        assertThat(gate.successes()).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.SENT_OK)).isEqualTo(1);
    }

    @Test
    void openCircuitBuffersExactlyOnceWithoutCallingTransport() {
        TelemetryBuffer store = mock(TelemetryBuffer.class);
        when(store.insert(anyString())).thenReturn(true);
        RecordingTransport transport = RecordingTransport.accepting();
        gate.setState(CircuitState.OPEN);
        TelemetryClient client = client(store, transport, gate, NO_DELAY, 10);

        boolean sent = client.send(reading(1.0));

        assertThat(sent).isFalse();
        verify(store, times(1)).insert(anyString());
        assertThat(transport.calls()).isZero();
        assertThat(metrics.counter(TelemetryClient.CIRCUIT_OPEN)).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.BUFFERED)).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.SEND_FAILED)).isZero();
    }

    @Test
    void buffersAfterAllAttemptsFail() {
        RecordingTransport transport = RecordingTransport.failing();
        TelemetryClient client = client(transport, gate, NO_DELAY);

        boolean sent = client.send(reading(2.0));

        assertThat(sent).isFalse();
        assertThat(transport.calls()).isEqualTo(3);
        assertThat(gate.failures()).isEqualTo(3);
        assertThat(buffer.count()).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.SEND_FAILED)).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.BUFFERED)).isEqualTo(1);
    }

    @Test
    void succeedsOnLaterAttempt() {
        RecordingTransport transport = RecordingTransport.accepting().then(Outcome.IO_ERROR, Outcome.TIMEOUT);
        TelemetryClient client = client(transport, gate, new RetryBackoff(3, Duration.ofMillis(5)));

        assertThat(client.send(reading(3.0))).isTrue();
        assertThat(transport.calls()).isEqualTo(3);
        assertThat(gate.failures()).isEqualTo(2);
        assertThat(gate.successes()).isEqualTo(1);
        assertThat(transport.received()).extracting(TelemetryPayload::payloadId).containsOnly(
                transport.received().get(0).payloadId());
    }

    @Test
    void rejectedPayloadCountsAsFailure() {
        RecordingTransport transport = new RecordingTransport(Outcome.REJECT);
        TelemetryClient client = client(transport, gate, new RetryBackoff(1, Duration.ZERO));

        assertThat(client.send(reading(4.0))).isFalse();
        assertThat(gate.failures()).isEqualTo(1);
        assertThat(buffer.count()).isEqualTo(1);
    }

    @Test
    void circuitOpeningDuringRetriesStopsFurtherAttempts() {
        RecordingTransport transport = RecordingTransport.failing();
        CircuitBreakerGate breaker = new Resilience4jCircuitBreakerGate("retry-test", 2, 1, Duration.ofMinutes(1));
        TelemetryClient client = client(transport, breaker, NO_DELAY);

        assertThat(client.send(reading(5.0))).isFalse();

        assertThat(transport.calls()).isEqualTo(2);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(buffer.count()).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.CIRCUIT_OPEN)).isEqualTo(1);
    }

    @Test
    void unexpectedErrorBuffersWithoutTrippingCircuit() {
        TelemetryTransport broken = payload -> {
            throw new IllegalStateException("serializer bug");
        };
        TelemetryClient client = client(broken, gate, NO_DELAY);

        assertThat(client.send(reading(6.0))).isFalse();
        assertThat(gate.failures()).isZero();
        assertThat(buffer.count()).isEqualTo(1);
        assertThat(metrics.counter(TelemetryClient.SEND_FAILED)).isEqualTo(1);
    }

    @Test
    void flushRedeliversBufferedPayloadUnchanged() {
        RecordingTransport transport = RecordingTransport.failing();
        TelemetryClient client = client(transport, gate, new RetryBackoff(1, Duration.ZERO));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("value", 21.5);
        data.put("count", 3);
        data.put("tags", List.of("a", "b"));
        data.put("nested", Map.of("ok", true));
        client.send(data);
        TelemetryPayload original = transport.received().get(0);

        transport.setDefaultOutcome(Outcome.ACCEPT);
        int flushed = client.flush();

        assertThat(flushed).isEqualTo(1);
        assertThat(buffer.count()).isZero();
        TelemetryPayload redelivered = transport.received().get(1);
        assertThat(redelivered).isEqualTo(original);
        assertThat(metrics.counter(TelemetryClient.FLUSHED)).isEqualTo(1);
    }

    @Test
    void flushKeepsWholeDoublesLongsAndNulls() {
        RecordingTransport transport = RecordingTransport.failing();
        TelemetryClient client = client(transport, gate, new RetryBackoff(1, Duration.ZERO));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("temperature", 80.0);
        data.put("uptime_ms", 5L);
        data.put("pid", null);
        data.put("workers", Map.of("analytics", Map.of("cpu_percent", 12.0)));
        client.send(data);
        TelemetryPayload original = transport.received().get(0);

        transport.setDefaultOutcome(Outcome.ACCEPT);
        client.flush();

        TelemetryPayload redelivered = transport.received().get(1);
        assertThat(redelivered).isEqualTo(original);
        assertThat(redelivered.data().get("temperature")).isInstanceOf(Double.class).isEqualTo(80.0);
        assertThat(redelivered.data()).containsEntry("pid", null);
    }

    @Test
    void flushIsSkippedWhileCircuitOpen() {
        RecordingTransport transport = RecordingTransport.accepting();
        gate.setState(CircuitState.OPEN);
        TelemetryClient client = client(transport, gate, NO_DELAY);
        client.send(reading(7.0));

        assertThat(client.flush()).isZero();
        assertThat(transport.calls()).isZero();
        assertThat(buffer.count()).isEqualTo(1);
    }

    @Test
    void flushStopsWhenCircuitOpensMidBatch() {
        for (int i = 0; i < 3; i++) {
            buffer.insert(PayloadCodec.encode(TelemetryPayload.create("edge-test", reading(i))));
        }
        RecordingTransport transport = RecordingTransport.failing();
        CircuitBreakerGate breaker = new Resilience4jCircuitBreakerGate("flush-test", 1, 1, Duration.ofMinutes(1));
        TelemetryClient client = client(transport, breaker, new RetryBackoff(1, Duration.ZERO));

        assertThat(client.flush()).isZero();
        assertThat(transport.calls()).isEqualTo(1);
        assertThat(buffer.count()).isEqualTo(3);
    }

    @Test
    void flushLeavesUndecodableRecordsInPlace() {
        buffer.insert("not json");
        buffer.insert(PayloadCodec.encode(TelemetryPayload.create("edge-test", reading(8.0))));
        RecordingTransport transport = RecordingTransport.accepting();
        TelemetryClient client = client(transport, gate, NO_DELAY);

        assertThat(client.flush()).isEqualTo(1);
        assertThat(buffer.oldest(10)).extracting(BufferedRecord::payloadJson).containsExactly("not json");
    }

    @Test
    void flushHonoursBatchSize() {
        for (int i = 0; i < 5; i++) {
            buffer.insert(PayloadCodec.encode(TelemetryPayload.create("edge-test", reading(i))));
        }
        TelemetryClient client = client(buffer, RecordingTransport.accepting(), gate, NO_DELAY, 2);

        assertThat(client.flush()).isEqualTo(2);
        assertThat(buffer.count()).isEqualTo(3);
    }

    @Test
    void backgroundLoopDrainsBufferOnceCollectorIsBack() {
        RecordingTransport transport = RecordingTransport.failing();
        TelemetryClient client = client(transport, gate, new RetryBackoff(1, Duration.ZERO));
        client.send(reading(9.0));
        client.send(reading(10.0));
        assertThat(client.bufferedCount()).isEqualTo(2);

        client.start();
        assertThat(client.isRunning()).isTrue();
        transport.setDefaultOutcome(Outcome.ACCEPT);

        await().atMost(5, TimeUnit.SECONDS).until(() -> client.bufferedCount() == 0);
        client.stop();
        assertThat(client.isRunning()).isFalse();
        assertThat(metrics.counter(TelemetryClient.FLUSHED)).isEqualTo(2);
    }

    @Test
    void statsReflectCounters() {
        RecordingTransport transport = RecordingTransport.accepting().then(Outcome.IO_ERROR);
        TelemetryClient client = client(transport, gate, new RetryBackoff(1, Duration.ZERO));
        client.send(reading(1.0));
        client.send(reading(2.0));

        TelemetryStats stats = client.stats();

        assertThat(stats.deviceId()).isEqualTo("edge-test");
        assertThat(stats.sentOk()).isEqualTo(1);
        assertThat(stats.sendFailed()).isEqualTo(1);
        assertThat(stats.buffered()).isEqualTo(1);
        assertThat(stats.bufferedCount()).isEqualTo(1);
        assertThat(stats.circuitState()).isEqualTo(CircuitState.CLOSED);
        assertThat(stats.toMap()).containsEntry("circuit_state", "CLOSED").containsEntry("sent_ok", 1L);
    }
}
