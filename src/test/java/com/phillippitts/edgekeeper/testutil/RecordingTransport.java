package com.phillippitts.edgekeeper.testutil;

import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryTransport;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Scriptable transport. Each call consumes the next scripted outcome; once the script is empty
 * the default outcome applies. Every payload handed to {@link #send} is recorded.
 */
public class RecordingTransport implements TelemetryTransport {

    /** Outcome of one send attempt. */
    public enum Outcome { ACCEPT, REJECT, IO_ERROR, TIMEOUT }

    private final List<TelemetryPayload> received = new CopyOnWriteArrayList<>();
    private final Deque<Outcome> script = new ArrayDeque<>();
    private volatile Outcome defaultOutcome;

    public RecordingTransport(Outcome defaultOutcome) {
        this.defaultOutcome = defaultOutcome;
    }

    public static RecordingTransport accepting() {
        return new RecordingTransport(Outcome.ACCEPT);
    }

    public static RecordingTransport failing() {
        return new RecordingTransport(Outcome.IO_ERROR);
    }

    public synchronized RecordingTransport then(Outcome... outcomes) {
        script.addAll(List.of(outcomes));
        return this;
    }

    public void setDefaultOutcome(Outcome outcome) {
        this.defaultOutcome = outcome;
    }

    @Override
    public boolean send(TelemetryPayload payload) throws IOException, TimeoutException {
        received.add(payload);
        Outcome outcome;
        synchronized (this) {
            outcome = script.isEmpty() ? defaultOutcome : script.poll();
        }
        return switch (outcome) {
            case ACCEPT -> true;
            case REJECT -> false;
            case IO_ERROR -> throw new IOException("Connection refused");
            case TIMEOUT -> throw new TimeoutException("Read timed out");
        };
    }

    public List<TelemetryPayload> received() {
        return List.copyOf(received);
    }

    public int calls() {
        return received.size();
    }
}
