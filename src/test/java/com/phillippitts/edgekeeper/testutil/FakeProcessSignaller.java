package com.phillippitts.edgekeeper.testutil;

import com.phillippitts.edgekeeper.service.supervisor.ProcessSignaller;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records signals instead of delivering them. Can be told to fail.
 */
public class FakeProcessSignaller implements ProcessSignaller {

    /** One recorded call. */
    public record Sent(long pid, Signal signal) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void send(long pid, Signal signal) throws IOException {
        if (failing) {
            throw new IOException("kill -" + signal + " " + pid + " exited with 1: No such process");
        }
        sent.add(new Sent(pid, signal));
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<Signal> signals() {
        return sent.stream().map(Sent::signal).toList();
    }
}
