package com.phillippitts.edgekeeper.service.supervisor;

import com.phillippitts.edgekeeper.util.LogSanitizer;
import com.phillippitts.edgekeeper.util.ProcessTimeouts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessSignaller} that runs {@code kill -STOP|-CONT <pid>} as an argv list.
 *
 * <p>The JDK has no portable SIGSTOP/SIGCONT API, so this relies on a POSIX {@code kill} binary.
 */
public final class KillCommandSignaller implements ProcessSignaller {

    private static final int STDERR_SNIPPET_CHARS = 200;

    private final ProcessFactory processFactory;

    public KillCommandSignaller() {
        this(new DefaultProcessFactory());
    }

    KillCommandSignaller(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /** Visible for tests */
    static List<String> command(long pid, Signal signal) {
        return List.of("kill", "-" + signal.name(), Long.toString(pid));
    }

    @Override
    public void send(long pid, Signal signal) throws IOException {
        Process kill = processFactory.start(command(pid, signal), null, Map.of());
        try {
            kill.getOutputStream().close();
            if (!kill.waitFor(ProcessTimeouts.SIGNAL_COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                throw new IOException("kill -" + signal + " " + pid + " timed out");
            }
            if (kill.exitValue() != 0) {
                String stderr = new String(kill.getErrorStream().readAllBytes(), StandardCharsets.UTF_8).trim();
                throw new IOException("kill -" + signal + " " + pid + " exited with " + kill.exitValue()
                        + ": " + LogSanitizer.truncate(stderr, STDERR_SNIPPET_CHARS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill.destroyForcibly();
            throw new IOException("Interrupted while signalling " + pid, e);
        }
    }
}
