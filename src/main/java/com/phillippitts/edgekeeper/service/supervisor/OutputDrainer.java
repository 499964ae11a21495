package com.phillippitts.edgekeeper.service.supervisor;

import com.phillippitts.edgekeeper.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains one output stream of a worker so the child never blocks on a full pipe.
 *
 * <p>Lines are logged at DEBUG under the worker's name. Each line is truncated and the total
 * logged volume is capped; once the cap is hit the stream is still read to the end but
 * further output is discarded.
 */
final class OutputDrainer implements Runnable {

    private static final Logger LOG = LogManager.getLogger(OutputDrainer.class);

    static final int MAX_LINE_CHARS = 500;
    static final long MAX_LOGGED_CHARS = 1_000_000L;

    private final InputStream inputStream;
    private final String workerName;
    private final String streamName;

    OutputDrainer(InputStream inputStream, String workerName, String streamName) {
        this.inputStream = inputStream;
        this.workerName = workerName;
        this.streamName = streamName;
    }

    /**
     * Starts a daemon thread draining {@code inputStream}.
     */
    static Thread start(InputStream inputStream, String workerName, String streamName) {
        Thread thread = new Thread(new OutputDrainer(inputStream, workerName, streamName),
                "worker-" + workerName + "-" + streamName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        ThreadContext.put(SupervisorLogging.WORKER_KEY, workerName);
        long logged = 0;
        boolean capReached = false;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                if (logged >= MAX_LOGGED_CHARS) {
                    if (!capReached) {
                        LOG.warn("Worker {} {} reached {} chars; discarding further output",
                                workerName, streamName, MAX_LOGGED_CHARS);
                        capReached = true;
                    }
                    continue; // Drain without logging
                }
                String safe = LogSanitizer.stripControl(LogSanitizer.truncate(line, MAX_LINE_CHARS));
                logged += safe.length();
                LOG.debug("[{}] {}", streamName, safe);
            }
        } catch (IOException e) {
            LOG.debug("Output drainer for {} {} stopped: {}", workerName, streamName, e.toString());
        } finally {
            ThreadContext.remove(SupervisorLogging.WORKER_KEY);
        }
    }
}
