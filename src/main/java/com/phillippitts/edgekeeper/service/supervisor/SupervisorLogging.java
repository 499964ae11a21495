package com.phillippitts.edgekeeper.service.supervisor;

import org.apache.logging.log4j.ThreadContext;

/**
 * ThreadContext helpers so every log line about one worker carries {@code worker=<name>}.
 */
final class SupervisorLogging {

    static final String WORKER_KEY = "worker";

    private SupervisorLogging() {
    }

    static void enter(String workerName) {
        ThreadContext.put(WORKER_KEY, workerName);
    }

    static void leave() {
        ThreadContext.remove(WORKER_KEY);
    }
}
