package com.phillippitts.edgekeeper.service.supervisor;

import java.io.IOException;

/**
 * Delivers job-control signals to worker processes.
 */
public interface ProcessSignaller {

    /** Signals used to pause and resume workers. */
    enum Signal { STOP, CONT }

    /**
     * Sends {@code signal} to the process {@code pid}.
     *
     * @throws IOException if the signal could not be delivered
     */
    void send(long pid, Signal signal) throws IOException;
}
