package com.phillippitts.edgekeeper.service.supervisor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} so the supervisor can be tested without real binaries.
 *
 * <p>Production code uses {@link DefaultProcessFactory}.
 */
public interface ProcessFactory {
    /**
     * Starts a new process. The command is an argv list and is never passed through a shell.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @param environment variables added to the inherited environment
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;
}
