package com.phillippitts.watchkeeper.service.spawn;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} so watchers can be tested without real children.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a scripted
 * implementation returning fake {@link Process} instances with controlled exit behavior.
 */
public interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, with the executable as the first element
     * @param env extra environment entries layered over the daemon's own environment
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Map<String, String> env, Path workingDir) throws IOException;
}
