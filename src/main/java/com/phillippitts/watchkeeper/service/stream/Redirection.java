package com.phillippitts.watchkeeper.service.stream;

/**
 * Descriptors registered for one child process.
 *
 * @param stdoutFd descriptor bound to the child's stdout
 * @param stderrFd descriptor bound to the child's stderr
 */
public record Redirection(int stdoutFd, int stderrFd) {
}
