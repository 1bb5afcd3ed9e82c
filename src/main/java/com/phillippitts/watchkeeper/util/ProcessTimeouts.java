package com.phillippitts.watchkeeper.util;

import java.time.Duration;

/**
 * Fixed timeout values for process management that are not per-watcher configuration.
 *
 * <p>The graceful stop window is configured per watcher ({@code graceful-timeout-ms}); the
 * values here bound what happens after it expires.
 *
 * @see com.phillippitts.watchkeeper.service.watcher.Watcher
 */
public final class ProcessTimeouts {

    /**
     * Wait after {@link Process#destroyForcibly()}.
     *
     * <p>1000ms is the OS-level deadline for SIGKILL delivery. Processes that survive this are
     * typically stuck in uninterruptible I/O and are reported, not waited on.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
