package com.phillippitts.watchkeeper.service.watcher.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when a process ignored termination for its whole graceful window and is being
 * force-killed.
 */
public record ShutdownTimeoutEvent(
        String watcher,
        long pid,
        Duration gracefulTimeout,
        Instant at
) {
    public ShutdownTimeoutEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
