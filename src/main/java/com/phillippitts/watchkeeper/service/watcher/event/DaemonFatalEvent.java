package com.phillippitts.watchkeeper.service.watcher.event;

import java.time.Instant;

/**
 * Published when an internal invariant is violated beyond local recovery. The daemon stops its
 * watchers and exits.
 */
public record DaemonFatalEvent(
        String reason,
        Throwable cause,
        Instant at
) {
    public DaemonFatalEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
