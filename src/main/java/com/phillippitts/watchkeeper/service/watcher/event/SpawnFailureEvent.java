package com.phillippitts.watchkeeper.service.watcher.event;

import java.time.Instant;

/**
 * Published when a process slot is abandoned after all spawn attempts failed.
 * The watcher keeps running in degraded state.
 */
public record SpawnFailureEvent(
        String watcher,
        int attempts,
        String message,
        Instant at
) {
    public SpawnFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
