package com.phillippitts.watchkeeper.service.watcher.event;

import com.phillippitts.watchkeeper.domain.WatcherState;

import java.time.Instant;

/**
 * Published when a watcher moves between lifecycle states (reconcile passes excluded).
 */
public record WatcherStateChangedEvent(
        String watcher,
        WatcherState from,
        WatcherState to,
        Instant at
) {
    public WatcherStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
