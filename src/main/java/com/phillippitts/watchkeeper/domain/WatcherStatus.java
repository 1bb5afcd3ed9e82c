package com.phillippitts.watchkeeper.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable status snapshot of a watcher, swapped atomically on every transition and readable
 * without acquiring the command gate.
 *
 * @param name             watcher name
 * @param state            lifecycle state
 * @param desired          desired process count
 * @param processes        live (not yet reaped) processes, oldest first
 * @param degraded         true once a process slot was abandoned after exhausting its retries;
 *                         cleared by an explicit start, restart or scale
 * @param lastError        message of the most recent spawn failure (nullable)
 * @param lastReconcileAt  last reconcile tick that visited this watcher (nullable)
 * @param updatedAt        when this snapshot was taken
 */
public record WatcherStatus(
        String name,
        WatcherState state,
        int desired,
        List<ProcessInfo> processes,
        boolean degraded,
        String lastError,
        Instant lastReconcileAt,
        Instant updatedAt
) {

    public WatcherStatus {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
        processes = List.copyOf(processes);
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static WatcherStatus initial(String name, int desired) {
        return new WatcherStatus(name, WatcherState.STOPPED, desired, List.of(), false, null, null, Instant.now());
    }

    public int live() {
        return processes.size();
    }

    /** Running at the desired count and not degraded. */
    public boolean isHealthy() {
        return state.isActive() && !degraded && processes.size() >= desired;
    }
}
