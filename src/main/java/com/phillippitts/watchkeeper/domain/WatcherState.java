package com.phillippitts.watchkeeper.domain;

/**
 * Lifecycle states of a watcher.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 * RUNNING → RECONCILING → RUNNING
 * </pre>
 */
public enum WatcherState {
    STOPPED,
    STARTING,
    RUNNING,
    RECONCILING,
    STOPPING;

    /** True for every state in which the watcher owns (or is acquiring) live processes. */
    public boolean isActive() {
        return this != STOPPED;
    }
}
