package com.phillippitts.watchkeeper.service.signal;

/**
 * Daemon response bound to a signal name via {@code watchkeeper.signals.actions.<NAME>}.
 */
public enum SignalAction {
    /** Stop every watcher, then exit the daemon. */
    QUIT,
    /** Gracefully restart every running watcher. */
    RELOAD,
    /** Reap exited processes of all watchers. */
    REAP,
    /** Log and do nothing. */
    IGNORE
}
