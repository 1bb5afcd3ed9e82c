package com.phillippitts.watchkeeper.service.watcher;

/**
 * Follow-up a watcher asks for after a reconcile pass. The watcher never performs these itself;
 * the supervisor runs them through its gated start/stop entry points.
 */
enum ReconcileOutcome {
    NONE,
    /** On-demand watcher saw pending connections. */
    START,
    /** Non-respawning watcher has no live processes left. */
    STOP
}
