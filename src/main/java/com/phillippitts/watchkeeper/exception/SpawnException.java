package com.phillippitts.watchkeeper.exception;

/**
 * Thrown when a watcher fails to start one of its processes (exec failure, permission,
 * resource exhaustion, or the child dying before it was confirmed).
 */
public class SpawnException extends WatchkeeperException {

    private final String watcherName;

    public SpawnException(String watcherName, String message) {
        super(message + " (watcher: " + watcherName + ")");
        this.watcherName = watcherName;
    }

    public SpawnException(String watcherName, String message, Throwable cause) {
        super(message + " (watcher: " + watcherName + ")", cause);
        this.watcherName = watcherName;
    }

    public String getWatcherName() {
        return watcherName;
    }
}
