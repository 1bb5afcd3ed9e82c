package com.phillippitts.watchkeeper.exception;

/**
 * Thrown when a command names a watcher the supervisor does not manage.
 */
public class UnknownWatcherException extends WatchkeeperException {

    private final String watcherName;

    public UnknownWatcherException(String watcherName) {
        super("No watcher named '" + watcherName + "'");
        this.watcherName = watcherName;
    }

    public String getWatcherName() {
        return watcherName;
    }
}
