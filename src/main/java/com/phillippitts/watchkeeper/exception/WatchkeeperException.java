package com.phillippitts.watchkeeper.exception;

/**
 * Base exception for all watchkeeper-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class WatchkeeperException extends RuntimeException {

    public WatchkeeperException(String message) {
        super(message);
    }

    public WatchkeeperException(String message, Throwable cause) {
        super(message, cause);
    }

    public WatchkeeperException(Throwable cause) {
        super(cause);
    }
}
