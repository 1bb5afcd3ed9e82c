package com.phillippitts.watchkeeper.exception;

/**
 * Thrown when the exclusive command gate could not be acquired within its bounded wait.
 * Callers may retry with backoff or report "busy" to their own caller.
 */
public class GateBusyException extends WatchkeeperException {

    private final String requestedCommand;
    private final String activeCommand;

    public GateBusyException(String requestedCommand, String activeCommand) {
        super(buildMessage(requestedCommand, activeCommand));
        this.requestedCommand = requestedCommand;
        this.activeCommand = activeCommand;
    }

    public GateBusyException(String requestedCommand, String activeCommand, Throwable cause) {
        super(buildMessage(requestedCommand, activeCommand), cause);
        this.requestedCommand = requestedCommand;
        this.activeCommand = activeCommand;
    }

    private static String buildMessage(String requested, String active) {
        return "Cannot run '" + requested + "': command '"
                + (active == null ? "unknown" : active) + "' is in progress";
    }

    public String getRequestedCommand() {
        return requestedCommand;
    }

    /**
     * @return name of the command holding the gate, or {@code null} if it was released
     *         between the failed attempt and the snapshot
     */
    public String getActiveCommand() {
        return activeCommand;
    }
}
