package com.phillippitts.watchkeeper.exception;

/**
 * The handler ledger and the event loop disagree about a descriptor and verification could
 * not bring them back in line. Not recoverable locally; the daemon shuts down.
 */
public class LedgerDivergenceException extends WatchkeeperException {

    private final int descriptor;

    public LedgerDivergenceException(int descriptor, String message, Throwable cause) {
        super(message + " (fd: " + descriptor + ")", cause);
        this.descriptor = descriptor;
    }

    public int getDescriptor() {
        return descriptor;
    }
}
