package com.phillippitts.watchkeeper.exception;

/**
 * Thrown when a descriptor is registered while the handler ledger still maps it to a live
 * binding.
 */
public class RegistrationConflictException extends WatchkeeperException {

    private final int descriptor;

    public RegistrationConflictException(int descriptor) {
        super("Descriptor " + descriptor + " is already registered");
        this.descriptor = descriptor;
    }

    public RegistrationConflictException(int descriptor, Throwable cause) {
        super("Descriptor " + descriptor + " is already registered", cause);
        this.descriptor = descriptor;
    }

    public int getDescriptor() {
        return descriptor;
    }
}
