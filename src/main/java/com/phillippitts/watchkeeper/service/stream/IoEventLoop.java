package com.phillippitts.watchkeeper.service.stream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Event loop owning the live descriptor-to-handler bindings.
 *
 * <p>Only {@link HandlerRegistry} calls the mutating methods; everything else goes through the
 * registry so its ledger stays in step with this loop.
 */
public interface IoEventLoop {

    /**
     * Binds a fresh handler.
     *
     * @throws IllegalStateException if {@code fd} is already bound
     */
    void add(int fd, InputStream source, StreamHandler handler);

    /**
     * Drops the binding for {@code fd} and closes its source.
     *
     * <p>Fallible: a failure may leave the binding in place or may have removed it anyway.
     * Callers verify with {@link #isBound(int)}.
     *
     * @throws IOException if the source could not be closed
     * @throws IllegalStateException if {@code fd} is not bound
     */
    void remove(int fd) throws IOException;

    /**
     * Overwrites whatever is bound to {@code fd} with a new binding.
     *
     * @throws IllegalStateException if the loop refuses to overwrite
     */
    void replace(int fd, InputStream source, StreamHandler handler);

    boolean isBound(int fd);
}
