package com.phillippitts.watchkeeper.service.stream;

import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.exception.RegistrationConflictException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ledger of descriptor-to-handler bindings, kept in step with the {@link IoEventLoop}.
 *
 * <p>Invariant: the ledger has an entry for {@code fd} if and only if the event loop has a live
 * binding for it. {@link #register} and {@link #unregister} are the only code paths that touch
 * either side.
 *
 * <p>Removal from the event loop is fallible. When it fails, the ledger entry is dropped only
 * after {@link IoEventLoop#isBound(int)} confirms the loop is clear. Otherwise the entry is kept
 * as <em>retained</em>: the descriptor counts as occupied, and a later registration of the same
 * (reused) number re-verifies the loop before binding, overwriting the stale binding if it is
 * still there.
 *
 * <p><b>Thread Safety:</b> register/unregister are synchronized on the registry; each runs its
 * event loop calls and ledger update as one step.
 */
@Component
public class HandlerRegistry {

    private static final Logger LOG = LogManager.getLogger(HandlerRegistry.class);

    private final IoEventLoop loop;
    private final Map<Integer, Registration> ledger = new HashMap<>();

    public HandlerRegistry(IoEventLoop loop) {
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    /**
     * Binds {@code handler} to {@code fd}.
     *
     * @throws RegistrationConflictException if the ledger maps {@code fd} to a confirmed binding
     * @throws LedgerDivergenceException if a stale binding is still live and the event loop
     *         refuses to overwrite it
     */
    public synchronized void register(int fd, InputStream source, StreamHandler handler) {
        Registration existing = ledger.get(fd);
        if (existing != null && !existing.retained()) {
            throw new RegistrationConflictException(fd);
        }
        if (existing != null) {
            LOG.info("fd {} reused while its previous binding is unconfirmed; re-verifying event loop", fd);
            retryRemoval(fd);
            if (!loop.isBound(fd)) {
                ledger.remove(fd);
            }
        }

        if (loop.isBound(fd)) {
            if (existing == null) {
                LOG.warn("fd {} bound in event loop without a ledger entry; overwriting", fd);
            }
            try {
                loop.replace(fd, source, handler);
            } catch (RuntimeException e) {
                throw new LedgerDivergenceException(fd,
                        "Event loop still holds a stale binding and refused to overwrite it", e);
            }
            LOG.debug("fd {} stale binding overwritten", fd);
        } else {
            try {
                loop.add(fd, source, handler);
            } catch (IllegalStateException e) {
                throw new RegistrationConflictException(fd, e);
            }
        }
        ledger.put(fd, new Registration(fd, handler, false));
    }

    /**
     * Removes the binding for {@code fd}. Unknown descriptors are ignored, so retrying is safe.
     *
     * @return true if the ledger no longer holds {@code fd}; false if it was retained because the
     *         event loop could not be confirmed clear
     */
    public synchronized boolean unregister(int fd) {
        Registration existing = ledger.get(fd);
        if (existing == null) {
            LOG.debug("unregister of unknown fd {} ignored", fd);
            return true;
        }
        try {
            loop.remove(fd);
            ledger.remove(fd);
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Event loop failed to remove fd {}: {}", fd, e.toString());
        }
        if (!loop.isBound(fd)) {
            ledger.remove(fd);
            LOG.info("fd {} verified clear in event loop after failed removal", fd);
            return true;
        }
        ledger.put(fd, existing.retain());
        LOG.warn("fd {} still bound in event loop; retained as occupied", fd);
        return false;
    }

    public synchronized boolean isRegistered(int fd) {
        return ledger.containsKey(fd);
    }

    /** True if {@code fd} is held only because its removal could not be confirmed. */
    public synchronized boolean isRetained(int fd) {
        Registration r = ledger.get(fd);
        return r != null && r.retained();
    }

    public synchronized Set<Integer> registeredDescriptors() {
        return new TreeSet<>(ledger.keySet());
    }

    private void retryRemoval(int fd) {
        if (!loop.isBound(fd)) {
            return;
        }
        try {
            loop.remove(fd);
        } catch (IOException | RuntimeException e) {
            LOG.debug("Retry removal of fd {} failed: {}", fd, e.toString());
        }
    }

    private record Registration(int fd, StreamHandler handler, boolean retained) {
        Registration retain() {
            return new Registration(fd, handler, true);
        }
    }
}
