package com.phillippitts.watchkeeper.service.gate;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.exception.GateBusyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daemon-wide named lock: at most one exclusive lifecycle command runs at any instant.
 *
 * <p>Every lifecycle-changing entry point (start/stop one watcher, start/stop all, reload,
 * reconcile) acquires the gate under its own command name. Two acquisition modes exist:
 * <ul>
 *   <li>{@link #acquire(String)}: bounded wait, for commands arriving from outside the control
 *       loop. Throws {@link GateBusyException} naming the active command on timeout.</li>
 *   <li>{@link #tryAcquire(String)}: zero wait, for the periodic reconciler, which skips the
 *       tick instead of queueing behind a running command.</li>
 * </ul>
 *
 * <p><b>Nesting:</b> a thread that already holds the gate may acquire it again. This is how a
 * gated operation triggers another lifecycle operation through the same public entry point
 * (the reconciler stopping a crashed watcher calls the regular stop command). The nested name
 * becomes the active command and the outer name is restored on release. Handles must be
 * released in reverse order of acquisition.
 *
 * <p>The active command name is mirrored into the Log4j2 {@code ThreadContext} under
 * {@code command} while held.
 *
 * <p><b>Thread Safety:</b> the {@link ReentrantLock} serializes owners; the handle stack is only
 * touched by the owning thread; {@code activeCommand} is volatile so other threads can report it
 * when they are refused.
 */
@Component
public class ExclusiveCommandGate {

    private static final Logger LOG = LogManager.getLogger(ExclusiveCommandGate.class);

    static final String MDC_KEY = "command";

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<GateHandle> held = new ArrayDeque<>();
    private final long acquireTimeoutMs;
    private volatile String activeCommand;

    public ExclusiveCommandGate(WatchkeeperProperties props) {
        this.acquireTimeoutMs = Math.max(0, props.getGate().getAcquireTimeoutMs());
    }

    /**
     * Acquires the gate, waiting up to {@code watchkeeper.gate.acquire-timeout-ms}.
     *
     * @param commandName name of the command about to run
     * @return handle to release (try-with-resources)
     * @throws GateBusyException if another command still holds the gate after the wait,
     *         or if the thread was interrupted while waiting
     */
    public GateHandle acquire(String commandName) {
        Objects.requireNonNull(commandName, "commandName");
        try {
            if (!lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                String active = activeCommand;
                LOG.debug("Gate busy: requested={}, active={}, waited={}ms", commandName, active, acquireTimeoutMs);
                throw new GateBusyException(commandName, active);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GateBusyException(commandName, activeCommand, e);
        }
        return enter(commandName);
    }

    /**
     * Acquires the gate only if it is free (or already held by this thread).
     *
     * @param commandName name of the command about to run
     * @return handle, or empty if another thread holds the gate
     */
    public Optional<GateHandle> tryAcquire(String commandName) {
        Objects.requireNonNull(commandName, "commandName");
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        return Optional.of(enter(commandName));
    }

    /**
     * Releases a handle obtained from this gate.
     *
     * @throws IllegalStateException if called from a thread that does not own the handle or
     *         if a nested handle acquired later is still held
     */
    public void release(GateHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (handle.owner() != Thread.currentThread() || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Thread " + Thread.currentThread().getName()
                    + " cannot release " + handle);
        }
        GateHandle top = held.peek();
        if (top != handle) {
            throw new IllegalStateException("Out-of-order release of '" + handle.command()
                    + "' while '" + (top == null ? "none" : top.command()) + "' is active");
        }
        held.pop();
        handle.markReleased();

        GateHandle outer = held.peek();
        if (outer == null) {
            activeCommand = null;
            ThreadContext.remove(MDC_KEY);
        } else {
            activeCommand = outer.command();
            ThreadContext.put(MDC_KEY, outer.command());
        }
        lock.unlock();
    }

    /**
     * Eventually-consistent view of the command currently holding the gate.
     */
    public Optional<String> activeCommand() {
        return Optional.ofNullable(activeCommand);
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    private GateHandle enter(String commandName) {
        GateHandle outer = held.peek();
        GateHandle handle = new GateHandle(this, commandName, Thread.currentThread());
        held.push(handle);
        activeCommand = commandName;
        ThreadContext.put(MDC_KEY, commandName);
        if (outer != null) {
            LOG.debug("Command {} nested inside {}", commandName, outer.command());
        }
        return handle;
    }
}
