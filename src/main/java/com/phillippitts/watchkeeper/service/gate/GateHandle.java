package com.phillippitts.watchkeeper.service.gate;

/**
 * Proof that the calling thread holds the {@link ExclusiveCommandGate} under a command name.
 *
 * <p>Only the gate can create handles. Watcher mutation methods take a handle parameter and
 * call {@link #verifyHeld()}, so there is no way to mutate lifecycle state without going through
 * {@link ExclusiveCommandGate#acquire(String)} or {@link ExclusiveCommandGate#tryAcquire(String)}.
 *
 * <p>Use with try-with-resources:
 * <pre>{@code
 * try (GateHandle handle = gate.acquire("watcher-stop")) {
 *     watcher.stop(handle);
 * }
 * }</pre>
 */
public final class GateHandle implements AutoCloseable {

    private final ExclusiveCommandGate gate;
    private final String command;
    private final Thread owner;
    private volatile boolean released;

    GateHandle(ExclusiveCommandGate gate, String command, Thread owner) {
        this.gate = gate;
        this.command = command;
        this.owner = owner;
    }

    public String command() {
        return command;
    }

    public boolean isHeld() {
        return !released;
    }

    Thread owner() {
        return owner;
    }

    /**
     * @throws IllegalStateException if this handle was released or is used from a thread
     *         other than the one that acquired it
     */
    public void verifyHeld() {
        if (released) {
            throw new IllegalStateException("Gate handle for '" + command + "' was already released");
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Gate handle for '" + command + "' is owned by thread "
                    + owner.getName() + ", not " + Thread.currentThread().getName());
        }
    }

    void markReleased() {
        released = true;
    }

    /** Releases the gate; calling it again is a no-op. */
    @Override
    public void close() {
        if (!released) {
            gate.release(this);
        }
    }

    @Override
    public String toString() {
        return "GateHandle[" + command + (released ? ", released" : "") + "]";
    }
}
