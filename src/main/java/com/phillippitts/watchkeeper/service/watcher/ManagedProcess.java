package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.domain.ProcessHealth;
import com.phillippitts.watchkeeper.domain.ProcessInfo;
import com.phillippitts.watchkeeper.service.stream.Redirection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * A confirmed child of a watcher together with the descriptors streaming its output.
 */
final class ManagedProcess {

    private final Process process;
    private final long pid;
    private final Redirection redirection;
    private final Instant spawnedAt;

    ManagedProcess(Process process, Redirection redirection, Instant spawnedAt) {
        this.process = Objects.requireNonNull(process, "process");
        this.pid = process.pid();
        this.redirection = Objects.requireNonNull(redirection, "redirection");
        this.spawnedAt = Objects.requireNonNull(spawnedAt, "spawnedAt");
    }

    long pid() {
        return pid;
    }

    Redirection redirection() {
        return redirection;
    }

    Instant spawnedAt() {
        return spawnedAt;
    }

    boolean isAlive() {
        return process.isAlive();
    }

    ProcessHealth health() {
        return process.isAlive() ? ProcessHealth.ALIVE : ProcessHealth.EXITED;
    }

    OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    boolean olderThan(Duration maxAge, Instant now) {
        return !maxAge.isZero() && Duration.between(spawnedAt, now).compareTo(maxAge) >= 0;
    }

    void terminate() {
        process.destroy();
    }

    void kill() {
        process.destroyForcibly();
    }

    /**
     * Waits for exit.
     *
     * @return true if the process exited within {@code timeout}; false on timeout or interrupt
     */
    boolean awaitExit(Duration timeout) {
        try {
            return process.waitFor(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    ProcessInfo snapshot() {
        return new ProcessInfo(pid, spawnedAt, health());
    }
}
