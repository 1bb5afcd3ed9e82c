package com.phillippitts.watchkeeper.service.control;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.service.metrics.SupervisorMetrics;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.WatcherSpec;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Control-protocol facade over {@link Supervisor}.
 *
 * <p>Adds the caller-side policy for gate contention: a command refused with
 * {@link GateBusyException} is retried up to {@code watchkeeper.commands.max-attempts} times with
 * linear backoff, then the last {@code GateBusyException} is rethrown so the caller can report
 * "busy". A {@link LedgerDivergenceException} is turned into a {@link DaemonFatalEvent}.
 */
@Service
public class SupervisorCommands {

    private static final Logger LOG = LogManager.getLogger(SupervisorCommands.class);

    private final Supervisor supervisor;
    private final SupervisorMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final int maxAttempts;
    private final long backoffMs;

    public SupervisorCommands(Supervisor supervisor,
                              SupervisorMetrics metrics,
                              ApplicationEventPublisher publisher,
                              WatchkeeperProperties props) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.maxAttempts = Math.max(1, props.getCommands().getMaxAttempts());
        this.backoffMs = Math.max(0, props.getCommands().getBackoffMs());
    }

    public WatcherStatus start(String name) {
        return withRetry(Supervisor.CMD_START, () -> supervisor.startWatcher(name));
    }

    public WatcherStatus stop(String name) {
        return withRetry(Supervisor.CMD_STOP, () -> supervisor.stopWatcher(name));
    }

    public WatcherStatus restart(String name) {
        return withRetry(Supervisor.CMD_RESTART, () -> supervisor.restartWatcher(name));
    }

    public WatcherStatus incr(String name, int count) {
        return withRetry(Supervisor.CMD_SCALE, () -> supervisor.scaleWatcher(name, count));
    }

    public WatcherStatus decr(String name, int count) {
        return withRetry(Supervisor.CMD_SCALE, () -> supervisor.scaleWatcher(name, -count));
    }

    public void startAll() {
        withRetry(Supervisor.CMD_START_ALL, () -> {
            supervisor.startAll();
            return null;
        });
    }

    public void stopAll() {
        withRetry(Supervisor.CMD_STOP_ALL, () -> {
            supervisor.stopAll();
            return null;
        });
    }

    public void reload() {
        withRetry(Supervisor.CMD_RELOAD, () -> {
            supervisor.reloadAll();
            return null;
        });
    }

    public int reap() {
        return withRetry(Supervisor.CMD_REAP, supervisor::reapAll);
    }

    public WatcherStatus add(WatcherSpec spec, boolean start) {
        return withRetry(Supervisor.CMD_ADD, () -> supervisor.addWatcher(spec, start));
    }

    public void remove(String name) {
        withRetry(Supervisor.CMD_REMOVE, () -> {
            supervisor.removeWatcher(name);
            return null;
        });
    }

    public List<WatcherStatus> statuses() {
        return supervisor.statuses();
    }

    public WatcherStatus status(String name) {
        return supervisor.status(name);
    }

    private <T> T withRetry(String command, Supplier<T> action) {
        GateBusyException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (GateBusyException e) {
                last = e;
                metrics.incrementGateBusy(command);
                LOG.info("Command {} busy (attempt {}/{}): '{}' in progress", command, attempt, maxAttempts,
                        e.getActiveCommand());
                if (attempt < maxAttempts && !backoff(attempt)) {
                    break;
                }
            } catch (LedgerDivergenceException e) {
                LOG.error("Command {} hit an irrecoverable ledger divergence", command, e);
                publisher.publishEvent(new DaemonFatalEvent("ledger divergence during " + command, e, Instant.now()));
                throw e;
            }
        }
        throw last;
    }

    /** Returns false if interrupted. */
    private boolean backoff(int attempt) {
        try {
            Thread.sleep(backoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
