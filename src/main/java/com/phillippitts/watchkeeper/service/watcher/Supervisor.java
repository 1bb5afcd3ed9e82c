package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.exception.UnknownWatcherException;
import com.phillippitts.watchkeeper.service.gate.ExclusiveCommandGate;
import com.phillippitts.watchkeeper.service.gate.GateHandle;
import com.phillippitts.watchkeeper.service.socket.ActivationSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns the watcher collection and exposes the only entry points that mutate it.
 *
 * <p>Every public lifecycle method acquires the {@link ExclusiveCommandGate} under its own
 * command name before touching a watcher. Internal follow-ups decided during reconcile (start
 * an on-demand watcher, stop a crashed non-respawning one) call these same public methods; the
 * gate lets the reconciling thread nest its acquisition, so no code path mutates a watcher
 * outside the gate or under a name other than its own.
 *
 * <p>External callers ({@code acquire}) wait up to the configured bound and get
 * {@link GateBusyException} naming the active command. {@link #reconcileAll()} never waits.
 */
@Component
public class Supervisor {

    private static final Logger LOG = LogManager.getLogger(Supervisor.class);

    public static final String CMD_START = "watcher-start";
    public static final String CMD_STOP = "watcher-stop";
    public static final String CMD_RESTART = "watcher-restart";
    public static final String CMD_SCALE = "watcher-scale";
    public static final String CMD_ADD = "watcher-add";
    public static final String CMD_REMOVE = "watcher-remove";
    public static final String CMD_START_ALL = "start-all";
    public static final String CMD_STOP_ALL = "stop-all";
    public static final String CMD_RELOAD = "reload";
    public static final String CMD_RECONCILE = "reconcile";
    public static final String CMD_REAP = "reap";

    private static final Comparator<Watcher> START_ORDER =
            Comparator.comparingInt((Watcher w) -> w.spec().priority()).reversed().thenComparing(Watcher::name);
    private static final Comparator<Watcher> STOP_ORDER =
            Comparator.comparingInt((Watcher w) -> w.spec().priority()).thenComparing(Watcher::name);

    private final ExclusiveCommandGate gate;
    private final WatcherFactory factory;
    private final ActivationSource activations;
    private final Map<String, Watcher> watchers = new ConcurrentHashMap<>();

    public Supervisor(ExclusiveCommandGate gate,
                      WatcherFactory factory,
                      ActivationSource activations,
                      WatchkeeperProperties props) {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.activations = Objects.requireNonNull(activations, "activations");
        for (WatchkeeperProperties.WatcherProperties wp : props.getWatchers()) {
            WatcherSpec spec = WatcherSpec.from(wp);
            if (watchers.putIfAbsent(spec.name(), factory.create(spec)) != null) {
                throw new IllegalArgumentException("Duplicate watcher name '" + spec.name() + "'");
            }
        }
        LOG.info("Supervisor managing watchers={}", watchers.keySet());
    }

    public WatcherStatus startWatcher(String name) {
        try (GateHandle handle = gate.acquire(CMD_START)) {
            Watcher watcher = require(name);
            startUnderGate(watcher, handle);
            return watcher.status();
        }
    }

    public WatcherStatus stopWatcher(String name) {
        try (GateHandle handle = gate.acquire(CMD_STOP)) {
            Watcher watcher = require(name);
            stopUnderGate(watcher, handle);
            return watcher.status();
        }
    }

    public WatcherStatus restartWatcher(String name) {
        try (GateHandle handle = gate.acquire(CMD_RESTART)) {
            Watcher watcher = require(name);
            stopUnderGate(watcher, handle);
            startUnderGate(watcher, handle);
            return watcher.status();
        }
    }

    /**
     * Adjusts the desired process count of one watcher.
     *
     * @throws IllegalArgumentException if the new count is outside the watcher's bounds
     */
    public WatcherStatus scaleWatcher(String name, int delta) {
        try (GateHandle handle = gate.acquire(CMD_SCALE)) {
            Watcher watcher = require(name);
            watcher.scale(handle, delta);
            return watcher.status();
        }
    }

    /**
     * Starts every autostart watcher, highest priority first. On-demand watchers wait for
     * socket activity instead.
     */
    public void startAll() {
        try (GateHandle handle = gate.acquire(CMD_START_ALL)) {
            forEachIsolated(ordered(START_ORDER), w -> {
                if (w.spec().autostart() && !w.spec().onDemand()) {
                    startUnderGate(w, handle);
                }
            });
        }
    }

    /** Stops every watcher, lowest priority first. */
    public void stopAll() {
        try (GateHandle handle = gate.acquire(CMD_STOP_ALL)) {
            forEachIsolated(ordered(STOP_ORDER), w -> stopUnderGate(w, handle));
        }
    }

    /** Gracefully restarts every watcher that is currently running. */
    public void reloadAll() {
        try (GateHandle handle = gate.acquire(CMD_RELOAD)) {
            forEachIsolated(ordered(START_ORDER), w -> {
                if (w.status().state().isActive()) {
                    stopUnderGate(w, handle);
                    startUnderGate(w, handle);
                }
            });
        }
    }

    /**
     * One reconcile pass over all watchers. Never waits for the gate.
     *
     * @return false if the pass was skipped because another command holds the gate
     */
    public boolean reconcileAll() {
        Optional<GateHandle> acquired = gate.tryAcquire(CMD_RECONCILE);
        if (acquired.isEmpty()) {
            LOG.info("Reconcile skipped; gate busy with '{}'", gate.activeCommand().orElse("unknown"));
            return false;
        }
        try (GateHandle handle = acquired.get()) {
            forEachIsolated(ordered(START_ORDER), w -> {
                ReconcileOutcome outcome = w.reconcile(handle, activations);
                switch (outcome) {
                    case START -> startWatcher(w.name());
                    case STOP -> stopWatcher(w.name());
                    default -> { }
                }
            });
        }
        return true;
    }

    /**
     * Reaps exited processes of every watcher (SIGCHLD). Respawning is left to reconcile.
     *
     * @return total processes reaped
     */
    public int reapAll() {
        try (GateHandle handle = gate.acquire(CMD_REAP)) {
            int reaped = 0;
            for (Watcher w : ordered(START_ORDER)) {
                reaped += w.reap(handle);
            }
            return reaped;
        }
    }

    /**
     * Adds a watcher at runtime.
     *
     * @param start start it right away (ignored for on-demand watchers)
     * @throws IllegalArgumentException if the name is taken
     */
    public WatcherStatus addWatcher(WatcherSpec spec, boolean start) {
        try (GateHandle handle = gate.acquire(CMD_ADD)) {
            Watcher watcher = factory.create(spec);
            if (watchers.putIfAbsent(spec.name(), watcher) != null) {
                throw new IllegalArgumentException("Watcher '" + spec.name() + "' already exists");
            }
            LOG.info("Watcher {} added", spec.name());
            if (start && !spec.onDemand()) {
                startUnderGate(watcher, handle);
            }
            return watcher.status();
        }
    }

    /** Stops and forgets a watcher. */
    public void removeWatcher(String name) {
        try (GateHandle handle = gate.acquire(CMD_REMOVE)) {
            Watcher watcher = require(name);
            stopUnderGate(watcher, handle);
            watchers.remove(name);
            LOG.info("Watcher {} removed", name);
        }
    }

    public List<WatcherStatus> statuses() {
        List<WatcherStatus> out = new ArrayList<>();
        for (Watcher w : ordered(Comparator.comparing(Watcher::name))) {
            out.add(w.status());
        }
        return out;
    }

    public WatcherStatus status(String name) {
        return require(name).status();
    }

    /** Longest graceful stop timeout across all watchers; zero when there are none. */
    public Duration longestGracefulTimeout() {
        return watchers.values().stream()
                .map(w -> w.spec().gracefulTimeout())
                .max(Comparator.naturalOrder())
                .orElse(Duration.ZERO);
    }

    public Optional<String> activeCommand() {
        return gate.activeCommand();
    }

    private void startUnderGate(Watcher watcher, GateHandle handle) {
        if (watcher.spec().onDemand()) {
            activations.release(watcher.spec().sockets());
        }
        watcher.start(handle);
    }

    private void stopUnderGate(Watcher watcher, GateHandle handle) {
        watcher.stop(handle);
        if (watcher.spec().onDemand()) {
            activations.rearm(watcher.spec().sockets());
        }
    }

    private Watcher require(String name) {
        Watcher watcher = watchers.get(name);
        if (watcher == null) {
            throw new UnknownWatcherException(name);
        }
        return watcher;
    }

    private List<Watcher> ordered(Comparator<Watcher> order) {
        List<Watcher> list = new ArrayList<>(watchers.values());
        list.sort(order);
        return list;
    }

    /** A failure in one watcher never stops the others; ledger divergence is fatal and escapes. */
    private static void forEachIsolated(List<Watcher> list, Consumer<Watcher> action) {
        for (Watcher w : list) {
            try {
                action.accept(w);
            } catch (LedgerDivergenceException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.error("Watcher {} operation failed: {}", w.name(), e.toString(), e);
            }
        }
    }
}
