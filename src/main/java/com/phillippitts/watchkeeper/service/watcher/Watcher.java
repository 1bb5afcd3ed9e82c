package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.domain.ProcessInfo;
import com.phillippitts.watchkeeper.domain.WatcherState;
import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.exception.SpawnException;
import com.phillippitts.watchkeeper.service.gate.GateHandle;
import com.phillippitts.watchkeeper.service.socket.ActivationSource;
import com.phillippitts.watchkeeper.service.spawn.ProcessFactory;
import com.phillippitts.watchkeeper.service.stream.OutputRedirector;
import com.phillippitts.watchkeeper.service.stream.Redirection;
import com.phillippitts.watchkeeper.service.watcher.event.ShutdownTimeoutEvent;
import com.phillippitts.watchkeeper.service.watcher.event.SpawnFailureEvent;
import com.phillippitts.watchkeeper.service.watcher.event.WatcherStateChangedEvent;
import com.phillippitts.watchkeeper.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle state machine for one named group of processes.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * STOPPED → STARTING → RUNNING      (start)
 * RUNNING → STOPPING → STOPPED      (stop)
 * RUNNING → RECONCILING → RUNNING   (reconcile)
 * </pre>
 *
 * <p><b>Gate discipline:</b> every mutating method is package-private and takes the
 * {@link GateHandle} of the command in progress, verified on entry. Only {@link Supervisor},
 * which acquires the gate, can call them.
 *
 * <p><b>Spawning:</b> {@code start} and {@code reconcile} share one spawn routine. Each process
 * slot gets {@code maxRetry + 1} attempts. An attempt registers output redirection before the
 * child is confirmed, and releases it again if confirmation fails, so a retry never finds its
 * reused descriptors still bound. A slot that runs out of attempts is abandoned and the watcher
 * is flagged degraded; abandoned slots are not retried until the next explicit start, restart
 * or scale.
 *
 * <p><b>Status:</b> {@link #status()} returns an immutable snapshot swapped on every transition
 * and readable from any thread without the gate.
 *
 * <p><b>Thread Safety:</b> mutable fields are only touched while the gate is held, which also
 * provides the happens-before edges between successive owners.
 */
public final class Watcher {

    private static final Logger LOG = LogManager.getLogger(Watcher.class);

    static final String MDC_KEY = "watcher";

    private final WatcherSpec spec;
    private final ProcessFactory processFactory;
    private final OutputRedirector redirector;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final List<ManagedProcess> processes = new ArrayList<>();
    private final AtomicReference<WatcherStatus> status;

    private WatcherState state = WatcherState.STOPPED;
    private int desired;
    private int abandonedSlots;
    private boolean degraded;
    private String lastError;
    private Instant lastReconcileAt;

    Watcher(WatcherSpec spec,
            ProcessFactory processFactory,
            OutputRedirector redirector,
            ApplicationEventPublisher publisher,
            Clock clock) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.redirector = Objects.requireNonNull(redirector, "redirector");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.desired = spec.numProcesses();
        this.status = new AtomicReference<>(WatcherStatus.initial(spec.name(), desired));
    }

    public String name() {
        return spec.name();
    }

    public WatcherSpec spec() {
        return spec;
    }

    public WatcherStatus status() {
        return status.get();
    }

    /**
     * Spawns processes up to the desired count. No-op unless STOPPED.
     */
    void start(GateHandle gate) {
        gate.verifyHeld();
        ThreadContext.put(MDC_KEY, spec.name());
        try {
            if (state.isActive()) {
                LOG.debug("Watcher {} already {}; start ignored", spec.name(), state);
                return;
            }
            abandonedSlots = 0;
            degraded = false;
            lastError = null;
            transition(WatcherState.STARTING);
            try {
                spawnShortfall();
            } catch (RuntimeException e) {
                // start and reconcile both skip STARTING, so it must not outlive this call
                transition(processes.isEmpty() ? WatcherState.STOPPED : WatcherState.RUNNING);
                throw e;
            }
            transition(WatcherState.RUNNING);
            LOG.info("Watcher {} started with {}/{} processes", spec.name(), processes.size(), desired);
        } finally {
            ThreadContext.remove(MDC_KEY);
        }
    }

    /**
     * Terminates every process, force-killing those that outlive the graceful timeout, and
     * releases their output bindings. No-op when already STOPPED.
     */
    void stop(GateHandle gate) {
        gate.verifyHeld();
        ThreadContext.put(MDC_KEY, spec.name());
        try {
            if (state == WatcherState.STOPPED) {
                LOG.debug("Watcher {} already stopped; stop ignored", spec.name());
                return;
            }
            transition(WatcherState.STOPPING);
            List<ManagedProcess> victims = new ArrayList<>(processes);
            processes.clear();
            terminate(victims);
            abandonedSlots = 0;
            transition(WatcherState.STOPPED);
            LOG.info("Watcher {} stopped ({} processes terminated)", spec.name(), victims.size());
        } finally {
            ThreadContext.remove(MDC_KEY);
        }
    }

    /**
     * One maintenance pass: reap exited processes, recycle expired ones, respawn the shortfall
     * and trim the surplus.
     *
     * @return follow-up the supervisor must run through its gated entry points
     */
    ReconcileOutcome reconcile(GateHandle gate, ActivationSource activations) {
        gate.verifyHeld();
        ThreadContext.put(MDC_KEY, spec.name());
        try {
            lastReconcileAt = clock.instant();
            if (state == WatcherState.STOPPED) {
                if (spec.onDemand() && activations.hasPendingActivity(spec.sockets())) {
                    LOG.info("Watcher {} has pending connections on {}; requesting start", spec.name(), spec.sockets());
                    return ReconcileOutcome.START;
                }
                publishStatus();
                return ReconcileOutcome.NONE;
            }
            if (state != WatcherState.RUNNING) {
                LOG.warn("Watcher {} found in {} during reconcile; skipping", spec.name(), state);
                return ReconcileOutcome.NONE;
            }

            transition(WatcherState.RECONCILING);
            try {
                reapExited();
                if (!spec.respawn()) {
                    if (processes.isEmpty() && desired > 0) {
                        LOG.info("Watcher {} has no live processes and respawn is off; requesting stop", spec.name());
                        return ReconcileOutcome.STOP;
                    }
                } else {
                    recycleExpired();
                    spawnShortfall();
                }
                trimSurplus();
                return ReconcileOutcome.NONE;
            } finally {
                transition(WatcherState.RUNNING);
            }
        } finally {
            ThreadContext.remove(MDC_KEY);
        }
    }

    /**
     * Drops processes that have exited and releases their bindings.
     *
     * @return number of processes reaped
     */
    int reap(GateHandle gate) {
        gate.verifyHeld();
        ThreadContext.put(MDC_KEY, spec.name());
        try {
            int reaped = reapExited();
            if (reaped > 0) {
                publishStatus();
            }
            return reaped;
        } finally {
            ThreadContext.remove(MDC_KEY);
        }
    }

    /**
     * Changes the desired count by {@code delta}; the next reconcile converges.
     *
     * @return new desired count
     * @throws IllegalArgumentException if the result falls outside [min, max]
     */
    int scale(GateHandle gate, int delta) {
        gate.verifyHeld();
        int target = desired + delta;
        if (target < spec.minProcesses() || target > spec.maxProcesses()) {
            throw new IllegalArgumentException("Watcher '" + spec.name() + "' cannot scale to " + target
                    + " processes; allowed range is [" + spec.minProcesses() + ", " + spec.maxProcesses() + "]");
        }
        desired = target;
        abandonedSlots = 0;
        degraded = false;
        lastError = null;
        publishStatus();
        LOG.info("Watcher {} desired count set to {}", spec.name(), desired);
        return desired;
    }

    private void spawnShortfall() {
        int missing = desired - abandonedSlots - processes.size();
        for (int i = 0; i < missing; i++) {
            if (!spawnSlot()) {
                abandonedSlots++;
            }
        }
    }

    private boolean spawnSlot() {
        SpawnException last = null;
        int attempts = spec.attemptsPerSlot();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ManagedProcess p = spawnOnce();
                processes.add(p);
                if (attempt > 1) {
                    LOG.info("Watcher {} spawned pid {} on attempt {}/{}", spec.name(), p.pid(), attempt, attempts);
                } else {
                    LOG.debug("Watcher {} spawned pid {}", spec.name(), p.pid());
                }
                return true;
            } catch (SpawnException e) {
                last = e;
                LOG.warn("Spawn attempt {}/{} for watcher {} failed: {}", attempt, attempts, spec.name(), e.getMessage());
            }
        }
        degraded = true;
        lastError = last.getMessage();
        LOG.error("Watcher {} abandoned a process slot after {} attempts; marking degraded", spec.name(), attempts);
        publisher.publishEvent(new SpawnFailureEvent(spec.name(), attempts, lastError, clock.instant()));
        return false;
    }

    /**
     * Starts one child, redirects its output, then confirms it. A child that already died with
     * a non-zero code is a failed attempt and its bindings are released before returning.
     */
    private ManagedProcess spawnOnce() {
        Process process;
        try {
            process = processFactory.start(spec.command(), spec.env(), spec.workingDir());
        } catch (IOException | RuntimeException e) {
            throw new SpawnException(spec.name(), "Cannot start " + spec.command().get(0) + ": " + e.getMessage(), e);
        }

        Redirection redirection;
        try {
            redirection = redirector.attach(spec.name(), process);
        } catch (LedgerDivergenceException e) {
            process.destroyForcibly();
            throw e;
        } catch (RuntimeException e) {
            // e.g. RegistrationConflictException, or TaskRejectedException from a saturated pump pool
            process.destroyForcibly();
            throw new SpawnException(spec.name(), "Output redirection failed: " + e, e);
        }

        if (!process.isAlive() && process.exitValue() != 0) {
            redirector.detach(redirection);
            throw new SpawnException(spec.name(), "Process exited during startup with code " + process.exitValue());
        }
        return new ManagedProcess(process, redirection, clock.instant());
    }

    private int reapExited() {
        int reaped = 0;
        Iterator<ManagedProcess> it = processes.iterator();
        while (it.hasNext()) {
            ManagedProcess p = it.next();
            if (!p.isAlive()) {
                it.remove();
                redirector.detach(p.redirection());
                reaped++;
                LOG.info("Reaped pid {} of watcher {} (exit code {})", p.pid(), spec.name(),
                        p.exitCode().isPresent() ? p.exitCode().getAsInt() : "?");
            }
        }
        return reaped;
    }

    private void recycleExpired() {
        if (spec.maxAge().isZero()) {
            return;
        }
        Instant now = clock.instant();
        List<ManagedProcess> expired = new ArrayList<>();
        for (ManagedProcess p : processes) {
            if (p.olderThan(spec.maxAge(), now)) {
                expired.add(p);
            }
        }
        if (!expired.isEmpty()) {
            processes.removeAll(expired);
            LOG.info("Watcher {} recycling {} process(es) older than {}", spec.name(), expired.size(), spec.maxAge());
            terminate(expired);
        }
    }

    private void trimSurplus() {
        while (processes.size() > desired) {
            ManagedProcess oldest = processes.remove(0);
            LOG.info("Watcher {} trimming surplus pid {}", spec.name(), oldest.pid());
            terminate(List.of(oldest));
        }
    }

    /**
     * Graceful termination with one shared deadline, then force-kill for survivors. Bindings are
     * released for every victim whatever the outcome.
     */
    private void terminate(List<ManagedProcess> victims) {
        for (ManagedProcess p : victims) {
            p.terminate();
        }
        long deadline = System.nanoTime() + spec.gracefulTimeout().toNanos();
        List<ManagedProcess> survivors = new ArrayList<>();
        for (ManagedProcess p : victims) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (!p.awaitExit(Duration.ofMillis(Math.max(0, remainingMs)))) {
                survivors.add(p);
            }
        }
        for (ManagedProcess p : survivors) {
            LOG.warn("pid {} of watcher {} did not exit within {}ms; forcing", p.pid(), spec.name(),
                    spec.gracefulTimeout().toMillis());
            publisher.publishEvent(new ShutdownTimeoutEvent(spec.name(), p.pid(), spec.gracefulTimeout(), clock.instant()));
            p.kill();
            if (!p.awaitExit(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT)) {
                LOG.warn("pid {} of watcher {} still alive after destroyForcibly", p.pid(), spec.name());
            }
        }
        for (ManagedProcess p : victims) {
            redirector.detach(p.redirection());
        }
    }

    private void transition(WatcherState next) {
        WatcherState previous = state;
        state = next;
        publishStatus();
        if (previous != WatcherState.RECONCILING && next != WatcherState.RECONCILING) {
            publisher.publishEvent(new WatcherStateChangedEvent(spec.name(), previous, next, clock.instant()));
        }
    }

    private void publishStatus() {
        List<ProcessInfo> infos = new ArrayList<>(processes.size());
        for (ManagedProcess p : processes) {
            infos.add(p.snapshot());
        }
        status.set(new WatcherStatus(spec.name(), state, desired, infos, degraded, lastError,
                lastReconcileAt, clock.instant()));
    }
}
