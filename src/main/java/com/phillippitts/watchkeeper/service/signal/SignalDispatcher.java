package com.phillippitts.watchkeeper.service.signal;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.exception.WatchkeeperException;
import com.phillippitts.watchkeeper.service.lifecycle.DaemonLifecycle;
import com.phillippitts.watchkeeper.service.metrics.SupervisorMetrics;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Consumer half of the signal front-end.
 *
 * <p>At startup one {@link SignalCapture} is installed per configured signal name. On the control
 * loop, every {@code watchkeeper.signals.poll-ms}, {@link #drain()} empties the ring and runs the
 * configured {@link SignalAction} for each number through the gated {@link Supervisor} entry
 * points. All logging, name lookup and error handling for signals happens here.
 *
 * <p>A signal whose action finds the gate busy is put back into the ring and retried on the
 * next drain. Numbers with no configured name are logged and dropped.
 */
@Component
@ConditionalOnProperty(prefix = "watchkeeper.signals", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SignalDispatcher {

    private static final Logger LOG = LogManager.getLogger(SignalDispatcher.class);

    private final SignalRingBuffer ring;
    private final OsSignals osSignals;
    private final Supervisor supervisor;
    private final DaemonLifecycle lifecycle;
    private final SupervisorMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Map<String, SignalAction> actions;
    private final Map<Integer, String> namesByNumber = new HashMap<>();

    public SignalDispatcher(WatchkeeperProperties props,
                            OsSignals osSignals,
                            Supervisor supervisor,
                            DaemonLifecycle lifecycle,
                            SupervisorMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this.ring = new SignalRingBuffer(props.getSignals().getCapacity());
        this.osSignals = Objects.requireNonNull(osSignals, "osSignals");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.actions = new LinkedHashMap<>();
        props.getSignals().getActions().forEach((name, action) -> actions.put(normalize(name), action));
    }

    @PostConstruct
    public void installHandlers() {
        SignalCapture capture = new SignalCapture(ring);
        List<String> unsupported = new ArrayList<>();
        for (String name : actions.keySet()) {
            OptionalInt number = osSignals.install(name, capture);
            if (number.isPresent()) {
                namesByNumber.put(number.getAsInt(), name);
            } else {
                unsupported.add(name);
            }
        }
        LOG.info("Signal handlers installed: {}", actions);
        if (!unsupported.isEmpty()) {
            LOG.warn("Signals not available on this platform/JVM, actions disabled: {}", unsupported);
        }
    }

    @Scheduled(fixedDelayString = "${watchkeeper.signals.poll-ms:50}")
    public void drain() {
        long dropped = ring.drainDropped();
        if (dropped > 0) {
            LOG.warn("{} signal(s) dropped: ring buffer full (capacity {})", dropped, ring.capacity());
            metrics.incrementSignalsDropped(dropped);
        }

        List<Integer> deferred = null;
        int budget = ring.capacity();
        int signo;
        while (budget-- > 0 && (signo = ring.poll()) != 0) {
            if (!dispatch(signo)) {
                if (deferred == null) {
                    deferred = new ArrayList<>();
                }
                deferred.add(signo);
            }
        }
        if (deferred != null) {
            for (int s : deferred) {
                if (!ring.offer(s)) {
                    LOG.warn("Deferred signal {} lost: ring buffer full", s);
                }
            }
        }
    }

    /** Visible for tests */
    SignalRingBuffer ring() {
        return ring;
    }

    /**
     * @return false if the action should be retried on the next drain
     */
    private boolean dispatch(int signo) {
        String name = namesByNumber.get(signo);
        if (name == null) {
            LOG.warn("Ignoring unmapped signal number {}", signo);
            metrics.incrementSignalReceived("unknown");
            return true;
        }
        SignalAction action = actions.get(name);
        metrics.incrementSignalReceived(name);
        LOG.info("Received SIG{}: {}", name, action);
        try {
            switch (action) {
                case QUIT -> lifecycle.requestShutdown("SIG" + name, 0);
                case RELOAD -> supervisor.reloadAll();
                case REAP -> supervisor.reapAll();
                case IGNORE -> LOG.debug("SIG{} ignored by configuration", name);
                default -> throw new IllegalStateException("Unhandled signal action " + action);
            }
            return true;
        } catch (GateBusyException e) {
            LOG.info("SIG{} deferred: '{}' in progress", name, e.getActiveCommand());
            metrics.incrementGateBusy(e.getRequestedCommand());
            return false;
        } catch (LedgerDivergenceException e) {
            publisher.publishEvent(new DaemonFatalEvent("ledger divergence handling SIG" + name, e, Instant.now()));
            return true;
        } catch (WatchkeeperException e) {
            LOG.error("SIG{} action {} failed: {}", name, action, e.getMessage(), e);
            return true;
        }
    }

    private static String normalize(String name) {
        String upper = name.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("SIG") ? upper.substring(3) : upper;
    }
}
