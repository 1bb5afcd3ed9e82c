package com.phillippitts.watchkeeper.service.lifecycle;

import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.WatchkeeperException;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Daemon boot and shutdown.
 *
 * <ul>
 *   <li>On {@link ApplicationReadyEvent}: start all autostart watchers.</li>
 *   <li>{@link #requestShutdown}: stop all watchers, then close the context and exit with the
 *       given code from a separate thread (the caller may be the control loop, which the
 *       context close waits on). A busy gate is retried with backoff until the longest graceful
 *       timeout plus a margin has passed; if the watchers still could not be stopped, a zero exit
 *       code becomes {@link #EXIT_FATAL}.</li>
 *   <li>On {@link DaemonFatalEvent}: shutdown with {@link #EXIT_FATAL}.</li>
 *   <li>{@code @PreDestroy} (JVM shutdown hook, context close): stop all watchers unless an
 *       earlier attempt already succeeded.</li>
 * </ul>
 */
@Component
public class DaemonLifecycle {

    private static final Logger LOG = LogManager.getLogger(DaemonLifecycle.class);

    /** EX_SOFTWARE from sysexits.h */
    public static final int EXIT_FATAL = 70;

    static final Duration DEFAULT_STOP_MARGIN = Duration.ofSeconds(5);
    private static final long INITIAL_BACKOFF_MS = 50;
    private static final long MAX_BACKOFF_MS = 1000;

    private final Supervisor supervisor;
    private final ApplicationContext context;
    private final IntConsumer exiter;
    private final Duration stopMargin;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final AtomicBoolean watchersStopped = new AtomicBoolean();

    @Autowired
    public DaemonLifecycle(Supervisor supervisor, ApplicationContext context) {
        this(supervisor, context, System::exit);
    }

    DaemonLifecycle(Supervisor supervisor, ApplicationContext context, IntConsumer exiter) {
        this(supervisor, context, exiter, DEFAULT_STOP_MARGIN);
    }

    DaemonLifecycle(Supervisor supervisor, ApplicationContext context, IntConsumer exiter, Duration stopMargin) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.context = context;
        this.exiter = Objects.requireNonNull(exiter, "exiter");
        this.stopMargin = Objects.requireNonNull(stopMargin, "stopMargin");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        LOG.info("Daemon ready; starting autostart watchers");
        try {
            supervisor.startAll();
        } catch (GateBusyException e) {
            // Reconcile will not start stopped watchers; an operator start-all is needed
            LOG.warn("Initial start-all refused: {}", e.getMessage());
        }
    }

    @EventListener
    public void onFatal(DaemonFatalEvent event) {
        LOG.error("Fatal daemon error: {}", event.reason(), event.cause());
        requestShutdown("fatal: " + event.reason(), EXIT_FATAL);
    }

    /**
     * Stops every watcher and exits the JVM. Only the first call has any effect.
     */
    public void requestShutdown(String reason, int exitCode) {
        if (!shutdownRequested.compareAndSet(false, true)) {
            LOG.debug("Shutdown already requested; ignoring '{}'", reason);
            return;
        }
        LOG.warn("Shutdown requested: {} (exit code {})", reason, exitCode);
        stopWatchersOnce();
        Thread exitThread = new Thread(() -> {
            int code = context == null ? exitCode : SpringApplication.exit(context, () -> exitCode);
            if (code == 0 && !watchersStopped.get()) {
                LOG.error("Watchers were not stopped; children may outlive the daemon");
                code = EXIT_FATAL;
            }
            exiter.accept(code);
        }, "daemon-exit");
        exitThread.setDaemon(false);
        exitThread.start();
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    @PreDestroy
    public void onShutdown() {
        stopWatchersOnce();
    }

    /**
     * Runs stop-all until it succeeds once. Later calls return immediately after a success and
     * try again after a failure.
     */
    private synchronized void stopWatchersOnce() {
        if (watchersStopped.get()) {
            return;
        }
        Duration budget = supervisor.longestGracefulTimeout().plus(stopMargin);
        long deadline = System.nanoTime() + budget.toNanos();
        long backoffMs = INITIAL_BACKOFF_MS;
        for (int attempt = 1; ; attempt++) {
            try {
                supervisor.stopAll();
                watchersStopped.set(true);
                LOG.info("All watchers stopped");
                return;
            } catch (GateBusyException e) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    LOG.error("Giving up stopping watchers after {} attempts over {} ms; children may outlive the daemon",
                            attempt, budget.toMillis());
                    return;
                }
                LOG.warn("stop-all busy (attempt {}): {}; retrying in {} ms", attempt, e.getMessage(), backoffMs);
                try {
                    Thread.sleep(Math.min(backoffMs, remainingMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.error("Interrupted while waiting to stop watchers; children may outlive the daemon");
                    return;
                }
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            } catch (WatchkeeperException e) {
                LOG.error("stop-all failed during shutdown: {}", e.getMessage(), e);
                return;
            }
        }
    }
}
