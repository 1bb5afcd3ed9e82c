package com.phillippitts.watchkeeper.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the supervisor core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Gate contention per requested command</li>
 *   <li>Reconcile cycles run and skipped, and their duration</li>
 *   <li>Abandoned spawn slots and forced kills per watcher</li>
 *   <li>Signals received per name and signals dropped on ring overflow</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SupervisorMetrics {

    private static final String METRIC_PREFIX = "watchkeeper";

    private final MeterRegistry registry;

    public SupervisorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param command the command that was refused
     */
    public void incrementGateBusy(String command) {
        Counter.builder(METRIC_PREFIX + ".gate.busy")
                .description("Commands refused because another command held the gate")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    public void recordReconcile(long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".reconcile.cycles")
                .description("Reconcile passes that ran")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".reconcile.duration")
                .description("Time taken by one reconcile pass")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementReconcileSkipped() {
        Counter.builder(METRIC_PREFIX + ".reconcile.skipped")
                .description("Reconcile ticks skipped because the gate was busy")
                .register(registry)
                .increment();
    }

    public void incrementSpawnFailure(String watcher) {
        Counter.builder(METRIC_PREFIX + ".spawn.failure")
                .description("Process slots abandoned after exhausting spawn retries")
                .tag("watcher", watcher)
                .register(registry)
                .increment();
    }

    public void incrementShutdownTimeout(String watcher) {
        Counter.builder(METRIC_PREFIX + ".shutdown.timeout")
                .description("Processes force-killed after the graceful timeout")
                .tag("watcher", watcher)
                .register(registry)
                .increment();
    }

    /**
     * @param signal signal name, or "unknown" for unmapped numbers
     */
    public void incrementSignalReceived(String signal) {
        Counter.builder(METRIC_PREFIX + ".signals.received")
                .description("Signals drained from the ring buffer")
                .tag("signal", signal)
                .register(registry)
                .increment();
    }

    public void incrementSignalsDropped(long count) {
        Counter.builder(METRIC_PREFIX + ".signals.dropped")
                .description("Signals lost because the ring buffer was full")
                .register(registry)
                .increment(count);
    }
}
