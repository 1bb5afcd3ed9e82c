package com.phillippitts.watchkeeper.service.reconcile;

import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.service.metrics.SupervisorMetrics;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * Timer-driven reconcile on the control loop.
 *
 * <p>Runs at a fixed delay ({@code watchkeeper.check-delay-ms}) so a slow pass pushes the next
 * tick back instead of stacking ticks. A tick that finds the gate busy is skipped and counted;
 * it never waits.
 */
@Component
@ConditionalOnProperty(prefix = "watchkeeper.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PeriodicReconciler {

    private static final Logger LOG = LogManager.getLogger(PeriodicReconciler.class);

    private final Supervisor supervisor;
    private final SupervisorMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public PeriodicReconciler(Supervisor supervisor, SupervisorMetrics metrics, ApplicationEventPublisher publisher) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Scheduled(fixedDelayString = "${watchkeeper.check-delay-ms:1000}",
            initialDelayString = "${watchkeeper.check-delay-ms:1000}")
    public void tick() {
        long start = System.nanoTime();
        try {
            if (supervisor.reconcileAll()) {
                metrics.recordReconcile(System.nanoTime() - start);
            } else {
                metrics.incrementReconcileSkipped();
            }
        } catch (LedgerDivergenceException e) {
            LOG.error("Reconcile hit an irrecoverable ledger divergence", e);
            publisher.publishEvent(new DaemonFatalEvent("ledger divergence during reconcile", e, Instant.now()));
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next tick retries
            LOG.error("Reconcile tick failed: {}", e.toString(), e);
        }
    }
}
