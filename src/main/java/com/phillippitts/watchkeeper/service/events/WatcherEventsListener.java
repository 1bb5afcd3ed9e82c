package com.phillippitts.watchkeeper.service.events;

import com.phillippitts.watchkeeper.service.metrics.SupervisorMetrics;
import com.phillippitts.watchkeeper.service.watcher.event.ShutdownTimeoutEvent;
import com.phillippitts.watchkeeper.service.watcher.event.SpawnFailureEvent;
import com.phillippitts.watchkeeper.service.watcher.event.WatcherStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for watcher events. Operator-facing warnings are throttled per watcher to
 * avoid log spam from a crash-looping program; metrics are always recorded.
 */
@Component
class WatcherEventsListener {
    private static final Logger LOG = LogManager.getLogger(WatcherEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final SupervisorMetrics metrics;

    WatcherEventsListener(SupervisorMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onSpawnFailure(SpawnFailureEvent e) {
        metrics.incrementSpawnFailure(e.watcher());
        if (shouldLog("spawn-" + e.watcher())) {
            LOG.warn("Watcher {} is degraded: slot abandoned after {} attempts ({}). "
                    + "Fix the command and run start, restart or incr.", e.watcher(), e.attempts(), e.message());
        }
    }

    @EventListener
    void onShutdownTimeout(ShutdownTimeoutEvent e) {
        metrics.incrementShutdownTimeout(e.watcher());
        if (shouldLog("shutdown-" + e.watcher())) {
            LOG.warn("Watcher {} pid {} ignored termination for {} ms and was killed. "
                    + "Consider raising graceful-timeout-ms.", e.watcher(), e.pid(), e.gracefulTimeout().toMillis());
        }
    }

    @EventListener
    void onStateChanged(WatcherStateChangedEvent e) {
        LOG.debug("Watcher {}: {} -> {}", e.watcher(), e.from(), e.to());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
