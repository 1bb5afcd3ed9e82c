package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.domain.WatcherState;
import com.phillippitts.watchkeeper.domain.WatcherStatus;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.service.gate.ExclusiveCommandGate;
import com.phillippitts.watchkeeper.service.gate.GateHandle;
import com.phillippitts.watchkeeper.service.spawn.ProcessFactory;
import com.phillippitts.watchkeeper.service.stream.DescriptorTable;
import com.phillippitts.watchkeeper.service.stream.HandlerRegistry;
import com.phillippitts.watchkeeper.service.stream.OutputRedirector;
import com.phillippitts.watchkeeper.service.watcher.event.ShutdownTimeoutEvent;
import com.phillippitts.watchkeeper.service.watcher.event.SpawnFailureEvent;
import com.phillippitts.watchkeeper.service.watcher.event.WatcherStateChangedEvent;
import com.phillippitts.watchkeeper.testutil.EventCapturingPublisher;
import com.phillippitts.watchkeeper.testutil.FakeActivationSource;
import com.phillippitts.watchkeeper.testutil.FakeIoEventLoop;
import com.phillippitts.watchkeeper.testutil.MutableClock;
import com.phillippitts.watchkeeper.testutil.ScriptedProcessFactory;
import com.phillippitts.watchkeeper.testutil.TestProcess;
import com.phillippitts.watchkeeper.testutil.TestWatchers;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatcherTest {

    private ScriptedProcessFactory factory;
    private FakeIoEventLoop loop;
    private HandlerRegistry registry;
    private DescriptorTable descriptors;
    private OutputRedirector redirector;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private ExclusiveCommandGate gate;
    private FakeActivationSource activations;

    @BeforeEach
    void setUp() {
        WatchkeeperProperties props = new WatchkeeperProperties();
        factory = new ScriptedProcessFactory();
        loop = new FakeIoEventLoop();
        registry = new HandlerRegistry(loop);
        descriptors = new DescriptorTable();
        redirector = new OutputRedirector(registry, descriptors, props);
        publisher = new EventCapturingPublisher();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        gate = new ExclusiveCommandGate(props);
        activations = new FakeActivationSource();
    }

    private Watcher watcher(WatchkeeperProperties.WatcherProperties p) {
        return watcher(p, factory);
    }

    private Watcher watcher(WatchkeeperProperties.WatcherProperties p, ProcessFactory processFactory) {
        return new Watcher(WatcherSpec.from(p), processFactory, redirector, publisher, clock);
    }

    private void start(Watcher w) {
        try (GateHandle h = gate.acquire("watcher-start")) {
            w.start(h);
        }
    }

    private void stop(Watcher w) {
        try (GateHandle h = gate.acquire("watcher-stop")) {
            w.stop(h);
        }
    }

    private ReconcileOutcome reconcile(Watcher w) {
        try (GateHandle h = gate.acquire("reconcile")) {
            return w.reconcile(h, activations);
        }
    }

    @Test
    void startSpawnsDesiredProcessesAndRedirectsOutput() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setNumProcesses(2);
        Watcher w = watcher(p);

        start(w);

        WatcherStatus status = w.status();
        assertThat(status.state()).isEqualTo(WatcherState.RUNNING);
        assertThat(status.live()).isEqualTo(2);
        assertThat(status.isHealthy()).isTrue();
        assertThat(loop.boundCount()).isEqualTo(4);
        assertThat(publisher.eventsOf(WatcherStateChangedEvent.class))
                .extracting(WatcherStateChangedEvent::to)
                .containsExactly(WatcherState.STARTING, WatcherState.RUNNING);
    }

    @Test
    void mutationWithReleasedHandleIsRejected() {
        Watcher w = watcher(TestWatchers.props("web"));
        GateHandle stale = gate.acquire("watcher-start");
        stale.close();

        assertThatThrownBy(() -> w.start(stale))
                .isInstanceOf(IllegalStateException.class);
        assertThat(w.status().state()).isEqualTo(WatcherState.STOPPED);
        assertThat(factory.commands).isEmpty();
    }

    @Test
    void startIsNoopWhenAlreadyRunning() {
        Watcher w = watcher(TestWatchers.props("web"));
        start(w);

        start(w);

        assertThat(factory.commands).hasSize(1);
    }

    @Test
    void failedSpawnsAreRetriedWithoutLeavingStaleBindings() {
        // Arrange: three children die at startup, the fourth lives
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setMaxRetry(3);
        factory.exitNext(3, 1);
        Watcher w = watcher(p);

        // Act
        start(w);

        // Assert
        assertThat(factory.commands).hasSize(4);
        assertThat(w.status().live()).isEqualTo(1);
        assertThat(w.status().degraded()).isFalse();
        assertThat(loop.boundCount()).isEqualTo(2);
        assertThat(registry.registeredDescriptors()).containsExactly(3, 4);
        assertThat(registry.isRetained(3)).isFalse();
        assertThat(descriptors.allocatedCount()).isEqualTo(2);
    }

    @Test
    void failedSpawnReusesRetainedDescriptorsThroughReplace() {
        // Arrange: the first child dies at startup and its descriptors cannot be closed
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        factory.exitNext(1, 1);
        loop.failNextRemovals(4, false);
        Watcher w = watcher(p);

        // Act
        start(w);

        // Assert: the retry got fds 3 and 4 again and overwrote the stale bindings
        assertThat(factory.commands).hasSize(2);
        assertThat(w.status().live()).isEqualTo(1);
        assertThat(w.status().degraded()).isFalse();
        assertThat(loop.adds.get()).isEqualTo(2);
        assertThat(loop.replaces.get()).isEqualTo(2);
        assertThat(registry.registeredDescriptors()).containsExactly(3, 4);
        assertThat(registry.isRetained(3)).isFalse();
        assertThat(registry.isRetained(4)).isFalse();
        assertThat(loop.isBound(3)).isTrue();
        assertThat(loop.isBound(4)).isTrue();
        assertThat(loop.boundCount()).isEqualTo(2);
    }

    @Test
    void rejectedOutputPumpIsRetriedAsSpawnFailure() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        loop.rejectNextAdds(1);
        Watcher w = watcher(p);

        start(w);

        assertThat(factory.started).hasSize(2);
        assertThat(factory.started.get(0).forcedCalls.get()).isEqualTo(1);
        assertThat(factory.alive()).hasSize(1);
        assertThat(w.status().state()).isEqualTo(WatcherState.RUNNING);
        assertThat(w.status().isHealthy()).isTrue();
        assertThat(registry.registeredDescriptors()).containsExactly(3, 4);
    }

    @Test
    void ledgerDivergenceDuringStartLeavesWatcherStopped() {
        loop.bindStale(3);
        loop.refuseReplace(true);
        Watcher w = watcher(TestWatchers.props("web"));

        assertThatThrownBy(() -> start(w)).isInstanceOf(LedgerDivergenceException.class);

        assertThat(w.status().state()).isEqualTo(WatcherState.STOPPED);
        assertThat(factory.alive()).isEmpty();
        assertThat(descriptors.allocatedCount()).isZero();
    }

    @Test
    void exhaustedRetriesAbandonSlotAndMarkDegraded() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setMaxRetry(1);
        factory.failNext(2);
        Watcher w = watcher(p);

        start(w);

        WatcherStatus status = w.status();
        assertThat(status.state()).isEqualTo(WatcherState.RUNNING);
        assertThat(status.degraded()).isTrue();
        assertThat(status.live()).isZero();
        assertThat(status.lastError()).contains("Cannot start web");
        assertThat(status.isHealthy()).isFalse();
        assertThat(publisher.eventsOf(SpawnFailureEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.watcher()).isEqualTo("web");
                    assertThat(e.attempts()).isEqualTo(2);
                });
        assertThat(loop.boundCount()).isZero();
    }

    @Test
    void abandonedSlotIsNotRetriedByReconcileButIsByExplicitStart() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setMaxRetry(0);
        factory.failNext(1);
        Watcher w = watcher(p);
        start(w);

        reconcile(w);
        assertThat(factory.commands).hasSize(1);

        stop(w);
        start(w);
        assertThat(factory.commands).hasSize(2);
        assertThat(w.status().degraded()).isFalse();
        assertThat(w.status().live()).isEqualTo(1);
    }

    @Test
    void stopTerminatesProcessesAndReleasesDescriptors() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setNumProcesses(2);
        Watcher w = watcher(p);
        start(w);

        stop(w);

        assertThat(w.status().state()).isEqualTo(WatcherState.STOPPED);
        assertThat(w.status().live()).isZero();
        assertThat(factory.started).allSatisfy(proc -> {
            assertThat(proc.isAlive()).isFalse();
            assertThat(proc.destroyCalls.get()).isEqualTo(1);
            assertThat(proc.forcedCalls.get()).isZero();
        });
        assertThat(loop.boundCount()).isZero();
        assertThat(descriptors.allocatedCount()).isZero();
    }

    @Test
    void stopForceKillsProcessesThatOutliveGracefulTimeout() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setGracefulTimeoutMs(50);
        factory.ignoringTerm();
        Watcher w = watcher(p);
        start(w);
        TestProcess stubborn = factory.started.get(0);

        stop(w);

        assertThat(stubborn.isAlive()).isFalse();
        assertThat(stubborn.forcedCalls.get()).isEqualTo(1);
        assertThat(publisher.eventsOf(ShutdownTimeoutEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.pid()).isEqualTo(stubborn.pid());
                    assertThat(e.gracefulTimeout()).isEqualTo(Duration.ofMillis(50));
                });
        assertThat(loop.boundCount()).isZero();
    }

    @Test
    void reconcileRespawnsCrashedProcess() {
        Watcher w = watcher(TestWatchers.props("web"));
        start(w);
        TestProcess first = factory.started.get(0);

        first.exit(1);
        ReconcileOutcome outcome = reconcile(w);

        assertThat(outcome).isEqualTo(ReconcileOutcome.NONE);
        assertThat(w.status().state()).isEqualTo(WatcherState.RUNNING);
        assertThat(w.status().live()).isEqualTo(1);
        assertThat(w.status().processes().get(0).pid()).isNotEqualTo(first.pid());
        assertThat(w.status().lastReconcileAt()).isEqualTo(clock.instant());
        assertThat(loop.boundCount()).isEqualTo(2);
    }

    @Test
    void reconcileWithoutRespawnAsksForStop() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("batch");
        p.setRespawn(false);
        Watcher w = watcher(p);
        start(w);

        factory.started.get(0).exit(0);
        ReconcileOutcome outcome = reconcile(w);

        assertThat(outcome).isEqualTo(ReconcileOutcome.STOP);
        assertThat(factory.commands).hasSize(1);
        assertThat(w.status().state()).isEqualTo(WatcherState.RUNNING);
    }

    @Test
    void reconcileRecyclesProcessesOlderThanMaxAge() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setMaxAgeSeconds(60);
        Watcher w = watcher(p);
        start(w);
        TestProcess old = factory.started.get(0);

        clock.advance(Duration.ofSeconds(30));
        reconcile(w);
        assertThat(old.isAlive()).isTrue();

        clock.advance(Duration.ofSeconds(31));
        reconcile(w);

        assertThat(old.isAlive()).isFalse();
        assertThat(factory.started).hasSize(2);
        assertThat(w.status().live()).isEqualTo(1);
        assertThat(w.status().processes().get(0).spawnedAt()).isEqualTo(clock.instant());
    }

    @Test
    void scaleChangesDesiredAndReconcileConverges() {
        Watcher w = watcher(TestWatchers.props("web"));
        start(w);

        try (GateHandle h = gate.acquire("watcher-scale")) {
            assertThat(w.scale(h, 2)).isEqualTo(3);
        }
        reconcile(w);
        assertThat(w.status().live()).isEqualTo(3);

        try (GateHandle h = gate.acquire("watcher-scale")) {
            w.scale(h, -2);
        }
        reconcile(w);

        assertThat(w.status().live()).isEqualTo(1);
        assertThat(factory.started.get(0).isAlive()).isFalse();
        assertThat(factory.started.get(2).isAlive()).isTrue();
        assertThat(loop.boundCount()).isEqualTo(2);
    }

    @Test
    void scaleOutsideBoundsIsRejected() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setMaxProcesses(2);
        Watcher w = watcher(p);

        try (GateHandle h = gate.acquire("watcher-scale")) {
            assertThatThrownBy(() -> w.scale(h, 5))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("[0, 2]");
            assertThatThrownBy(() -> w.scale(h, -2))
                    .isInstanceOf(IllegalArgumentException.class);
        }
        assertThat(w.status().desired()).isEqualTo(1);
    }

    @Test
    void reapDropsExitedProcessesWithoutRespawning() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("web");
        p.setNumProcesses(2);
        Watcher w = watcher(p);
        start(w);

        factory.started.get(1).exit(2);
        int reaped;
        try (GateHandle h = gate.acquire("reap")) {
            reaped = w.reap(h);
        }

        assertThat(reaped).isEqualTo(1);
        assertThat(w.status().live()).isEqualTo(1);
        assertThat(factory.started).hasSize(2);
        assertThat(loop.boundCount()).isEqualTo(2);
    }

    @Test
    void stoppedOnDemandWatcherAsksForStartOnActivity() {
        WatchkeeperProperties.WatcherProperties p = TestWatchers.props("lazy");
        p.setOnDemand(true);
        p.setSockets(List.of("lazy-socket"));
        Watcher w = watcher(p);

        assertThat(reconcile(w)).isEqualTo(ReconcileOutcome.NONE);

        activations.connect("lazy-socket");
        assertThat(reconcile(w)).isEqualTo(ReconcileOutcome.START);
        assertThat(factory.commands).isEmpty();
    }

    @Test
    void spawnRunsWithWatcherNameInLoggingContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        ProcessFactory capturing = (command, env, dir) -> {
            seen.set(ThreadContext.get("watcher"));
            return new TestProcess(77);
        };
        Watcher w = watcher(TestWatchers.props("web"), capturing);

        start(w);

        assertThat(seen.get()).isEqualTo("web");
        assertThat(ThreadContext.get("watcher")).isNull();
    }
}
