package com.phillippitts.watchkeeper.service.signal;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.service.lifecycle.DaemonLifecycle;
import com.phillippitts.watchkeeper.service.metrics.SupervisorMetrics;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import com.phillippitts.watchkeeper.testutil.EventCapturingPublisher;
import com.phillippitts.watchkeeper.testutil.InMemoryAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sun.misc.SignalHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalDispatcherTest {

    private static final int HUP = 1;
    private static final int INT = 2;
    private static final int TERM = 15;
    private static final int CHLD = 17;

    private Supervisor supervisor;
    private DaemonLifecycle lifecycle;
    private SimpleMeterRegistry registry;
    private EventCapturingPublisher publisher;
    private FakeOsSignals os;
    private InMemoryAppender appender;

    @BeforeEach
    void setUp() {
        supervisor = mock(Supervisor.class);
        lifecycle = mock(DaemonLifecycle.class);
        registry = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
        os = new FakeOsSignals(Map.of("HUP", HUP, "INT", INT, "TERM", TERM, "CHLD", CHLD));
        appender = InMemoryAppender.attachTo(SignalDispatcher.class.getName());
    }

    @AfterEach
    void tearDown() {
        appender.detach();
    }

    private SignalDispatcher dispatcher(WatchkeeperProperties props) {
        SignalDispatcher d = new SignalDispatcher(props, os, supervisor, lifecycle,
                new SupervisorMetrics(registry), publisher);
        d.installHandlers();
        return d;
    }

    private SignalDispatcher dispatcher() {
        return dispatcher(new WatchkeeperProperties());
    }

    @Test
    void installsOneHandlerPerConfiguredSignal() {
        dispatcher();

        assertThat(os.installed).containsOnlyKeys("TERM", "INT", "HUP", "CHLD");
    }

    @Test
    void hangupReloadsWatchers() {
        SignalDispatcher d = dispatcher();

        d.ring().offer(HUP);
        d.drain();

        verify(supervisor).reloadAll();
        assertThat(registry.get("watchkeeper.signals.received").tag("signal", "HUP").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void terminateRequestsShutdown() {
        SignalDispatcher d = dispatcher();

        d.ring().offer(TERM);
        d.drain();

        verify(lifecycle).requestShutdown("SIGTERM", 0);
        verify(supervisor, never()).stopAll();
    }

    @Test
    void childExitReaps() {
        SignalDispatcher d = dispatcher();
        when(supervisor.reapAll()).thenReturn(1);

        d.ring().offer(CHLD);
        d.drain();

        verify(supervisor).reapAll();
    }

    @Test
    void ignoredSignalRunsNothing() {
        WatchkeeperProperties props = new WatchkeeperProperties();
        props.getSignals().setActions(Map.of("HUP", SignalAction.IGNORE));
        SignalDispatcher d = dispatcher(props);

        d.ring().offer(HUP);
        d.drain();

        verify(supervisor, never()).reloadAll();
    }

    @Test
    void configuredNamesAreCaseAndPrefixInsensitive() {
        WatchkeeperProperties props = new WatchkeeperProperties();
        props.getSignals().setActions(Map.of(" sigterm ", SignalAction.QUIT, "Hup", SignalAction.RELOAD));
        SignalDispatcher d = dispatcher(props);

        d.ring().offer(TERM);
        d.ring().offer(HUP);
        d.drain();

        assertThat(os.installed).containsOnlyKeys("TERM", "HUP");
        verify(lifecycle).requestShutdown("SIGTERM", 0);
        verify(supervisor).reloadAll();
    }

    @Test
    void unmappedNumberIsLoggedAndDropped() {
        SignalDispatcher d = dispatcher();

        d.ring().offer(99);
        d.drain();

        assertThat(appender.contains(Level.WARN, "Ignoring unmapped signal number 99")).isTrue();
        assertThat(registry.get("watchkeeper.signals.received").tag("signal", "unknown").counter().count())
                .isEqualTo(1.0);
        assertThat(d.ring().size()).isZero();
    }

    @Test
    void busyGateDefersSignalToNextDrain() {
        SignalDispatcher d = dispatcher();
        doThrow(new GateBusyException("reload", "watcher-start"))
                .doNothing()
                .when(supervisor).reloadAll();

        d.ring().offer(HUP);
        d.drain();
        assertThat(d.ring().size()).isEqualTo(1);

        d.drain();
        verify(supervisor, times(2)).reloadAll();
        assertThat(d.ring().size()).isZero();
    }

    @Test
    void overflowIsReportedOnNextDrain() {
        WatchkeeperProperties props = new WatchkeeperProperties();
        props.getSignals().setCapacity(2);
        SignalDispatcher d = dispatcher(props);
        doNothing().when(supervisor).reloadAll();

        d.ring().offer(HUP);
        d.ring().offer(HUP);
        d.ring().offer(HUP);
        d.drain();

        verify(supervisor, times(2)).reloadAll();
        assertThat(registry.get("watchkeeper.signals.dropped").counter().count()).isEqualTo(1.0);
        assertThat(appender.contains(Level.WARN, "dropped")).isTrue();
    }

    @Test
    void ledgerDivergenceIsFatal() {
        SignalDispatcher d = dispatcher();
        doThrow(new LedgerDivergenceException(5, "stale", new IllegalStateException()))
                .when(supervisor).reloadAll();

        d.ring().offer(HUP);
        d.drain();

        assertThat(publisher.eventsOf(DaemonFatalEvent.class)).hasSize(1);
    }

    @Test
    void unsupportedSignalIsWarnedNotFatal() {
        os = new FakeOsSignals(Map.of("TERM", TERM));

        dispatcher();

        assertThat(os.installed).containsOnlyKeys("TERM");
        assertThat(appender.contains(Level.WARN, "not available")).isTrue();
    }

    @Test
    void acceptsSigPrefixedNames() {
        WatchkeeperProperties props = new WatchkeeperProperties();
        props.getSignals().setActions(Map.of("sighup", SignalAction.RELOAD));
        SignalDispatcher d = dispatcher(props);

        d.ring().offer(HUP);
        d.drain();

        assertThat(os.installed).containsOnlyKeys("HUP");
        verify(supervisor).reloadAll();
    }

    // --- Test double ---
    static class FakeOsSignals implements OsSignals {
        final Map<String, Integer> numbers;
        final Map<String, SignalHandler> installed = new HashMap<>();

        FakeOsSignals(Map<String, Integer> numbers) {
            this.numbers = numbers;
        }

        @Override
        public OptionalInt install(String name, SignalHandler handler) {
            Integer n = numbers.get(name);
            if (n == null) {
                return OptionalInt.empty();
            }
            installed.put(name, handler);
            return OptionalInt.of(n);
        }
    }
}
