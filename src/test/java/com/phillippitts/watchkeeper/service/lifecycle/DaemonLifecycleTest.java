package com.phillippitts.watchkeeper.service.lifecycle;

import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.service.watcher.Supervisor;
import com.phillippitts.watchkeeper.service.watcher.event.DaemonFatalEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DaemonLifecycleTest {

    private Supervisor supervisor;
    private List<Integer> exitCodes;
    private DaemonLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        supervisor = mock(Supervisor.class);
        when(supervisor.longestGracefulTimeout()).thenReturn(Duration.ZERO);
        exitCodes = new CopyOnWriteArrayList<>();
        lifecycle = new DaemonLifecycle(supervisor, null, exitCodes::add);
    }

    @Test
    void readyStartsAutostartWatchers() {
        lifecycle.onReady();

        verify(supervisor).startAll();
    }

    @Test
    void shutdownStopsWatchersThenExitsWithCode() {
        lifecycle.requestShutdown("SIGTERM", 0);

        verify(supervisor).stopAll();
        await().atMost(3, SECONDS).until(() -> exitCodes.size() == 1);
        assertThat(exitCodes).containsExactly(0);
        assertThat(lifecycle.isShutdownRequested()).isTrue();
    }

    @Test
    void repeatedShutdownRequestsAreIgnored() {
        lifecycle.requestShutdown("SIGTERM", 0);
        lifecycle.requestShutdown("SIGINT", 0);
        lifecycle.onShutdown();

        verify(supervisor, times(1)).stopAll();
        await().atMost(3, SECONDS).until(() -> exitCodes.size() == 1);
    }

    @Test
    void busyStopAllIsRetried() {
        doThrow(new GateBusyException(Supervisor.CMD_STOP_ALL, Supervisor.CMD_RECONCILE))
                .doNothing()
                .when(supervisor).stopAll();

        lifecycle.onShutdown();

        verify(supervisor, times(2)).stopAll();
    }

    @Test
    void stopAllKeepsRetryingWhileGateStaysBusy() {
        GateBusyException busy = new GateBusyException(Supervisor.CMD_STOP_ALL, Supervisor.CMD_RESTART);
        doThrow(busy).doThrow(busy).doThrow(busy).doThrow(busy)
                .doNothing()
                .when(supervisor).stopAll();

        lifecycle.requestShutdown("SIGTERM", 0);

        verify(supervisor, times(5)).stopAll();
        await().atMost(3, SECONDS).until(() -> exitCodes.size() == 1);
        assertThat(exitCodes).containsExactly(0);
    }

    @Test
    void unstoppableWatchersExitNonZeroAndPreDestroyTriesAgain() {
        lifecycle = new DaemonLifecycle(supervisor, null, exitCodes::add, Duration.ofMillis(300));
        doThrow(new GateBusyException(Supervisor.CMD_STOP_ALL, Supervisor.CMD_RESTART))
                .when(supervisor).stopAll();

        lifecycle.requestShutdown("SIGTERM", 0);

        await().atMost(3, SECONDS).until(() -> exitCodes.size() == 1);
        assertThat(exitCodes).containsExactly(DaemonLifecycle.EXIT_FATAL);
        verify(supervisor, atLeast(2)).stopAll();

        clearInvocations(supervisor);
        doNothing().when(supervisor).stopAll();
        lifecycle.onShutdown();
        lifecycle.onShutdown();

        verify(supervisor, times(1)).stopAll();
    }

    @Test
    void stopRetriesWaitForLongestGracefulTimeout() {
        lifecycle = new DaemonLifecycle(supervisor, null, exitCodes::add, Duration.ZERO);
        when(supervisor.longestGracefulTimeout()).thenReturn(Duration.ofMillis(400));
        doThrow(new GateBusyException(Supervisor.CMD_STOP_ALL, Supervisor.CMD_STOP))
                .when(supervisor).stopAll();

        long started = System.nanoTime();
        lifecycle.onShutdown();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(400));
        verify(supervisor, atLeast(3)).stopAll();
    }

    @Test
    void fatalEventExitsWithSoftwareErrorCode() {
        doNothing().when(supervisor).stopAll();

        lifecycle.onFatal(new DaemonFatalEvent("ledger divergence", new IllegalStateException(), Instant.now()));

        await().atMost(3, SECONDS).until(() -> exitCodes.size() == 1);
        assertThat(exitCodes).containsExactly(DaemonLifecycle.EXIT_FATAL);
    }
}
