package com.phillippitts.watchkeeper.service.stream;

import com.phillippitts.watchkeeper.exception.LedgerDivergenceException;
import com.phillippitts.watchkeeper.exception.RegistrationConflictException;
import com.phillippitts.watchkeeper.testutil.FakeIoEventLoop;
import com.phillippitts.watchkeeper.testutil.InMemoryAppender;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlerRegistryTest {

    private FakeIoEventLoop loop;
    private HandlerRegistry registry;
    private InMemoryAppender appender;

    @BeforeEach
    void setUp() {
        loop = new FakeIoEventLoop();
        registry = new HandlerRegistry(loop);
        appender = InMemoryAppender.attachTo(HandlerRegistry.class.getName());
    }

    @AfterEach
    void tearDown() {
        appender.detach();
    }

    private static InputStream empty() {
        return new ByteArrayInputStream(new byte[0]);
    }

    @Test
    void registerBindsLoopAndLedger() {
        List<String> lines = new ArrayList<>();

        registry.register(3, empty(), lines::add);
        loop.emit(3, "hello");

        assertThat(registry.isRegistered(3)).isTrue();
        assertThat(loop.isBound(3)).isTrue();
        assertThat(lines).containsExactly("hello");
    }

    @Test
    void registeringLiveDescriptorTwiceConflicts() {
        registry.register(3, empty(), line -> { });

        assertThatThrownBy(() -> registry.register(3, empty(), line -> { }))
                .isInstanceOf(RegistrationConflictException.class)
                .hasMessageContaining("3");
        assertThat(loop.adds.get()).isEqualTo(1);
    }

    @Test
    void unregisterOfUnknownDescriptorIsNoop() {
        assertThat(registry.unregister(42)).isTrue();
        assertThat(loop.removeAttempts.get()).isZero();
    }

    @Test
    void unregisterClearsBothSides() {
        registry.register(3, empty(), line -> { });

        assertThat(registry.unregister(3)).isTrue();

        assertThat(registry.isRegistered(3)).isFalse();
        assertThat(loop.isBound(3)).isFalse();
    }

    @Test
    void failedRemovalThatClearedTheLoopDropsLedgerEntry() {
        registry.register(3, empty(), line -> { });
        loop.failNextRemovals(1, true);

        boolean clear = registry.unregister(3);

        assertThat(clear).isTrue();
        assertThat(registry.isRegistered(3)).isFalse();
        assertThat(appender.contains(Level.INFO, "verified clear")).isTrue();
    }

    @Test
    void failedRemovalThatLeftBindingIsRetained() {
        registry.register(3, empty(), line -> { });
        loop.failNextRemovals(1, false);

        boolean clear = registry.unregister(3);

        assertThat(clear).isFalse();
        assertThat(registry.isRegistered(3)).isTrue();
        assertThat(registry.isRetained(3)).isTrue();
        assertThat(loop.isBound(3)).isTrue();
    }

    @Test
    void reusedRetainedDescriptorIsReverifiedThenAdded() {
        registry.register(3, empty(), line -> { });
        loop.failNextRemovals(1, false);
        registry.unregister(3);
        List<String> fresh = new ArrayList<>();

        // Act: same number handed out again, retry removal now works
        registry.register(3, empty(), fresh::add);
        loop.emit(3, "new");

        assertThat(registry.isRetained(3)).isFalse();
        assertThat(loop.replaces.get()).isZero();
        assertThat(loop.adds.get()).isEqualTo(2);
        assertThat(fresh).containsExactly("new");
    }

    @Test
    void reusedRetainedDescriptorOverwritesStillLiveBinding() {
        registry.register(3, empty(), line -> { });
        loop.failNextRemovals(2, false);
        registry.unregister(3);
        List<String> fresh = new ArrayList<>();

        registry.register(3, empty(), fresh::add);
        loop.emit(3, "new");

        assertThat(loop.replaces.get()).isEqualTo(1);
        assertThat(registry.isRetained(3)).isFalse();
        assertThat(fresh).containsExactly("new");
    }

    @Test
    void refusedOverwriteOfStaleBindingIsLedgerDivergence() {
        registry.register(3, empty(), line -> { });
        loop.failNextRemovals(2, false);
        registry.unregister(3);
        loop.refuseReplace(true);

        assertThatThrownBy(() -> registry.register(3, empty(), line -> { }))
                .isInstanceOf(LedgerDivergenceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void bindingWithoutLedgerEntryIsOverwrittenWithWarning() {
        loop.bindStale(7);

        registry.register(7, empty(), line -> { });

        assertThat(loop.replaces.get()).isEqualTo(1);
        assertThat(registry.isRegistered(7)).isTrue();
        assertThat(appender.contains(Level.WARN, "without a ledger entry")).isTrue();
    }

    @Test
    void ledgerMatchesLoopAfterMixedFailures() {
        for (int fd = 3; fd < 9; fd++) {
            registry.register(fd, empty(), line -> { });
        }
        loop.failNextRemovals(1, true);
        registry.unregister(3);
        loop.failNextRemovals(1, false);
        registry.unregister(4);
        registry.unregister(5);
        registry.register(4, empty(), line -> { });

        Set<Integer> bound = new TreeSet<>();
        for (int fd = 0; fd < 16; fd++) {
            if (loop.isBound(fd)) {
                bound.add(fd);
            }
        }
        assertThat(registry.registeredDescriptors()).isEqualTo(bound).containsExactly(4, 6, 7, 8);
    }
}
