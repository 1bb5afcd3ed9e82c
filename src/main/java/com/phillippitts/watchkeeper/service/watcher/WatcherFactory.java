package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.service.spawn.ProcessFactory;
import com.phillippitts.watchkeeper.service.stream.OutputRedirector;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds {@link Watcher}s wired to the shared spawn and output collaborators.
 */
@Component
public class WatcherFactory {

    private final ProcessFactory processFactory;
    private final OutputRedirector redirector;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Autowired
    public WatcherFactory(ProcessFactory processFactory,
                          OutputRedirector redirector,
                          ApplicationEventPublisher publisher) {
        this(processFactory, redirector, publisher, Clock.systemUTC());
    }

    public WatcherFactory(ProcessFactory processFactory,
                          OutputRedirector redirector,
                          ApplicationEventPublisher publisher,
                          Clock clock) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.redirector = Objects.requireNonNull(redirector, "redirector");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Watcher create(WatcherSpec spec) {
        return new Watcher(spec, processFactory, redirector, publisher, clock);
    }
}
