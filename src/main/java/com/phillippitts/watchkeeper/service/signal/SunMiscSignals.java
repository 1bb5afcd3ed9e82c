package com.phillippitts.watchkeeper.service.signal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.OptionalInt;

/**
 * {@link OsSignals} backed by {@code sun.misc.Signal} (module {@code jdk.unsupported}).
 */
@Component
public class SunMiscSignals implements OsSignals {

    private static final Logger LOG = LogManager.getLogger(SunMiscSignals.class);

    @Override
    public OptionalInt install(String name, SignalHandler handler) {
        try {
            Signal signal = new Signal(name);
            Signal.handle(signal, handler);
            return OptionalInt.of(signal.getNumber());
        } catch (IllegalArgumentException e) {
            // Unknown on this platform, or reserved by the VM (QUIT, USR1 with some GCs)
            LOG.debug("Cannot install handler for SIG{}: {}", name, e.getMessage());
            return OptionalInt.empty();
        }
    }
}
