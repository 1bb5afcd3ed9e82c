package com.phillippitts.watchkeeper.service.signal;

import sun.misc.SignalHandler;

import java.util.OptionalInt;

/**
 * Installs signal handlers with the JVM.
 */
public interface OsSignals {

    /**
     * @param name signal name without the {@code SIG} prefix, e.g. {@code HUP}
     * @return the platform signal number, or empty if the signal is unknown here or reserved
     *         by the JVM
     */
    OptionalInt install(String name, SignalHandler handler);
}
