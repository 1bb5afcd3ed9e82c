package com.phillippitts.watchkeeper.service.stream;

/**
 * Callback bound to an output descriptor; invoked once per line read from it.
 */
@FunctionalInterface
public interface StreamHandler {
    void onLine(String line);
}
