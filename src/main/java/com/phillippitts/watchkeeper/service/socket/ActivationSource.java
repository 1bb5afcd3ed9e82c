package com.phillippitts.watchkeeper.service.socket;

import java.util.Collection;

/**
 * Listening sockets that start on-demand watchers when a client connects.
 */
public interface ActivationSource {

    /** True if any of the named sockets has a connection waiting to be accepted. */
    boolean hasPendingActivity(Collection<String> socketNames);

    /** Stops listening so the watcher's own processes can bind the addresses. */
    void release(Collection<String> socketNames);

    /** Starts listening again after the watcher stopped. */
    void rearm(Collection<String> socketNames);
}
