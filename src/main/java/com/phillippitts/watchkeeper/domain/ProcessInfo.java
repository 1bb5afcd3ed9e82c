package com.phillippitts.watchkeeper.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one supervised process as seen at the last watcher transition.
 *
 * @param pid       OS process id
 * @param spawnedAt when the process was confirmed started
 * @param health    liveness at snapshot time
 */
public record ProcessInfo(long pid, Instant spawnedAt, ProcessHealth health) {

    public ProcessInfo {
        Objects.requireNonNull(spawnedAt, "spawnedAt");
        Objects.requireNonNull(health, "health");
    }
}
