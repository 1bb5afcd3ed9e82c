package com.phillippitts.watchkeeper.service.watcher;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one watcher.
 *
 * @param name            unique watcher name
 * @param command         executable and arguments
 * @param env             extra environment entries
 * @param workingDir      working directory (nullable: inherit the daemon's)
 * @param numProcesses    initial desired process count
 * @param minProcesses    lower bound for scaling
 * @param maxProcesses    upper bound for scaling
 * @param maxRetry        retries per process slot after the first failed attempt
 * @param gracefulTimeout wait between termination request and force-kill
 * @param respawn         whether reconcile replaces processes that exited
 * @param autostart       whether {@code startAll} starts this watcher
 * @param onDemand        start only when one of {@code sockets} sees a connection
 * @param sockets         activation socket names
 * @param priority        higher starts earlier and stops later
 * @param maxAge          processes older than this are recycled; {@link Duration#ZERO} disables
 */
public record WatcherSpec(
        String name,
        List<String> command,
        Map<String, String> env,
        Path workingDir,
        int numProcesses,
        int minProcesses,
        int maxProcesses,
        int maxRetry,
        Duration gracefulTimeout,
        boolean respawn,
        boolean autostart,
        boolean onDemand,
        List<String> sockets,
        int priority,
        Duration maxAge
) {

    public WatcherSpec {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Watcher name must not be blank");
        }
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Watcher '" + name + "' has no command");
        }
        env = env == null ? Map.of() : Map.copyOf(env);
        sockets = sockets == null ? List.of() : List.copyOf(sockets);
        Objects.requireNonNull(gracefulTimeout, "gracefulTimeout");
        Objects.requireNonNull(maxAge, "maxAge");
        if (minProcesses < 0 || minProcesses > numProcesses || numProcesses > maxProcesses) {
            throw new IllegalArgumentException("Watcher '" + name + "': num-processes " + numProcesses
                    + " outside [" + minProcesses + ", " + maxProcesses + "]");
        }
        if (maxRetry < 0) {
            throw new IllegalArgumentException("Watcher '" + name + "': max-retry must be >= 0");
        }
        if (onDemand && sockets.isEmpty()) {
            throw new IllegalArgumentException("On-demand watcher '" + name + "' has no sockets");
        }
    }

    public static WatcherSpec from(WatchkeeperProperties.WatcherProperties p) {
        String dir = p.getWorkingDir();
        return new WatcherSpec(
                p.getName(),
                p.getCommand(),
                p.getEnv(),
                dir == null || dir.isBlank() ? null : Path.of(dir),
                p.getNumProcesses(),
                p.getMinProcesses(),
                p.getMaxProcesses(),
                p.getMaxRetry(),
                Duration.ofMillis(p.getGracefulTimeoutMs()),
                p.isRespawn(),
                p.isAutostart(),
                p.isOnDemand(),
                p.getSockets(),
                p.getPriority(),
                Duration.ofSeconds(p.getMaxAgeSeconds())
        );
    }

    /** Total attempts allowed per process slot. */
    public int attemptsPerSlot() {
        return maxRetry + 1;
    }
}
