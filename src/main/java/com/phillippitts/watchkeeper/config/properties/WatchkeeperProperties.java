package com.phillippitts.watchkeeper.config.properties;

import com.phillippitts.watchkeeper.service.signal.SignalAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for the supervisor daemon ({@code watchkeeper.*}).
 *
 * <p>Watchers and sockets are read once at startup; runtime additions go through
 * the control API instead of re-binding these properties.
 */
@Validated
@ConfigurationProperties(prefix = "watchkeeper")
public class WatchkeeperProperties {

    /** Interval between reconcile ticks in milliseconds. */
    @Min(10)
    private long checkDelayMs = 1000;

    @Valid
    private Gate gate = new Gate();

    @Valid
    private Commands commands = new Commands();

    @Valid
    private Reconcile reconcile = new Reconcile();

    @Valid
    private Signals signals = new Signals();

    @Valid
    private Streams streams = new Streams();

    @Valid
    private List<WatcherProperties> watchers = new ArrayList<>();

    @Valid
    private List<SocketProperties> sockets = new ArrayList<>();

    public long getCheckDelayMs() {
        return checkDelayMs;
    }

    public void setCheckDelayMs(long checkDelayMs) {
        this.checkDelayMs = checkDelayMs;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Commands getCommands() {
        return commands;
    }

    public void setCommands(Commands commands) {
        this.commands = commands;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public void setReconcile(Reconcile reconcile) {
        this.reconcile = reconcile;
    }

    public Signals getSignals() {
        return signals;
    }

    public void setSignals(Signals signals) {
        this.signals = signals;
    }

    public Streams getStreams() {
        return streams;
    }

    public void setStreams(Streams streams) {
        this.streams = streams;
    }

    public List<WatcherProperties> getWatchers() {
        return watchers;
    }

    public void setWatchers(List<WatcherProperties> watchers) {
        this.watchers = watchers;
    }

    public List<SocketProperties> getSockets() {
        return sockets;
    }

    public void setSockets(List<SocketProperties> sockets) {
        this.sockets = sockets;
    }

    /**
     * Exclusive command gate settings.
     */
    public static class Gate {
        /** Bounded wait for commands arriving from outside the control loop. */
        @Min(0)
        private long acquireTimeoutMs = 2000;

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }
    }

    /**
     * Retry policy applied by the control API when the gate is busy.
     */
    public static class Commands {
        @Min(1)
        @Max(20)
        private int maxAttempts = 3;

        @Min(0)
        private long backoffMs = 200;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }
    }

    /**
     * Periodic reconciler switch. The interval lives at {@code watchkeeper.check-delay-ms}.
     */
    public static class Reconcile {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Signal front-end settings.
     */
    public static class Signals {
        private boolean enabled = true;

        /** Ring buffer slots; signals arriving while the ring is full are counted and dropped. */
        @Min(2)
        @Max(4096)
        private int capacity = 64;

        @Min(1)
        private long pollMs = 50;

        private Map<String, SignalAction> actions = defaultActions();

        private static Map<String, SignalAction> defaultActions() {
            Map<String, SignalAction> defaults = new LinkedHashMap<>();
            defaults.put("TERM", SignalAction.QUIT);
            defaults.put("INT", SignalAction.QUIT);
            defaults.put("HUP", SignalAction.RELOAD);
            defaults.put("CHLD", SignalAction.REAP);
            return defaults;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public long getPollMs() {
            return pollMs;
        }

        public void setPollMs(long pollMs) {
            this.pollMs = pollMs;
        }

        public Map<String, SignalAction> getActions() {
            return actions;
        }

        public void setActions(Map<String, SignalAction> actions) {
            this.actions = actions;
        }
    }

    /**
     * Child output streaming settings.
     */
    public static class Streams {
        @Min(80)
        private int maxLineChars = 4096;

        public int getMaxLineChars() {
            return maxLineChars;
        }

        public void setMaxLineChars(int maxLineChars) {
            this.maxLineChars = maxLineChars;
        }
    }

    /**
     * One managed group of processes running the same command.
     */
    public static class WatcherProperties {
        @NotBlank
        private String name;

        @NotEmpty
        private List<String> command = new ArrayList<>();

        private Map<String, String> env = new LinkedHashMap<>();

        private String workingDir;

        @Min(0)
        private int numProcesses = 1;

        @Min(0)
        private int minProcesses = 0;

        @Min(1)
        private int maxProcesses = 16;

        @Min(0)
        private int maxRetry = 5;

        @Min(0)
        private long gracefulTimeoutMs = 30_000;

        private boolean respawn = true;

        private boolean autostart = true;

        private boolean onDemand = false;

        private List<String> sockets = new ArrayList<>();

        private int priority = 0;

        /** Processes older than this are recycled by reconcile; 0 disables recycling. */
        @Min(0)
        private long maxAgeSeconds = 0;

        @AssertTrue(message = "num-processes must lie within [min-processes, max-processes]")
        public boolean isProcessCountWithinBounds() {
            return minProcesses <= numProcesses && numProcesses <= maxProcesses;
        }

        @AssertTrue(message = "on-demand watchers need at least one socket")
        public boolean isOnDemandBackedBySocket() {
            return !onDemand || !sockets.isEmpty();
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public Map<String, String> getEnv() {
            return env;
        }

        public void setEnv(Map<String, String> env) {
            this.env = env;
        }

        public String getWorkingDir() {
            return workingDir;
        }

        public void setWorkingDir(String workingDir) {
            this.workingDir = workingDir;
        }

        public int getNumProcesses() {
            return numProcesses;
        }

        public void setNumProcesses(int numProcesses) {
            this.numProcesses = numProcesses;
        }

        public int getMinProcesses() {
            return minProcesses;
        }

        public void setMinProcesses(int minProcesses) {
            this.minProcesses = minProcesses;
        }

        public int getMaxProcesses() {
            return maxProcesses;
        }

        public void setMaxProcesses(int maxProcesses) {
            this.maxProcesses = maxProcesses;
        }

        public int getMaxRetry() {
            return maxRetry;
        }

        public void setMaxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
        }

        public long getGracefulTimeoutMs() {
            return gracefulTimeoutMs;
        }

        public void setGracefulTimeoutMs(long gracefulTimeoutMs) {
            this.gracefulTimeoutMs = gracefulTimeoutMs;
        }

        public boolean isRespawn() {
            return respawn;
        }

        public void setRespawn(boolean respawn) {
            this.respawn = respawn;
        }

        public boolean isAutostart() {
            return autostart;
        }

        public void setAutostart(boolean autostart) {
            this.autostart = autostart;
        }

        public boolean isOnDemand() {
            return onDemand;
        }

        public void setOnDemand(boolean onDemand) {
            this.onDemand = onDemand;
        }

        public List<String> getSockets() {
            return sockets;
        }

        public void setSockets(List<String> sockets) {
            this.sockets = sockets;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public long getMaxAgeSeconds() {
            return maxAgeSeconds;
        }

        public void setMaxAgeSeconds(long maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
        }
    }

    /**
     * Listening socket used for on-demand activation.
     */
    public static class SocketProperties {
        @NotBlank
        private String name;

        @NotBlank
        private String host = "127.0.0.1";

        /** 0 binds an ephemeral port. */
        @Min(0)
        @Max(65535)
        private int port;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
