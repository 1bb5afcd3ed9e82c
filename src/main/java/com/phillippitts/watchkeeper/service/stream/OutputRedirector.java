package com.phillippitts.watchkeeper.service.stream;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Streams a child's stdout and stderr into per-watcher loggers
 * ({@code watchkeeper.output.<watcher>}): stdout at INFO, stderr at WARN.
 *
 * <p>Each stream gets a descriptor from {@link DescriptorTable} and a binding through
 * {@link HandlerRegistry}. {@link #detach} always gives the descriptors back, so a number whose
 * binding was retained by the registry can be handed out again on the next spawn.
 */
@Component
public class OutputRedirector {

    private static final Logger LOG = LogManager.getLogger(OutputRedirector.class);

    static final String OUTPUT_LOGGER_PREFIX = "watchkeeper.output.";

    private final HandlerRegistry registry;
    private final DescriptorTable descriptors;
    private final int maxLineChars;

    public OutputRedirector(HandlerRegistry registry, DescriptorTable descriptors, WatchkeeperProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
        this.maxLineChars = props.getStreams().getMaxLineChars();
    }

    /**
     * Registers both output streams of {@code process}.
     *
     * <p>Either both streams end up registered or neither does.
     */
    public Redirection attach(String watcherName, Process process) {
        Logger output = LogManager.getLogger(OUTPUT_LOGGER_PREFIX + watcherName);
        long pid = process.pid();
        int outFd = descriptors.allocate();
        int errFd = descriptors.allocate();
        try {
            registry.register(outFd, process.getInputStream(),
                    line -> output.info("[{}] {}", pid, LogSanitizer.clean(line, maxLineChars)));
        } catch (RuntimeException e) {
            descriptors.release(outFd);
            descriptors.release(errFd);
            throw e;
        }
        try {
            registry.register(errFd, process.getErrorStream(),
                    line -> output.warn("[{}] {}", pid, LogSanitizer.clean(line, maxLineChars)));
        } catch (RuntimeException e) {
            registry.unregister(outFd);
            descriptors.release(outFd);
            descriptors.release(errFd);
            throw e;
        }
        LOG.debug("Redirected pid {} of watcher {} to fds {}/{}", pid, watcherName, outFd, errFd);
        return new Redirection(outFd, errFd);
    }

    /**
     * Unregisters both descriptors and returns them to the table. Safe to call twice.
     */
    public void detach(Redirection redirection) {
        boolean outClear = registry.unregister(redirection.stdoutFd());
        boolean errClear = registry.unregister(redirection.stderrFd());
        descriptors.release(redirection.stdoutFd());
        descriptors.release(redirection.stderrFd());
        if (!outClear || !errClear) {
            LOG.warn("Descriptors {}/{} released with unconfirmed bindings", redirection.stdoutFd(),
                    redirection.stderrFd());
        }
    }
}
