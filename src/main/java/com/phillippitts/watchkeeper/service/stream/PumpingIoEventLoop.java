package com.phillippitts.watchkeeper.service.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * {@link IoEventLoop} that runs one blocking pump per bound descriptor on the stream executor.
 *
 * <p>A binding lives from {@code add}/{@code replace} until {@code remove} succeeds, even after
 * its pump reached end of stream, mirroring a multiplexer that keeps a callback registered for
 * a hung-up descriptor until it is explicitly unregistered.
 */
@Component
public class PumpingIoEventLoop implements IoEventLoop {

    private static final Logger LOG = LogManager.getLogger(PumpingIoEventLoop.class);

    private final AsyncTaskExecutor executor;
    private final Map<Integer, Binding> bindings = new ConcurrentHashMap<>();

    public PumpingIoEventLoop(@Qualifier("streamExecutor") AsyncTaskExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void add(int fd, InputStream source, StreamHandler handler) {
        Binding binding = new Binding(source, handler);
        if (bindings.putIfAbsent(fd, binding) != null) {
            throw new IllegalStateException("fd " + fd + " added twice");
        }
        start(fd, binding);
    }

    @Override
    public void remove(int fd) throws IOException {
        Binding binding = bindings.get(fd);
        if (binding == null) {
            throw new IllegalStateException("fd " + fd + " is not bound");
        }
        // A failed close leaves the binding live; the caller verifies with isBound
        binding.source.close();
        bindings.remove(fd, binding);
        binding.cancel();
    }

    @Override
    public void replace(int fd, InputStream source, StreamHandler handler) {
        Binding fresh = new Binding(source, handler);
        Binding stale = bindings.put(fd, fresh);
        if (stale != null) {
            stale.cancel();
            try {
                stale.source.close();
            } catch (IOException e) {
                LOG.debug("Closing overwritten source for fd {} failed: {}", fd, e.toString());
            }
        }
        start(fd, fresh);
    }

    @Override
    public boolean isBound(int fd) {
        return bindings.containsKey(fd);
    }

    /** Visible for tests */
    int boundCount() {
        return bindings.size();
    }

    private void start(int fd, Binding binding) {
        try {
            binding.pump = executor.submit(() -> pump(fd, binding));
        } catch (RuntimeException e) {
            bindings.remove(fd, binding);
            throw e;
        }
    }

    private static void pump(int fd, Binding binding) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(binding.source, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                try {
                    binding.handler.onLine(line);
                } catch (RuntimeException e) {
                    LOG.warn("Handler for fd {} failed: {}", fd, e.toString());
                }
            }
            LOG.debug("fd {} reached end of stream", fd);
        } catch (IOException e) {
            LOG.debug("Pump for fd {} stopped: {}", fd, e.toString());
        }
    }

    private static final class Binding {
        private final InputStream source;
        private final StreamHandler handler;
        private volatile Future<?> pump;

        Binding(InputStream source, StreamHandler handler) {
            this.source = Objects.requireNonNull(source, "source");
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        void cancel() {
            Future<?> f = pump;
            if (f != null) {
                f.cancel(true);
            }
        }
    }
}
