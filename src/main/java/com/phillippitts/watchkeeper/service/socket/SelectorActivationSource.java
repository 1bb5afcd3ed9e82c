package com.phillippitts.watchkeeper.service.socket;

import com.phillippitts.watchkeeper.config.properties.WatchkeeperProperties;
import com.phillippitts.watchkeeper.exception.WatchkeeperException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ActivationSource} over non-blocking {@link ServerSocketChannel}s registered with one
 * {@link Selector}.
 *
 * <p>Readiness is polled with {@link Selector#selectNow()} from the reconcile tick; nothing
 * blocks. Pending connections are never accepted here. When the watcher starts, the listening
 * socket is closed so its processes can bind the address, which drops the connection that
 * triggered activation.
 */
@Component
public class SelectorActivationSource implements ActivationSource {

    private static final Logger LOG = LogManager.getLogger(SelectorActivationSource.class);

    private final Map<String, WatchkeeperProperties.SocketProperties> sockets = new LinkedHashMap<>();
    private final Map<String, ServerSocketChannel> listening = new HashMap<>();
    private Selector selector;

    public SelectorActivationSource(WatchkeeperProperties props) {
        for (WatchkeeperProperties.SocketProperties s : props.getSockets()) {
            sockets.put(s.getName(), s);
        }
    }

    @PostConstruct
    public synchronized void open() {
        try {
            selector = Selector.open();
        } catch (IOException e) {
            throw new WatchkeeperException("Cannot open activation selector", e);
        }
        for (String name : sockets.keySet()) {
            try {
                bind(name);
            } catch (IOException e) {
                throw new WatchkeeperException("Cannot bind activation socket '" + name + "'", e);
            }
        }
        if (!sockets.isEmpty()) {
            LOG.info("Activation sockets listening: {}", listening.keySet());
        }
    }

    @Override
    public synchronized boolean hasPendingActivity(Collection<String> socketNames) {
        if (selector == null || socketNames.isEmpty()) {
            return false;
        }
        try {
            selector.selectNow();
        } catch (IOException e) {
            LOG.warn("Activation poll failed: {}", e.toString());
            return false;
        }
        boolean pending = false;
        for (SelectionKey key : selector.selectedKeys()) {
            if (key.isValid() && key.isAcceptable() && socketNames.contains(key.attachment())) {
                pending = true;
            }
        }
        // Level-triggered: keys for other watchers come back on their own poll
        selector.selectedKeys().clear();
        return pending;
    }

    @Override
    public synchronized void release(Collection<String> socketNames) {
        boolean closedAny = false;
        for (String name : socketNames) {
            ServerSocketChannel channel = listening.remove(name);
            if (channel == null) {
                continue;
            }
            try {
                channel.close();
                closedAny = true;
                LOG.debug("Activation socket '{}' released", name);
            } catch (IOException e) {
                LOG.warn("Closing activation socket '{}' failed: {}", name, e.toString());
            }
        }
        if (closedAny) {
            flushCancelledKeys();
        }
    }

    @Override
    public synchronized void rearm(Collection<String> socketNames) {
        if (selector == null) {
            return;
        }
        for (String name : socketNames) {
            if (listening.containsKey(name)) {
                continue;
            }
            if (!sockets.containsKey(name)) {
                LOG.warn("Watcher references unknown activation socket '{}'", name);
                continue;
            }
            try {
                bind(name);
                LOG.debug("Activation socket '{}' re-armed", name);
            } catch (IOException e) {
                LOG.warn("Re-arming activation socket '{}' failed; on-demand start disabled until next stop: {}",
                        name, e.toString());
            }
        }
    }

    /** Bound port of a listening socket, mainly for sockets configured with port 0. */
    public synchronized Optional<Integer> localPort(String name) {
        ServerSocketChannel channel = listening.get(name);
        if (channel == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(((InetSocketAddress) channel.getLocalAddress()).getPort());
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public synchronized boolean isListening(String name) {
        return listening.containsKey(name);
    }

    @PreDestroy
    public synchronized void close() {
        release(new ArrayList<>(listening.keySet()));
        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                LOG.debug("Closing activation selector failed: {}", e.toString());
            }
            selector = null;
        }
    }

    private void bind(String name) throws IOException {
        WatchkeeperProperties.SocketProperties cfg = sockets.get(name);
        ServerSocketChannel channel = ServerSocketChannel.open();
        try {
            channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            channel.bind(new InetSocketAddress(cfg.getHost(), cfg.getPort()));
            channel.configureBlocking(false);
            channel.register(selector, SelectionKey.OP_ACCEPT, name);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        listening.put(name, channel);
    }

    /** A closed channel keeps its port until its key is deregistered by the next selection. */
    private void flushCancelledKeys() {
        try {
            selector.selectNow();
            selector.selectedKeys().clear();
        } catch (IOException e) {
            LOG.debug("Flushing cancelled activation keys failed: {}", e.toString());
        }
    }
}
