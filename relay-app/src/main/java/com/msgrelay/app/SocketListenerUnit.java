package com.msgrelay.app;

import com.msgrelay.core.config.RelayConfig;
import com.msgrelay.core.storage.MongoStorageSink;
import com.msgrelay.core.storage.StorageSink;
import com.msgrelay.server.socket.NettySocketListener;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Runs the socket listener with its storage sink. If the sink is unreachable at startup the
 * unit returns without ever accepting a connection.
 */
@Slf4j
public class SocketListenerUnit implements RelayUnit {

    public static final String NAME = "socket";

    private final RelayConfig config;
    private final Function<RelayConfig.Storage, StorageSink> sinkFactory;
    private volatile NettySocketListener listener;
    private volatile boolean stopped;

    public SocketListenerUnit(RelayConfig config) {
        this(config, MongoStorageSink::new);
    }

    public SocketListenerUnit(RelayConfig config, Function<RelayConfig.Storage, StorageSink> sinkFactory) {
        this.config = config;
        this.sinkFactory = sinkFactory;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() throws Exception {
        try (StorageSink sink = sinkFactory.apply(config.getStorage())) {
            listener = new NettySocketListener(config.getSocket(), sink);
            if (stopped) {
                log.info("{} unit stopped before it started", NAME);
                return;
            }
            try {
                listener.start().get();
            } catch (ExecutionException e) {
                log.error("Socket listener did not start: {}", e.getCause().getMessage());
                return;
            }
            try {
                listener.closeFuture().get();
            } finally {
                listener.shutdown();
            }
        }
    }

    @Override
    public void stop() {
        stopped = true;
        NettySocketListener current = listener;
        if (current != null) {
            current.shutdown();
        }
    }

    public int getBoundPort() {
        NettySocketListener current = listener;
        return current == null ? 0 : current.getBoundPort();
    }
}
