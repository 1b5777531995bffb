package com.msgrelay.app;

import com.msgrelay.core.config.RelayConfig;
import com.msgrelay.server.http.HttpFrontHandler;
import com.msgrelay.server.http.NettyHttpServer;
import com.msgrelay.server.http.WebContent;
import com.msgrelay.server.socket.SocketRelayClient;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;

/**
 * Runs the HTTP front together with the relay client it hands messages to.
 */
@Slf4j
public class HttpFrontUnit implements RelayUnit {

    public static final String NAME = "http";

    private final RelayConfig config;
    private volatile NettyHttpServer server;
    private volatile boolean stopped;

    public HttpFrontUnit(RelayConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() throws Exception {
        RelayConfig.Http http = config.getHttp();
        RelayConfig.Socket socket = config.getSocket();
        try (SocketRelayClient relayClient = new SocketRelayClient(socket.getHost(), socket.getPort())) {
            WebContent webContent = new WebContent(Paths.get(http.getWebRoot()));
            server = new NettyHttpServer(http.getHost(), http.getPort(), http.getHandlerThreads(),
                    new HttpFrontHandler(webContent, relayClient));
            if (stopped) {
                log.info("{} unit stopped before it started", NAME);
                return;
            }
            try {
                server.start().get();
                server.closeFuture().get();
            } finally {
                server.shutdown();
            }
        }
    }

    @Override
    public void stop() {
        stopped = true;
        NettyHttpServer current = server;
        if (current != null) {
            current.shutdown();
        }
    }

    /**
     * Port actually bound, useful when configured with port 0. Zero until started.
     */
    public int getBoundPort() {
        NettyHttpServer current = server;
        return current == null ? 0 : current.getBoundPort();
    }
}
