package com.msgrelay.server.http;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class NettyHttpServer {

    private static final int MAX_CONTENT_LENGTH = 65536;

    private final String host;
    private final int port;
    private final int handlerThreads;
    private final HttpFrontHandler frontHandler;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    // page reads and form handling run here, off the I/O threads
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;
    private final CompletableFuture<Void> startFuture = new CompletableFuture<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final CompletableFuture<Void> shutdownFuture = new CompletableFuture<>();

    private int boundPort;

    public NettyHttpServer(String host, int port, int handlerThreads, HttpFrontHandler frontHandler) {
        this.host = host;
        this.port = port;
        this.handlerThreads = handlerThreads;
        this.frontHandler = frontHandler;
    }

    public CompletableFuture<Void> start() {
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("http-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("http-worker"));
        handlerGroup = new DefaultEventExecutorGroup(handlerThreads, new DefaultThreadFactory("http-handler"));

        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        public void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new HttpServerCodec());
                            ch.pipeline().addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            ch.pipeline().addLast(handlerGroup, "front", frontHandler);
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true);

            // bind is asynchronous, the result is reported through startFuture
            ChannelFuture f = b.bind(host, port);
            f.addListener(future -> {
                if (future.isSuccess()) {
                    serverChannel = f.channel();
                    boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
                    serverChannel.closeFuture().addListener(closed -> closeFuture.complete(null));
                    log.info("HTTP server started on {}:{}", host, boundPort);
                    startFuture.complete(null);
                } else {
                    log.error("HTTP server failed to start on {}:{}", host, port, future.cause());
                    startFuture.completeExceptionally(future.cause());
                    shutdown();
                }
            });

            return startFuture;

        } catch (Exception e) {
            startFuture.completeExceptionally(e);
            shutdown();
            return startFuture;
        }
    }

    /**
     * Completes when the server channel closes.
     */
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    public CompletableFuture<Void> shutdown() {
        log.info("Shutting down HTTP server on {}:{}", host, boundPort != 0 ? boundPort : port);
        if (serverChannel != null) {
            serverChannel.close();
        }
        CompletableFuture<Void> bossShutdownFuture = shutdownGracefully("BossGroup", bossGroup);
        CompletableFuture<Void> workerShutdownFuture = shutdownGracefully("WorkerGroup", workerGroup);
        CompletableFuture<Void> handlerShutdownFuture = shutdownGracefully("HandlerGroup", handlerGroup);

        CompletableFuture.allOf(bossShutdownFuture, workerShutdownFuture, handlerShutdownFuture)
                .thenRun(() -> {
                    log.info("HTTP server on {}:{} shut down completely.", host, boundPort);
                    closeFuture.complete(null);
                    shutdownFuture.complete(null);
                })
                .exceptionally(e -> {
                    log.error("HTTP server shutdown encountered errors: {}", e.getMessage());
                    closeFuture.complete(null);
                    shutdownFuture.completeExceptionally(e);
                    return null;
                });

        return shutdownFuture;
    }

    private static CompletableFuture<Void> shutdownGracefully(String name, EventExecutorGroup group) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (group == null) {
            done.complete(null);
            return done;
        }
        group.shutdownGracefully().addListener(f -> {
            if (f.isSuccess()) {
                log.debug("{} shutdown gracefully.", name);
                done.complete(null);
            } else {
                log.error("{} shutdown failed.", name, f.cause());
                done.completeExceptionally(f.cause());
            }
        });
        return done;
    }

    public int getBoundPort() {
        return boundPort;
    }
}
