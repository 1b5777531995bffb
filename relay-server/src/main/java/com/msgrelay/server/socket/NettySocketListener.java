package com.msgrelay.server.socket;

import com.msgrelay.core.config.RelayConfig;
import com.msgrelay.core.storage.StorageException;
import com.msgrelay.core.storage.StorageSink;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * TCP listener that receives messages from the HTTP front and persists them.
 * <p>
 * {@link #start()} checks that the storage sink is reachable before binding. When it is not,
 * the returned future fails and the listener never accepts a connection.
 */
@Slf4j
public class NettySocketListener {

    private final String host;
    private final int port;
    private final int bufferSize;
    private final StorageSink storageSink;
    private final Clock clock;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService persistExecutor;
    private Channel serverChannel;
    private final CompletableFuture<Void> startFuture = new CompletableFuture<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private int boundPort;

    public NettySocketListener(RelayConfig.Socket socket, StorageSink storageSink) {
        this(socket.getHost(), socket.getPort(), socket.getBufferSize(), storageSink, Clock.systemUTC());
    }

    public NettySocketListener(String host, int port, int bufferSize, StorageSink storageSink, Clock clock) {
        this.host = host;
        this.port = port;
        this.bufferSize = bufferSize;
        this.storageSink = storageSink;
        this.clock = clock;
    }

    public CompletableFuture<Void> start() {
        try {
            storageSink.ping();
            log.info("Connection to storage established");
        } catch (StorageException e) {
            log.error("Could not connect to storage, socket listener will not start: {}", e.getMessage());
            startFuture.completeExceptionally(e);
            closeFuture.complete(null);
            return startFuture;
        }

        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("socket-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("socket-worker"));
        // one thread per in-flight connection, so a slow insert only stalls its own connection
        persistExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("socket-handler"));

        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        public void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new MessagePersistHandler(storageSink, clock, persistExecutor));
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(bufferSize));

            ChannelFuture f = b.bind(host, port);
            f.addListener(future -> {
                if (future.isSuccess()) {
                    serverChannel = f.channel();
                    boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
                    serverChannel.closeFuture().addListener(closed -> closeFuture.complete(null));
                    log.info("Socket listener started on {}:{}", host, boundPort);
                    startFuture.complete(null);
                } else {
                    log.error("Socket listener failed to bind {}:{}", host, port, future.cause());
                    startFuture.completeExceptionally(future.cause());
                    shutdown();
                }
            });
        } catch (Exception e) {
            startFuture.completeExceptionally(e);
            shutdown();
        }
        return startFuture;
    }

    /**
     * Completes once the listener stops accepting, or right away if it never started.
     */
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    public CompletableFuture<Void> shutdown() {
        log.info("Shutting down socket listener on {}:{}", host, boundPort != 0 ? boundPort : port);
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (persistExecutor != null) {
            persistExecutor.shutdown();
        }
        closeFuture.complete(null);
        return closeFuture;
    }

    public int getBoundPort() {
        return boundPort;
    }
}
