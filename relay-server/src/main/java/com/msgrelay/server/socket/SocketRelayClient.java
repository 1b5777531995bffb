package com.msgrelay.server.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.msgrelay.core.message.Message;
import com.msgrelay.core.message.MessageCodec;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Client side of the socket hop: one short-lived TCP connection per message, a single
 * write of the JSON payload, then close.
 */
@Slf4j
public class SocketRelayClient implements MessageRelay, AutoCloseable {

    private final String host;
    private final int port;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public SocketRelayClient(String host, int port) {
        this.host = host;
        this.port = port;
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-client"));
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // the listener never answers, nothing to decode
                    }
                });
    }

    @Override
    public CompletableFuture<Void> send(Message message) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        byte[] payload;
        try {
            payload = MessageCodec.encode(message);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(e);
            return result;
        }

        bootstrap.connect(host, port).addListener((ChannelFutureListener) connectFuture -> {
            if (!connectFuture.isSuccess()) {
                result.completeExceptionally(connectFuture.cause());
                return;
            }
            Channel channel = connectFuture.channel();
            channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) writeFuture -> {
                channel.close();
                if (writeFuture.isSuccess()) {
                    log.debug("Sent {} bytes to {}:{}", payload.length, host, port);
                    result.complete(null);
                } else {
                    result.completeExceptionally(writeFuture.cause());
                }
            });
        });
        return result;
    }

    @Override
    public void close() {
        group.shutdownGracefully();
    }
}
