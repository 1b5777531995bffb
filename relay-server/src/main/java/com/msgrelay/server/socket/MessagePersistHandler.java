package com.msgrelay.server.socket;

import com.msgrelay.core.message.MessageCodec;
import com.msgrelay.core.message.MessageConstants;
import com.msgrelay.core.storage.StorageException;
import com.msgrelay.core.storage.StorageSink;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;
import java.time.Clock;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Per-connection handler of the socket listener: one read, one message.
 * <p>
 * The first receive is taken as the whole payload. It is decoded, stamped with the receipt
 * time and inserted on the persist executor, then the connection is closed whatever happened.
 * Nothing is ever written back to the peer.
 */
@Slf4j
public class MessagePersistHandler extends ChannelInboundHandlerAdapter {

    private final StorageSink storageSink;
    private final Clock clock;
    private final Executor persistExecutor;

    private boolean received;

    public MessagePersistHandler(StorageSink storageSink, Clock clock, Executor persistExecutor) {
        this.storageSink = storageSink;
        this.clock = clock;
        this.persistExecutor = persistExecutor;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (received || !(msg instanceof ByteBuf)) {
                return;
            }
            received = true;
            ctx.channel().config().setAutoRead(false);

            byte[] payload = ByteBufUtil.getBytes((ByteBuf) msg);
            SocketAddress remote = ctx.channel().remoteAddress();
            persistExecutor.execute(() -> {
                try {
                    persist(payload, remote);
                } finally {
                    ctx.close();
                }
            });
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    void persist(byte[] payload, SocketAddress remote) {
        try {
            Map<String, Object> document = MessageCodec.decode(payload);
            document.put(MessageConstants.FIELD_DATE, Date.from(clock.instant()));
            try {
                storageSink.insert(document);
                log.info("Stored message: {}", document);
            } catch (StorageException e) {
                log.error("Error inserting message into storage: {}", e.getMessage(), e);
            }
        } catch (Exception e) {
            log.error("Error handling socket request from {}: {}", remote, e.getMessage());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!received) {
            log.debug("Connection from {} closed without a payload", ctx.channel().remoteAddress());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Error on socket connection from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
