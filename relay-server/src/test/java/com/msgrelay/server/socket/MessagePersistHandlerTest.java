package com.msgrelay.server.socket;

import ch.qos.logback.classic.Level;
import com.msgrelay.core.message.Message;
import com.msgrelay.core.message.MessageCodec;
import com.msgrelay.core.storage.StorageException;
import com.msgrelay.server.LogCapture;
import com.msgrelay.server.RecordingStorageSink;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessagePersistHandlerTest {

    private static final Instant RECEIVED_AT = Instant.parse("2024-05-01T10:15:30Z");

    private RecordingStorageSink sink;
    private Clock clock;

    @BeforeEach
    void setUp() {
        sink = new RecordingStorageSink();
        clock = Clock.fixed(RECEIVED_AT, ZoneOffset.UTC);
    }

    @Test
    void validPayloadIsStampedAndStored() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));
        byte[] wire = MessageCodec.encode(Message.builder().username("alice").message("hello").build());

        channel.writeInbound(Unpooled.wrappedBuffer(wire));

        List<Map<String, Object>> inserted = sink.inserted();
        assertEquals(1, inserted.size());
        assertEquals(List.of("username", "message", "date"), List.copyOf(inserted.get(0).keySet()));
        assertEquals("alice", inserted.get(0).get("username"));
        assertEquals("hello", inserted.get(0).get("message"));
        assertEquals(Date.from(RECEIVED_AT), inserted.get(0).get("date"));
        assertFalse(channel.isOpen(), "connection must be closed after the message is handled");
        assertNull(channel.readOutbound(), "nothing is ever written back to the sender");
    }

    @Test
    void senderSuppliedDateIsOverwritten() {
        EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));

        channel.writeInbound(payload("{\"username\":\"alice\",\"message\":\"hi\",\"date\":\"1999-12-31\"}"));

        assertEquals(Date.from(RECEIVED_AT), sink.inserted().get(0).get("date"));
    }

    @Test
    void malformedPayloadIsLoggedAndNotStored() {
        try (LogCapture logs = LogCapture.of(MessagePersistHandler.class)) {
            EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));

            channel.writeInbound(payload("{\"username\": \"alice\", "));

            assertEquals(0, sink.insertAttempts());
            assertFalse(channel.isOpen());
            assertTrue(logs.contains(Level.ERROR, "Error handling socket request"));
        }
    }

    @Test
    void nonObjectPayloadIsNotStored() {
        EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));

        channel.writeInbound(payload("[\"alice\", \"hello\"]"));

        assertEquals(0, sink.insertAttempts());
        assertFalse(channel.isOpen());
    }

    @Test
    void insertFailureIsLoggedAndConnectionClosed() {
        sink.failInsertsWith(new StorageException("Insert into messages_db.messages failed",
                new IllegalStateException("not primary")));
        try (LogCapture logs = LogCapture.of(MessagePersistHandler.class)) {
            EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));

            channel.writeInbound(payload("{\"username\":\"alice\",\"message\":\"hello\"}"));

            assertEquals(1, sink.insertAttempts());
            assertTrue(sink.inserted().isEmpty());
            assertFalse(channel.isOpen());
            assertTrue(logs.contains(Level.ERROR, "Error inserting message into storage"));
        }
    }

    @Test
    void onlyTheFirstReceiveIsHandled() {
        List<Runnable> tasks = new ArrayList<>();
        EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, tasks::add));
        ByteBuf first = payload("{\"username\":\"alice\",\"message\":\"one\"}");
        ByteBuf second = payload("{\"username\":\"alice\",\"message\":\"two\"}");

        channel.writeInbound(first);
        channel.writeInbound(second);
        assertEquals(1, tasks.size());
        assertFalse(channel.config().isAutoRead(), "no further reads after the first payload");

        tasks.forEach(Runnable::run);

        assertEquals(1, sink.inserted().size());
        assertEquals("one", sink.inserted().get(0).get("message"));
        assertEquals(0, first.refCnt());
        assertEquals(0, second.refCnt());
        assertFalse(channel.isOpen());
    }

    @Test
    void connectionClosedWithoutPayloadStoresNothing() {
        EmbeddedChannel channel = new EmbeddedChannel(new MessagePersistHandler(sink, clock, Runnable::run));

        channel.close();

        assertEquals(0, sink.insertAttempts());
    }

    private static ByteBuf payload(String json) {
        return Unpooled.copiedBuffer(json, CharsetUtil.UTF_8);
    }
}
