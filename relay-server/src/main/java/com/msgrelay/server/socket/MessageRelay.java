package com.msgrelay.server.socket;

import com.msgrelay.core.message.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Hands a message over to the socket listener. Send-once: no retry and no acknowledgment,
 * the returned future only reports whether the bytes were written.
 */
public interface MessageRelay {

    CompletableFuture<Void> send(Message message);
}
