package com.msgrelay.server;

import com.msgrelay.core.storage.StorageException;
import com.msgrelay.core.storage.StorageSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link StorageSink} that records every inserted document.
 */
public class RecordingStorageSink implements StorageSink {

    private final BlockingQueue<Map<String, Object>> inserted = new LinkedBlockingQueue<>();
    private final AtomicInteger insertAttempts = new AtomicInteger();
    private final AtomicInteger pings = new AtomicInteger();
    private volatile StorageException pingFailure;
    private volatile StorageException insertFailure;
    private volatile boolean closed;

    public static RecordingStorageSink unreachable() {
        RecordingStorageSink sink = new RecordingStorageSink();
        sink.pingFailure = new StorageException("MongoDB is not reachable",
                new IllegalStateException("Timed out after 5000 ms"));
        return sink;
    }

    public RecordingStorageSink failInsertsWith(StorageException failure) {
        this.insertFailure = failure;
        return this;
    }

    @Override
    public void ping() {
        pings.incrementAndGet();
        if (pingFailure != null) {
            throw pingFailure;
        }
    }

    @Override
    public void insert(Map<String, Object> document) {
        insertAttempts.incrementAndGet();
        if (insertFailure != null) {
            throw insertFailure;
        }
        inserted.add(new LinkedHashMap<>(document));
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Waits until {@code count} documents have been inserted and returns them in insertion order.
     */
    public List<Map<String, Object>> awaitInserted(int count, Duration timeout) throws InterruptedException {
        List<Map<String, Object>> documents = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (documents.size() < count) {
            long remaining = deadline - System.nanoTime();
            Map<String, Object> next = inserted.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            if (next == null) {
                throw new AssertionError("Expected " + count + " inserted documents but got " + documents.size());
            }
            documents.add(next);
        }
        return documents;
    }

    public List<Map<String, Object>> inserted() {
        return new ArrayList<>(inserted);
    }

    public int insertAttempts() {
        return insertAttempts.get();
    }

    public int pings() {
        return pings.get();
    }

    public boolean isClosed() {
        return closed;
    }
}
