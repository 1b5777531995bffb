package com.msgrelay.core.storage;

import java.util.Map;

/**
 * Insert-only document sink the socket listener persists messages into.
 * Implementations must be safe for concurrent use by several handler threads.
 */
public interface StorageSink extends AutoCloseable {

    /**
     * Synchronous reachability check, bounded by the implementation's own timeout.
     *
     * @throws StorageException if the store cannot be reached
     */
    void ping();

    /**
     * Inserts one document.
     *
     * @throws StorageException if the insert fails
     */
    void insert(Map<String, Object> document);

    @Override
    void close();
}
