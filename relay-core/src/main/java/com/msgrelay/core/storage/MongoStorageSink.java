package com.msgrelay.core.storage;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.msgrelay.core.config.RelayConfig;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link StorageSink} backed by a MongoDB collection.
 * <p>
 * The driver's server selection timeout doubles as the bound on {@link #ping()}, so an
 * unreachable server fails the startup check after {@code healthCheckTimeoutMillis}.
 */
@Slf4j
public class MongoStorageSink implements StorageSink {

    private static final String ADMIN_DATABASE = "admin";

    private final MongoClient client;
    private final MongoCollection<Document> collection;

    public MongoStorageSink(RelayConfig.Storage storage) {
        this(MongoClients.create(MongoClientSettings.builder()
                        .applyConnectionString(new ConnectionString(storage.getUri()))
                        .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                                storage.getHealthCheckTimeoutMillis(), TimeUnit.MILLISECONDS))
                        .build()),
                storage.getDatabase(), storage.getCollection());
    }

    MongoStorageSink(MongoClient client, String database, String collection) {
        this.client = client;
        this.collection = client.getDatabase(database).getCollection(collection);
    }

    @Override
    public void ping() {
        try {
            client.getDatabase(ADMIN_DATABASE).runCommand(new Document("ping", 1));
            log.debug("MongoDB ping succeeded");
        } catch (MongoException e) {
            throw new StorageException("MongoDB is not reachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void insert(Map<String, Object> document) {
        try {
            collection.insertOne(new Document(document));
        } catch (MongoException e) {
            throw new StorageException("Insert into " + collection.getNamespace() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
