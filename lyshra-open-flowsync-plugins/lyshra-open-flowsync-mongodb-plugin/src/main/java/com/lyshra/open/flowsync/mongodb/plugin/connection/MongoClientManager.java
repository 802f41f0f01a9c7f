package com.lyshra.open.flowsync.mongodb.plugin.connection;

import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.mongodb.plugin.config.MongoConnectionConfig;
import com.lyshra.open.flowsync.mongodb.plugin.error.FlowSyncMongoErrorCodes;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Owns the reactive {@link MongoClient} of one connection configuration.
 *
 * <p>The client is created lazily on first use and shared by every store built on this
 * manager. {@link #close()} releases it; a closed manager creates a fresh client when used
 * again.</p>
 */
@Slf4j
public class MongoClientManager implements AutoCloseable {

    private final MongoConnectionConfig config;
    private final Object lock = new Object();
    private volatile MongoClient client;

    public MongoClientManager(MongoConnectionConfig config) {
        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new FlowSyncRuntimeException(FlowSyncMongoErrorCodes.INVALID_CONNECTION_CONFIG,
                    Map.of("message", e.getMessage()), e);
        }
        this.config = config;
    }

    public MongoConnectionConfig getConfig() {
        return config;
    }

    public MongoClient getClient() {
        MongoClient current = client;
        if (current == null) {
            synchronized (lock) {
                current = client;
                if (current == null) {
                    current = createClient();
                    client = current;
                }
            }
        }
        return current;
    }

    public MongoDatabase getDatabase() {
        return getClient().getDatabase(config.getDatabase());
    }

    /**
     * @param baseName collection name without the configured prefix
     */
    public MongoCollection<Document> getCollection(String baseName) {
        return getDatabase().getCollection(config.collectionName(baseName));
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (client != null) {
                client.close();
                client = null;
                log.info("Closed MongoDB client for {}", maskConnectionString(config.getConnectionString()));
            }
        }
    }

    private MongoClient createClient() {
        try {
            MongoClient created = MongoClients.create(buildSettings(config));
            log.info("Created MongoDB client for {} (database {})",
                    maskConnectionString(config.getConnectionString()), config.getDatabase());
            return created;
        } catch (IllegalArgumentException e) {
            throw new FlowSyncRuntimeException(FlowSyncMongoErrorCodes.INVALID_CONNECTION_CONFIG,
                    Map.of("message", String.valueOf(e.getMessage())), e);
        } catch (RuntimeException e) {
            throw new FlowSyncRuntimeException(FlowSyncMongoErrorCodes.CONNECTION_FAILED,
                    Map.of("message", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Driver settings for {@code config}. Building the settings never contacts a server.
     */
    public static MongoClientSettings buildSettings(MongoConnectionConfig config) {
        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.getConnectionString()));

        if (config.getUsername() != null && !config.getUsername().isBlank()
                && config.getPassword() != null && !config.getPassword().isBlank()) {
            builder.credential(MongoCredential.createCredential(
                    config.getUsername(),
                    config.getAuthDatabase() != null ? config.getAuthDatabase() : "admin",
                    config.getPassword().toCharArray()));
        }

        builder.applyToConnectionPoolSettings(pool -> {
            pool.maxSize(config.getMaxPoolSize());
            pool.minSize(config.getMinPoolSize());
            pool.maxWaitTime(config.getMaxWaitTime().toMillis(), TimeUnit.MILLISECONDS);
        });
        builder.applyToServerSettings(server ->
                server.heartbeatFrequency(config.getHeartbeatFrequency().toMillis(), TimeUnit.MILLISECONDS));
        builder.applyToClusterSettings(cluster ->
                cluster.serverSelectionTimeout(config.getServerSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS));

        return builder
                .readPreference(toReadPreference(config.getReadPreference()))
                .writeConcern(parseWriteConcern(config.getWriteConcern()))
                .retryWrites(config.isRetryWrites())
                .retryReads(config.isRetryReads())
                .build();
    }

    static ReadPreference toReadPreference(String readPreference) {
        if (readPreference == null || readPreference.isBlank()) {
            return ReadPreference.primary();
        }
        return ReadPreference.valueOf(readPreference.trim());
    }

    /**
     * Parses {@code w:1}, {@code w:2}, {@code w:majority} or a tag set name after {@code w:}.
     */
    static WriteConcern parseWriteConcern(String writeConcern) {
        if (writeConcern == null || writeConcern.isBlank()) {
            return WriteConcern.MAJORITY;
        }
        String normalized = writeConcern.toLowerCase(Locale.ROOT).replace(" ", "");
        if (!normalized.startsWith("w:")) {
            throw new IllegalArgumentException("Write concern must look like w:<value>, got " + writeConcern);
        }
        String value = normalized.substring(2);
        if ("majority".equals(value)) {
            return WriteConcern.MAJORITY;
        }
        try {
            return new WriteConcern(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return new WriteConcern(value);
        }
    }

    static String maskConnectionString(String connectionString) {
        if (connectionString == null) {
            return "null";
        }
        return connectionString.replaceAll("://[^:/@]+:[^@]+@", "://***:***@");
    }
}
