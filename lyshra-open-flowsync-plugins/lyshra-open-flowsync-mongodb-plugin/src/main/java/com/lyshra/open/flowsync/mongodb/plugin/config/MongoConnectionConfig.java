package com.lyshra.open.flowsync.mongodb.plugin.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Connection settings of the MongoDB persistence plugin.
 *
 * <p>Build with {@link #builder()}, or start from {@link #localDefaults(String)} for a
 * single local server. {@link #validate()} rejects unusable settings before any client
 * is created.</p>
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "password")
public class MongoConnectionConfig {

    /**
     * MongoDB connection URI, e.g. {@code mongodb://localhost:27017} or {@code mongodb+srv://cluster.example.net}.
     */
    @NotBlank
    private final String connectionString;

    @NotBlank
    private final String database;

    /**
     * Optional, may also be part of the connection string.
     */
    private final String username;

    private final String password;

    @Builder.Default
    private final String authDatabase = "admin";

    /**
     * Prepended to every collection name, so several deployments can share a database.
     */
    @Builder.Default
    private final String collectionPrefix = "flowsync_";

    @Min(1)
    @Builder.Default
    private final int maxPoolSize = 50;

    @Min(0)
    @Builder.Default
    private final int minPoolSize = 0;

    @Builder.Default
    private final Duration maxWaitTime = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration serverSelectionTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private final Duration heartbeatFrequency = Duration.ofSeconds(10);

    /**
     * Driver read preference name: primary, primaryPreferred, secondary, secondaryPreferred or nearest.
     */
    @Builder.Default
    private final String readPreference = "primary";

    /**
     * Write concern as {@code w:<n>} or {@code w:majority}.
     */
    @Builder.Default
    private final String writeConcern = "w:majority";

    @Builder.Default
    private final boolean retryWrites = true;

    @Builder.Default
    private final boolean retryReads = true;

    public static MongoConnectionConfig localDefaults(String database) {
        return MongoConnectionConfig.builder()
                .connectionString("mongodb://localhost:27017")
                .database(database)
                .build();
    }

    public String collectionName(String baseName) {
        return (collectionPrefix == null ? "" : collectionPrefix) + baseName;
    }

    public void validate() {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalStateException("connectionString must not be blank");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalStateException("database must not be blank");
        }
        if (database.matches(".*[/\\\\. \"$].*")) {
            throw new IllegalStateException("database name contains an illegal character: " + database);
        }
        if (collectionPrefix != null && (collectionPrefix.contains("$") || collectionPrefix.contains("\0"))) {
            throw new IllegalStateException("collectionPrefix contains an illegal character: " + collectionPrefix);
        }
        if (maxPoolSize < 1) {
            throw new IllegalStateException("maxPoolSize must be at least 1");
        }
        if (minPoolSize < 0 || minPoolSize > maxPoolSize) {
            throw new IllegalStateException("minPoolSize must be between 0 and maxPoolSize");
        }
        if (maxWaitTime == null || maxWaitTime.isNegative()) {
            throw new IllegalStateException("maxWaitTime must not be negative");
        }
        if (serverSelectionTimeout == null || serverSelectionTimeout.isNegative()) {
            throw new IllegalStateException("serverSelectionTimeout must not be negative");
        }
        if (heartbeatFrequency == null || heartbeatFrequency.isZero() || heartbeatFrequency.isNegative()) {
            throw new IllegalStateException("heartbeatFrequency must be positive");
        }
    }
}
