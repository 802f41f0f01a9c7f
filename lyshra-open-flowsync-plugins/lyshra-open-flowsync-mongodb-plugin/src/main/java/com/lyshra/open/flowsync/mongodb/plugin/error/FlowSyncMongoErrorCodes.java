package com.lyshra.open.flowsync.mongodb.plugin.error;

import com.lyshra.open.flowsync.integration.exception.IFlowSyncErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error codes raised by the MongoDB persistence plugin.
 */
@Getter
@AllArgsConstructor
public enum FlowSyncMongoErrorCodes implements IFlowSyncErrorInfo {

    // Connection
    INVALID_CONNECTION_CONFIG(
            "FLOWSYNC_MONGO_001",
            "Invalid MongoDB connection configuration: {message}"
    ),
    CONNECTION_FAILED(
            "FLOWSYNC_MONGO_002",
            "Failed to create MongoDB client: {message}"
    ),
    STORAGE_UNAVAILABLE(
            "FLOWSYNC_MONGO_003",
            "MongoDB is unavailable during {operation} on {collection}: {message}"
    ),

    // Reads and writes
    READ_FAILED(
            "FLOWSYNC_MONGO_011",
            "MongoDB {operation} on {collection} failed: {message}"
    ),
    WRITE_FAILED(
            "FLOWSYNC_MONGO_012",
            "MongoDB {operation} on {collection} failed: {message}"
    ),
    INDEX_CREATION_FAILED(
            "FLOWSYNC_MONGO_013",
            "Creating indexes on {collection} failed: {message}"
    ),

    // Documents
    DOCUMENT_CONVERSION_FAILED(
            "FLOWSYNC_MONGO_031",
            "Stored document in {collection} could not be read: {message}"
    );

    private final String errorCode;
    private final String errorTemplate;
}
