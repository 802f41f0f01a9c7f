package com.lyshra.open.flowsync.mongodb.plugin.error;

import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.mongodb.DuplicateKeyException;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;

import java.util.Map;

/**
 * Maps driver exceptions onto the contract's exception hierarchy.
 *
 * <p>Every driver failure becomes a {@link FlowSyncStorageException}, which aborts a sync run.
 * Duplicate-key violations are reported separately through {@link #isDuplicateKey(Throwable)}
 * so stores can turn them into domain conflicts.</p>
 */
public final class MongoErrorTranslator {

    static final int DUPLICATE_KEY_CODE = 11000;

    private MongoErrorTranslator() {
        // Utility class
    }

    public static boolean isDuplicateKey(Throwable error) {
        if (error instanceof DuplicateKeyException) {
            return true;
        }
        if (error instanceof MongoWriteException writeException) {
            return writeException.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
        }
        if (error instanceof MongoCommandException commandException) {
            return commandException.getErrorCode() == DUPLICATE_KEY_CODE;
        }
        return false;
    }

    public static boolean isConnectivityFailure(Throwable error) {
        return error instanceof MongoTimeoutException
                || error instanceof MongoSocketException
                || error instanceof MongoSecurityException;
    }

    /**
     * Translates {@code error} raised by {@code operation} on {@code collection}. Exceptions
     * already in the contract hierarchy and non-driver exceptions pass through unchanged.
     */
    public static Throwable translate(Throwable error, String operation, String collection, boolean write) {
        if (error instanceof FlowSyncRuntimeException || !(error instanceof MongoException)) {
            return error;
        }
        FlowSyncMongoErrorCodes code;
        if (isConnectivityFailure(error)) {
            code = FlowSyncMongoErrorCodes.STORAGE_UNAVAILABLE;
        } else {
            code = write ? FlowSyncMongoErrorCodes.WRITE_FAILED : FlowSyncMongoErrorCodes.READ_FAILED;
        }
        return new FlowSyncStorageException(code, Map.of(
                "operation", operation,
                "collection", collection,
                "message", String.valueOf(error.getMessage())), error);
    }
}
