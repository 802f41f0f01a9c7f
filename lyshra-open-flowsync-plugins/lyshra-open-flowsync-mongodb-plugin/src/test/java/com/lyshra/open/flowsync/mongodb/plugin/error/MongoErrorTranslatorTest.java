package com.lyshra.open.flowsync.mongodb.plugin.error;

import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MongoErrorTranslatorTest {

    private static MongoCommandException commandFailure(int code) {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
                .append("code", new BsonInt32(code))
                .append("errmsg", new BsonString("command failed"));
        return new MongoCommandException(response, new ServerAddress());
    }

    @Test
    void testIsDuplicateKey() {
        assertTrue(MongoErrorTranslator.isDuplicateKey(commandFailure(11000)));
        assertFalse(MongoErrorTranslator.isDuplicateKey(commandFailure(50)));
        assertFalse(MongoErrorTranslator.isDuplicateKey(new IllegalStateException("boom")));
    }

    @Test
    void testTranslate_TimeoutIsStorageUnavailable() {
        Throwable translated = MongoErrorTranslator.translate(
                new MongoTimeoutException("no server"), "find", "flowsync_git_state", false);

        FlowSyncStorageException storage = assertInstanceOf(FlowSyncStorageException.class, translated);
        assertEquals("FLOWSYNC_MONGO_003", storage.getErrorCode());
        assertTrue(storage.getMessage().contains("flowsync_git_state"));
    }

    @Test
    void testTranslate_ReadAndWriteFailures() {
        FlowSyncStorageException read = assertInstanceOf(FlowSyncStorageException.class,
                MongoErrorTranslator.translate(new MongoException("bad"), "find", "c", false));
        FlowSyncStorageException write = assertInstanceOf(FlowSyncStorageException.class,
                MongoErrorTranslator.translate(new MongoException("bad"), "save", "c", true));

        assertEquals("FLOWSYNC_MONGO_011", read.getErrorCode());
        assertEquals("FLOWSYNC_MONGO_012", write.getErrorCode());
    }

    @Test
    void testTranslate_PassesThroughOtherErrors() {
        IllegalArgumentException invalid = new IllegalArgumentException("status cannot be null");
        FlowSyncRuntimeException domain = new FlowSyncRuntimeException("already mapped");

        assertSame(invalid, MongoErrorTranslator.translate(invalid, "save", "c", true));
        assertSame(domain, MongoErrorTranslator.translate(domain, "save", "c", true));
    }
}
