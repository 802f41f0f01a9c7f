package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.mongodb.plugin.config.MongoConnectionConfig;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class MongoEnvironmentMapStoreTest {

    /**
     * Store whose writes fail with a fixed driver error and whose canonical-id lookup
     * returns fixed rows, so the conflict handling of {@code save} runs without a server.
     */
    private static final class FailingWriteStore extends MongoEnvironmentMapStore {

        private final Throwable writeFailure;
        private final List<EnvironmentMapping> slotRows;
        private final AtomicInteger lookups = new AtomicInteger();

        FailingWriteStore(Throwable writeFailure, List<EnvironmentMapping> slotRows) {
            super(new MongoClientManager(MongoConnectionConfig.localDefaults("flowsync")));
            this.writeFailure = writeFailure;
            this.slotRows = slotRows;
        }

        @Override
        protected <T> Mono<T> write(String operation, Supplier<Publisher<T>> publisher) {
            return super.write(operation, () -> Mono.error(writeFailure));
        }

        @Override
        public Flux<EnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
            lookups.incrementAndGet();
            return Flux.fromIterable(slotRows);
        }
    }

    private static MongoCommandException duplicateKey() {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
                .append("code", new BsonInt32(11000))
                .append("errmsg", new BsonString("E11000 duplicate key error"));
        return new MongoCommandException(response, new ServerAddress());
    }

    private static EnvironmentMapping.EnvironmentMappingBuilder row() {
        return EnvironmentMapping.builder()
                .tenantId("acme")
                .environmentId("prod")
                .status(WorkflowMappingStatus.UNTRACKED)
                .presentInRuntime(true);
    }

    @Test
    void testRowKey_PrefersNativeId() {
        BsonDocument key = MongoEnvironmentMapStore.rowKey(row().nativeId("203").canonicalId("aaaa-1111").build())
                .toBsonDocument();

        assertTrue(key.toJson().contains("\"nativeId\": \"203\""));
        assertFalse(key.toJson().contains("aaaa-1111"));
    }

    @Test
    void testRowKey_FallsBackToCanonicalId() {
        BsonDocument key = MongoEnvironmentMapStore.rowKey(row().canonicalId("aaaa-1111").build()).toBsonDocument();

        assertTrue(key.toJson().contains("aaaa-1111"));
        assertTrue(key.toJson().contains("\"nativeId\": null"));
    }

    @Test
    void testValidate_RejectsInconsistentRows() {
        assertThrows(IllegalArgumentException.class,
                () -> MongoEnvironmentMapStore.validate(row().status(WorkflowMappingStatus.LINKED).nativeId("203").build()));
        assertThrows(IllegalArgumentException.class,
                () -> MongoEnvironmentMapStore.validate(row().build()));
        assertThrows(IllegalArgumentException.class,
                () -> MongoEnvironmentMapStore.validate(row().status(null).nativeId("203").build()));
        assertDoesNotThrow(() -> MongoEnvironmentMapStore.validate(row().nativeId("203").build()));
    }

    @Test
    void testSave_DuplicateKeyNamesSlotOwner() {
        EnvironmentMapping owner = row().status(WorkflowMappingStatus.LINKED).nativeId("203").canonicalId("aaaa-1111").build();
        EnvironmentMapping missing = row().status(WorkflowMappingStatus.MISSING).nativeId("150").canonicalId("aaaa-1111").build();
        FailingWriteStore store = new FailingWriteStore(duplicateKey(), List.of(missing, owner));

        DuplicateMappingException conflict = assertThrows(DuplicateMappingException.class, () -> store.save(
                row().status(WorkflowMappingStatus.LINKED).nativeId("311").canonicalId("aaaa-1111").build()).block());

        assertEquals("aaaa-1111", conflict.getCanonicalId());
        assertEquals("311", conflict.getNativeId());
        assertEquals("203", conflict.getConflictingNativeId());
        assertEquals("prod", conflict.getEnvironmentId());
        assertEquals(1, store.lookups.get());
    }

    @Test
    void testSave_DuplicateKeyWithoutVisibleOwner() {
        EnvironmentMapping self = row().status(WorkflowMappingStatus.LINKED).nativeId("311").canonicalId("aaaa-1111").build();
        FailingWriteStore store = new FailingWriteStore(duplicateKey(), List.of(self));

        DuplicateMappingException conflict = assertThrows(DuplicateMappingException.class,
                () -> store.save(self).block());

        assertEquals("unknown", conflict.getConflictingNativeId());
    }

    @Test
    void testSave_OtherWriteFailuresAreStorageErrors() {
        FailingWriteStore store = new FailingWriteStore(new MongoTimeoutException("no server"), List.of());

        FlowSyncStorageException failure = assertThrows(FlowSyncStorageException.class, () -> store.save(
                row().status(WorkflowMappingStatus.LINKED).nativeId("311").canonicalId("aaaa-1111").build()).block());

        assertEquals("FLOWSYNC_MONGO_003", failure.getErrorCode());
        assertEquals(0, store.lookups.get());
    }

    @Test
    void testSave_InvalidRowNeverReachesServer() {
        FailingWriteStore store = new FailingWriteStore(duplicateKey(), List.of());

        assertThrows(IllegalArgumentException.class, () -> store.save(row().build()).block());
        assertEquals(0, store.lookups.get());
    }
}
