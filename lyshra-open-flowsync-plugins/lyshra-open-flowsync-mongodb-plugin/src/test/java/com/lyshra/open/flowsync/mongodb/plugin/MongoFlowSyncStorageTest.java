package com.lyshra.open.flowsync.mongodb.plugin;

import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.mongodb.plugin.config.MongoConnectionConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring of the storage bundle. The client is created lazily, so none of these tests
 * needs a running server.
 */
class MongoFlowSyncStorageTest {

    @Test
    void testStores_SharePrefixedCollections() {
        MongoConnectionConfig config = MongoConnectionConfig.localDefaults("flowsync").toBuilder()
                .collectionPrefix("acme_")
                .build();

        try (MongoFlowSyncStorage storage = new MongoFlowSyncStorage(config)) {
            assertEquals("acme_canonical_workflows", storage.getCanonicalWorkflowStore().getCollectionName());
            assertEquals("acme_git_state", storage.getGitStateStore().getCollectionName());
            assertEquals("acme_environment_map", storage.getEnvironmentMapStore().getCollectionName());
            assertEquals("acme_content_hash_registry", storage.getContentHashRegistryStore().getCollectionName());
            assertSame(config, storage.getClientManager().getConfig());
        }
    }

    @Test
    void testConstructor_RejectsInvalidConfig() {
        MongoConnectionConfig config = MongoConnectionConfig.localDefaults("flow.sync");

        FlowSyncRuntimeException error = assertThrows(FlowSyncRuntimeException.class,
                () -> new MongoFlowSyncStorage(config));
        assertEquals("FLOWSYNC_MONGO_001", error.getErrorCode());
    }

    @Test
    void testClose_WithoutClientIsNoOp() {
        MongoFlowSyncStorage storage = new MongoFlowSyncStorage(MongoConnectionConfig.localDefaults("flowsync"));

        assertDoesNotThrow(storage::close);
        assertDoesNotThrow(storage::close);
    }
}
