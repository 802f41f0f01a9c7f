package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.mongodb.client.model.IndexModel;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MongoIndexInitializerTest {

    private static IndexModel index(String collection, String name) {
        return MongoIndexInitializer.indexPlan().get(collection).stream()
                .filter(model -> name.equals(model.getOptions().getName()))
                .findFirst()
                .orElseThrow();
    }

    private static BsonDocument render(Bson bson) {
        return bson.toBsonDocument();
    }

    @Test
    void testPlan_CoversEveryCollectionWithKeys() {
        Map<String, List<IndexModel>> plan = MongoIndexInitializer.indexPlan();

        assertEquals(List.of(MongoCanonicalWorkflowStore.COLLECTION, MongoGitStateStore.COLLECTION,
                MongoEnvironmentMapStore.COLLECTION), List.copyOf(plan.keySet()));
        assertTrue(index(MongoCanonicalWorkflowStore.COLLECTION, MongoIndexInitializer.CANONICAL_UNIQUE).getOptions().isUnique());
        assertTrue(index(MongoGitStateStore.COLLECTION, MongoIndexInitializer.GIT_STATE_UNIQUE).getOptions().isUnique());
    }

    @Test
    void testNativeIdIndex_OnlyCoversRowsWithNativeId() {
        IndexModel model = index(MongoEnvironmentMapStore.COLLECTION, MongoIndexInitializer.MAP_NATIVE_UNIQUE);

        assertTrue(model.getOptions().isUnique());
        assertEquals(List.of("tenantId", "environmentId", "nativeId"), List.copyOf(render(model.getKeys()).keySet()));
        assertTrue(render(model.getOptions().getPartialFilterExpression()).containsKey("nativeId"));
    }

    @Test
    void testCanonicalSlotIndex_ExcludesMissingRows() {
        IndexModel model = index(MongoEnvironmentMapStore.COLLECTION, MongoIndexInitializer.MAP_CANONICAL_SLOT_UNIQUE);

        assertTrue(model.getOptions().isUnique());
        assertTrue(render(model.getOptions().getPartialFilterExpression()).toJson().contains("canonicalId"));
        assertEquals(List.of("linked", "untracked", "ignored", "deleted"), MongoIndexInitializer.canonicalSlotStatuses());
    }
}
