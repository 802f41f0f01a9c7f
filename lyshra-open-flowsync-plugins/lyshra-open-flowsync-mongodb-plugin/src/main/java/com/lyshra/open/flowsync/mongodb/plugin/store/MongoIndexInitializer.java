package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.error.FlowSyncMongoErrorCodes;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CANONICAL_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CONTENT_HASH;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.ENVIRONMENT_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.NATIVE_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.PATH;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.STATUS;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.TENANT_ID;

/**
 * Creates the indexes that carry the storage-level uniqueness rules:
 * <ul>
 *   <li>canonical workflows: unique (tenantId, canonicalId)</li>
 *   <li>git state: unique (tenantId, environmentId, canonicalId), plus lookups by path and content hash</li>
 *   <li>environment map: unique (tenantId, environmentId, nativeId) where the native id is set, and
 *       unique (tenantId, environmentId, canonicalId) over rows that are not MISSING</li>
 * </ul>
 * The registry collection is keyed by {@code _id} and needs no extra index. Index creation is
 * idempotent. The partial filter on status uses {@code $in}, which needs MongoDB 6.0 or later.
 */
@Slf4j
public class MongoIndexInitializer {

    static final String CANONICAL_UNIQUE = "uk_tenant_canonical";
    static final String GIT_STATE_UNIQUE = "uk_tenant_env_canonical";
    static final String GIT_STATE_PATH = "ix_tenant_env_path";
    static final String GIT_STATE_HASH = "ix_tenant_env_hash";
    static final String MAP_NATIVE_UNIQUE = "uk_tenant_env_native";
    static final String MAP_CANONICAL_SLOT_UNIQUE = "uk_tenant_env_canonical_live";
    static final String MAP_STATUS = "ix_tenant_env_status";

    private final MongoClientManager clientManager;

    public MongoIndexInitializer(MongoClientManager clientManager) {
        this.clientManager = clientManager;
    }

    public Mono<Void> createIndexes() {
        return Flux.fromIterable(indexPlan().entrySet())
                .concatMap(entry -> createIndexes(entry.getKey(), entry.getValue()))
                .then();
    }

    /**
     * Indexes per base collection name.
     */
    static Map<String, List<IndexModel>> indexPlan() {
        Map<String, List<IndexModel>> plan = new LinkedHashMap<>();
        plan.put(MongoCanonicalWorkflowStore.COLLECTION, List.of(
                new IndexModel(Indexes.ascending(TENANT_ID, CANONICAL_ID),
                        new IndexOptions().name(CANONICAL_UNIQUE).unique(true))));
        plan.put(MongoGitStateStore.COLLECTION, List.of(
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, CANONICAL_ID),
                        new IndexOptions().name(GIT_STATE_UNIQUE).unique(true)),
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, PATH),
                        new IndexOptions().name(GIT_STATE_PATH)),
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, CONTENT_HASH),
                        new IndexOptions().name(GIT_STATE_HASH))));
        plan.put(MongoEnvironmentMapStore.COLLECTION, List.of(
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, NATIVE_ID),
                        new IndexOptions().name(MAP_NATIVE_UNIQUE).unique(true)
                                .partialFilterExpression(Filters.type(NATIVE_ID, BsonType.STRING))),
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, CANONICAL_ID),
                        new IndexOptions().name(MAP_CANONICAL_SLOT_UNIQUE).unique(true)
                                .partialFilterExpression(Filters.and(
                                        Filters.type(CANONICAL_ID, BsonType.STRING),
                                        Filters.in(STATUS, canonicalSlotStatuses())))),
                new IndexModel(Indexes.ascending(TENANT_ID, ENVIRONMENT_ID, STATUS),
                        new IndexOptions().name(MAP_STATUS))));
        return plan;
    }

    static List<String> canonicalSlotStatuses() {
        return Arrays.stream(WorkflowMappingStatus.values())
                .filter(WorkflowMappingStatus::occupiesCanonicalSlot)
                .map(WorkflowMappingStatus::getValue)
                .toList();
    }

    private Mono<Void> createIndexes(String baseName, List<IndexModel> indexes) {
        String collection = clientManager.getConfig().collectionName(baseName);
        return Flux.defer(() -> clientManager.getDatabase().getCollection(collection).createIndexes(indexes))
                .doOnNext(name -> log.info("Ensured index {} on {}", name, collection))
                .onErrorMap(error -> new FlowSyncStorageException(FlowSyncMongoErrorCodes.INDEX_CREATION_FAILED,
                        Map.of("collection", collection, "message", String.valueOf(error.getMessage())), error))
                .then();
    }
}
