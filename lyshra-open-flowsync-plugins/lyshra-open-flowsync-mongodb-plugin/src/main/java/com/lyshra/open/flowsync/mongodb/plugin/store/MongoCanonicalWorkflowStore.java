package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter;
import com.lyshra.open.flowsync.mongodb.plugin.error.MongoErrorTranslator;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import lombok.extern.slf4j.Slf4j;
import org.bson.conversions.Bson;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CANONICAL_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.TENANT_ID;

/**
 * Canonical workflows, unique per (tenantId, canonicalId).
 */
@Slf4j
public class MongoCanonicalWorkflowStore extends AbstractMongoStore implements ICanonicalWorkflowStore {

    public static final String COLLECTION = "canonical_workflows";

    public MongoCanonicalWorkflowStore(MongoClientManager clientManager) {
        super(clientManager, COLLECTION);
    }

    @Override
    public Mono<CanonicalWorkflow> save(CanonicalWorkflow workflow) {
        return Mono.fromCallable(() -> requireKey(workflow))
                .flatMap(filter -> write("save", () -> collection()
                        .replaceOne(filter, FlowSyncDocumentConverter.toDocument(workflow), UPSERT)))
                .doOnNext(result -> log.debug("Saved canonical workflow {}/{}", workflow.getTenantId(), workflow.getCanonicalId()))
                .thenReturn(workflow);
    }

    @Override
    public Mono<Boolean> insertIfAbsent(CanonicalWorkflow workflow) {
        return Mono.fromCallable(() -> requireKey(workflow))
                .flatMap(filter -> write("insert", () -> collection().insertOne(FlowSyncDocumentConverter.toDocument(workflow))))
                .map(result -> true)
                .onErrorResume(MongoErrorTranslator::isDuplicateKey, duplicate -> {
                    log.debug("Canonical workflow {}/{} already exists", workflow.getTenantId(), workflow.getCanonicalId());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Optional<CanonicalWorkflow>> findById(String tenantId, String canonicalId) {
        return findOne("findById", key(tenantId, canonicalId), FlowSyncDocumentConverter::toCanonicalWorkflow);
    }

    @Override
    public Flux<CanonicalWorkflow> findByTenant(String tenantId) {
        return findMany("findByTenant", Filters.eq(TENANT_ID, tenantId), Sorts.ascending(CANONICAL_ID),
                FlowSyncDocumentConverter::toCanonicalWorkflow);
    }

    private static Bson key(String tenantId, String canonicalId) {
        return Filters.and(Filters.eq(TENANT_ID, tenantId), Filters.eq(CANONICAL_ID, canonicalId));
    }

    private static Bson requireKey(CanonicalWorkflow workflow) {
        if (workflow.getTenantId() == null || workflow.getCanonicalId() == null) {
            throw new IllegalArgumentException("tenantId and canonicalId cannot be null");
        }
        return key(workflow.getTenantId(), workflow.getCanonicalId());
    }
}
