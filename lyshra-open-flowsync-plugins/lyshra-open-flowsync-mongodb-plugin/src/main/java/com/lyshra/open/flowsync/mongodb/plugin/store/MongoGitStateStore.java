package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import lombok.extern.slf4j.Slf4j;
import org.bson.conversions.Bson;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CANONICAL_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CONTENT_HASH;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.ENVIRONMENT_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.PATH;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.TENANT_ID;

/**
 * Git state rows, unique per (tenantId, environmentId, canonicalId).
 */
@Slf4j
public class MongoGitStateStore extends AbstractMongoStore implements IGitStateStore {

    public static final String COLLECTION = "git_state";

    public MongoGitStateStore(MongoClientManager clientManager) {
        super(clientManager, COLLECTION);
    }

    @Override
    public Mono<GitState> save(GitState gitState) {
        return Mono.fromCallable(() -> {
                    if (gitState.getTenantId() == null || gitState.getEnvironmentId() == null || gitState.getCanonicalId() == null) {
                        throw new IllegalArgumentException("tenantId, environmentId and canonicalId cannot be null");
                    }
                    return key(gitState.getTenantId(), gitState.getEnvironmentId(), gitState.getCanonicalId());
                })
                .flatMap(filter -> write("save", () -> collection()
                        .replaceOne(filter, FlowSyncDocumentConverter.toDocument(gitState), UPSERT)))
                .doOnNext(result -> log.debug("Saved git state {}/{}/{} hash={}", gitState.getTenantId(),
                        gitState.getEnvironmentId(), gitState.getCanonicalId(), gitState.getContentHash()))
                .thenReturn(gitState);
    }

    @Override
    public Mono<Optional<GitState>> find(String tenantId, String environmentId, String canonicalId) {
        return findOne("find", key(tenantId, environmentId, canonicalId), FlowSyncDocumentConverter::toGitState);
    }

    @Override
    public Mono<Optional<GitState>> findByPath(String tenantId, String environmentId, String path) {
        return findOne("findByPath", Filters.and(environment(tenantId, environmentId), Filters.eq(PATH, path)),
                FlowSyncDocumentConverter::toGitState);
    }

    @Override
    public Flux<GitState> findByContentHash(String tenantId, String environmentId, String contentHash) {
        return findMany("findByContentHash",
                Filters.and(environment(tenantId, environmentId), Filters.eq(CONTENT_HASH, contentHash)),
                Sorts.ascending(CANONICAL_ID), FlowSyncDocumentConverter::toGitState);
    }

    @Override
    public Flux<GitState> findByEnvironment(String tenantId, String environmentId) {
        return findMany("findByEnvironment", environment(tenantId, environmentId), Sorts.ascending(CANONICAL_ID),
                FlowSyncDocumentConverter::toGitState);
    }

    private static Bson environment(String tenantId, String environmentId) {
        return Filters.and(Filters.eq(TENANT_ID, tenantId), Filters.eq(ENVIRONMENT_ID, environmentId));
    }

    private static Bson key(String tenantId, String environmentId, String canonicalId) {
        return Filters.and(environment(tenantId, environmentId), Filters.eq(CANONICAL_ID, canonicalId));
    }
}
