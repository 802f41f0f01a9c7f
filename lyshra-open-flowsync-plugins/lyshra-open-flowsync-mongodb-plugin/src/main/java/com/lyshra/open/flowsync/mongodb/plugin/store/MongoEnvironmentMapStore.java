package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter;
import com.lyshra.open.flowsync.mongodb.plugin.error.MongoErrorTranslator;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import lombok.extern.slf4j.Slf4j;
import org.bson.conversions.Bson;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;

import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.CANONICAL_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.ENVIRONMENT_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.NATIVE_ID;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.STATUS;
import static com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter.TENANT_ID;

/**
 * Environment mappings.
 *
 * <p>Rows are addressed by (tenantId, environmentId, nativeId), or by canonical id while the
 * native id is unknown. The "one non-MISSING row per canonical id" rule is enforced by a
 * partial unique index (see {@link MongoIndexInitializer}); a violation surfaces as
 * {@link DuplicateMappingException}.</p>
 */
@Slf4j
public class MongoEnvironmentMapStore extends AbstractMongoStore implements IEnvironmentMapStore {

    public static final String COLLECTION = "environment_map";

    public MongoEnvironmentMapStore(MongoClientManager clientManager) {
        super(clientManager, COLLECTION);
    }

    @Override
    public Mono<EnvironmentMapping> save(EnvironmentMapping mapping) {
        return Mono.fromCallable(() -> {
                    validate(mapping);
                    return rowKey(mapping);
                })
                .flatMap(filter -> write("save", () -> collection()
                        .replaceOne(filter, FlowSyncDocumentConverter.toDocument(mapping), UPSERT)))
                .doOnNext(result -> log.debug("Saved environment mapping {}/{} native={} canonical={} status={}",
                        mapping.getTenantId(), mapping.getEnvironmentId(), mapping.getNativeId(),
                        mapping.getCanonicalId(), mapping.getStatus()))
                .thenReturn(mapping)
                .onErrorResume(MongoErrorTranslator::isDuplicateKey, duplicate -> conflictFor(mapping));
    }

    @Override
    public Mono<Optional<EnvironmentMapping>> findByNativeId(String tenantId, String environmentId, String nativeId) {
        return findOne("findByNativeId", Filters.and(environment(tenantId, environmentId), Filters.eq(NATIVE_ID, nativeId)),
                FlowSyncDocumentConverter::toEnvironmentMapping);
    }

    @Override
    public Flux<EnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
        return findMany("findByCanonicalId",
                Filters.and(environment(tenantId, environmentId), Filters.eq(CANONICAL_ID, canonicalId)),
                Sorts.ascending(NATIVE_ID), FlowSyncDocumentConverter::toEnvironmentMapping);
    }

    @Override
    public Flux<EnvironmentMapping> findByEnvironment(String tenantId, String environmentId) {
        return findMany("findByEnvironment", environment(tenantId, environmentId), Sorts.ascending(NATIVE_ID),
                FlowSyncDocumentConverter::toEnvironmentMapping);
    }

    @Override
    public Flux<EnvironmentMapping> findByStatus(String tenantId, String environmentId, WorkflowMappingStatus status) {
        return findMany("findByStatus",
                Filters.and(environment(tenantId, environmentId), Filters.eq(STATUS, status.getValue())),
                Sorts.ascending(NATIVE_ID), FlowSyncDocumentConverter::toEnvironmentMapping);
    }

    /**
     * Looks up the row that owns the canonical slot so the conflict names it.
     */
    private Mono<EnvironmentMapping> conflictFor(EnvironmentMapping mapping) {
        return findByCanonicalId(mapping.getTenantId(), mapping.getEnvironmentId(), mapping.getCanonicalId())
                .filter(other -> other.getStatus() != null && other.getStatus().occupiesCanonicalSlot())
                .filter(other -> !Objects.equals(other.getNativeId(), mapping.getNativeId()))
                .next()
                .map(EnvironmentMapping::getNativeId)
                .defaultIfEmpty("unknown")
                .flatMap(conflictingNativeId -> {
                    log.warn("Rejected mapping of canonical workflow {} to native workflow {} in {}/{}: already mapped to {}",
                            mapping.getCanonicalId(), mapping.getNativeId(), mapping.getTenantId(),
                            mapping.getEnvironmentId(), conflictingNativeId);
                    return Mono.error(new DuplicateMappingException(mapping.getTenantId(), mapping.getEnvironmentId(),
                            mapping.getCanonicalId(), mapping.getNativeId(), conflictingNativeId));
                });
    }

    static Bson rowKey(EnvironmentMapping mapping) {
        Bson environment = environment(mapping.getTenantId(), mapping.getEnvironmentId());
        if (mapping.getNativeId() != null) {
            return Filters.and(environment, Filters.eq(NATIVE_ID, mapping.getNativeId()));
        }
        return Filters.and(environment, Filters.eq(CANONICAL_ID, mapping.getCanonicalId()), Filters.eq(NATIVE_ID, null));
    }

    private static Bson environment(String tenantId, String environmentId) {
        return Filters.and(Filters.eq(TENANT_ID, tenantId), Filters.eq(ENVIRONMENT_ID, environmentId));
    }

    static void validate(EnvironmentMapping mapping) {
        if (mapping.getTenantId() == null || mapping.getEnvironmentId() == null) {
            throw new IllegalArgumentException("tenantId and environmentId cannot be null");
        }
        if (mapping.getStatus() == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (mapping.getNativeId() == null && mapping.getCanonicalId() == null) {
            throw new IllegalArgumentException("A mapping needs a native id or a canonical id");
        }
        if (mapping.getStatus() == WorkflowMappingStatus.LINKED && mapping.getCanonicalId() == null) {
            throw new IllegalArgumentException("A LINKED mapping requires a canonical id");
        }
    }
}
