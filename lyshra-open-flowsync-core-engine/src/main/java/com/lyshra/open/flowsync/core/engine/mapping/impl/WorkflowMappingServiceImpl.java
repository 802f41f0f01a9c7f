package com.lyshra.open.flowsync.core.engine.mapping.impl;

import com.lyshra.open.flowsync.core.engine.mapping.IWorkflowMappingService;
import com.lyshra.open.flowsync.core.engine.status.WorkflowMappingStatusResolver;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.enumerations.OnboardOutcome;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.sync.OnboardItemResult;
import com.lyshra.open.flowsync.integration.models.sync.OnboardResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
public class WorkflowMappingServiceImpl implements IWorkflowMappingService {

    private static final Comparator<EnvironmentMapping> MOST_RECENTLY_SYNCED = Comparator.comparing(
            EnvironmentMapping::getLastEnvSyncAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final IEnvironmentMapStore environmentMapStore;
    private final ICanonicalWorkflowStore canonicalWorkflowStore;

    public WorkflowMappingServiceImpl(IEnvironmentMapStore environmentMapStore, ICanonicalWorkflowStore canonicalWorkflowStore) {
        this.environmentMapStore = environmentMapStore;
        this.canonicalWorkflowStore = canonicalWorkflowStore;
    }

    @Override
    public Mono<Optional<WorkflowMappingStatus>> getMappingStatus(String tenantId, String environmentId, String canonicalId) {
        return environmentMapStore.findByCanonicalId(tenantId, environmentId, canonicalId)
                .collectList()
                .flatMap(rows -> {
                    Optional<EnvironmentMapping> current = rows.stream()
                            .filter(row -> row.getStatus().occupiesCanonicalSlot())
                            .findFirst()
                            .or(() -> rows.stream().max(MOST_RECENTLY_SYNCED));
                    if (current.isEmpty()) {
                        return Mono.just(Optional.<WorkflowMappingStatus>empty());
                    }
                    return isCanonicalDeleted(tenantId, canonicalId)
                            .map(deleted -> Optional.of(WorkflowMappingStatusResolver.resolve(current.get(), deleted)));
                });
    }

    @Override
    public Flux<EnvironmentMapping> listUntracked(String tenantId, String environmentId) {
        return environmentMapStore.findByStatus(tenantId, environmentId, WorkflowMappingStatus.UNTRACKED);
    }

    @Override
    public Mono<OnboardResult> onboard(String tenantId, String environmentId, List<String> nativeIds, String actor) {
        return Flux.fromIterable(nativeIds)
                .distinct()
                .concatMap(nativeId -> onboardOne(tenantId, environmentId, nativeId, actor)
                        .onErrorResume(error -> !(error instanceof FlowSyncStorageException), error -> {
                            log.warn("Onboarding native workflow {} in {} failed: {}", nativeId, environmentId, error.getMessage());
                            return Mono.just(itemResult(environmentId, nativeId, OnboardOutcome.FAILED, null, error.getMessage()));
                        }))
                .collectList()
                .map(results -> OnboardResult.builder().results(results).build());
    }

    private Mono<OnboardItemResult> onboardOne(String tenantId, String environmentId, String nativeId, String actor) {
        return environmentMapStore.findByNativeId(tenantId, environmentId, nativeId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Mono.just(itemResult(environmentId, nativeId, OnboardOutcome.FAILED, null,
                                "No mapping for this native workflow; run an environment sync first"));
                    }
                    EnvironmentMapping row = found.get();
                    if (row.isTracked()) {
                        return Mono.just(itemResult(environmentId, nativeId, OnboardOutcome.SKIPPED, row.getCanonicalId(),
                                "Already mapped to a canonical workflow"));
                    }
                    if (row.isDeleted() || row.isIgnored()) {
                        return Mono.just(itemResult(environmentId, nativeId, OnboardOutcome.SKIPPED, null,
                                "Mapping is " + row.getStatus().getValue()));
                    }
                    Instant now = Instant.now();
                    CanonicalWorkflow workflow = CanonicalWorkflow.builder()
                            .tenantId(tenantId)
                            .canonicalId(UUID.randomUUID().toString())
                            .displayName(row.getDisplayName() != null ? row.getDisplayName() : nativeId)
                            .createdBy(actor)
                            .build();
                    return canonicalWorkflowStore.save(workflow)
                            .then(saveResolved(row.toBuilder()
                                    .canonicalId(workflow.getCanonicalId())
                                    .linkedAt(now)
                                    .linkedBy(actor)
                                    .build(), false))
                            .map(saved -> {
                                log.info("Onboarded native workflow {} in {} as canonical workflow {}",
                                        nativeId, environmentId, saved.getCanonicalId());
                                return itemResult(environmentId, nativeId, OnboardOutcome.ONBOARDED, saved.getCanonicalId(), null);
                            });
                });
    }

    @Override
    public Mono<EnvironmentMapping> link(String tenantId, String environmentId, String nativeId, String canonicalId, String actor) {
        Mono<CanonicalWorkflow> canonical = canonicalWorkflowStore.findById(tenantId, canonicalId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Mono.error(new FlowSyncRuntimeException(FlowSyncErrorCodes.CANONICAL_WORKFLOW_NOT_FOUND,
                                Map.of("canonicalId", canonicalId, "tenantId", tenantId)));
                    }
                    if (found.get().isDeleted()) {
                        return Mono.error(new FlowSyncRuntimeException(FlowSyncErrorCodes.CANONICAL_WORKFLOW_DELETED,
                                Map.of("canonicalId", canonicalId)));
                    }
                    return Mono.just(found.get());
                });
        return canonical
                .then(requireMutable(tenantId, environmentId, nativeId))
                .flatMap(row -> environmentMapStore.findByCanonicalId(tenantId, environmentId, canonicalId)
                        .filter(other -> other.getStatus().occupiesCanonicalSlot())
                        .filter(other -> !Objects.equals(other.getNativeId(), nativeId))
                        .next()
                        .flatMap(conflict -> Mono.<EnvironmentMapping>error(conflict(environmentId, canonicalId, conflict.getNativeId())))
                        .switchIfEmpty(Mono.defer(() -> saveResolved(row.toBuilder()
                                .canonicalId(canonicalId)
                                .linkedAt(Instant.now())
                                .linkedBy(actor)
                                .build(), false))))
                .doOnNext(saved -> log.info("Linked native workflow {} in {} to canonical workflow {} by {}",
                        nativeId, environmentId, canonicalId, actor));
    }

    @Override
    public Mono<EnvironmentMapping> ignore(String tenantId, String environmentId, String nativeId) {
        return requireMutable(tenantId, environmentId, nativeId)
                .flatMap(row -> save(row.toBuilder().status(WorkflowMappingStatus.IGNORED).build()));
    }

    @Override
    public Mono<EnvironmentMapping> unignore(String tenantId, String environmentId, String nativeId) {
        return requireMutable(tenantId, environmentId, nativeId)
                .flatMap(row -> {
                    if (!row.isIgnored()) {
                        return Mono.just(row);
                    }
                    return isCanonicalDeleted(tenantId, row.getCanonicalId())
                            .flatMap(canonicalDeleted -> saveResolved(row.toBuilder().status(null).build(), canonicalDeleted));
                });
    }

    @Override
    public Mono<EnvironmentMapping> markDeleted(String tenantId, String environmentId, String nativeId) {
        return requireMapping(tenantId, environmentId, nativeId)
                .flatMap(row -> {
                    if (row.isDeleted()) {
                        return Mono.just(row);
                    }
                    log.info("Marking native workflow {} in {} as DELETED", nativeId, environmentId);
                    return save(row.toBuilder().status(WorkflowMappingStatus.DELETED).build());
                });
    }

    /**
     * Recomputes the status of {@code row} with the resolver and saves it. A null status on
     * the row means "no administrative flag".
     */
    private Mono<EnvironmentMapping> saveResolved(EnvironmentMapping row, boolean canonicalDeleted) {
        WorkflowMappingStatus status = WorkflowMappingStatusResolver.resolve(row, canonicalDeleted);
        return save(row.toBuilder().status(status).build());
    }

    private Mono<EnvironmentMapping> save(EnvironmentMapping row) {
        return environmentMapStore.save(row)
                .onErrorMap(DuplicateMappingException.class,
                        duplicate -> conflict(row.getEnvironmentId(), row.getCanonicalId(), duplicate.getConflictingNativeId()));
    }

    private Mono<EnvironmentMapping> requireMapping(String tenantId, String environmentId, String nativeId) {
        return environmentMapStore.findByNativeId(tenantId, environmentId, nativeId)
                .flatMap(found -> Mono.justOrEmpty(found))
                .switchIfEmpty(Mono.error(() -> new FlowSyncRuntimeException(FlowSyncErrorCodes.MAPPING_NOT_FOUND,
                        Map.of("nativeId", nativeId, "environmentId", environmentId))));
    }

    private Mono<EnvironmentMapping> requireMutable(String tenantId, String environmentId, String nativeId) {
        return requireMapping(tenantId, environmentId, nativeId)
                .flatMap(row -> row.isDeleted()
                        ? Mono.error(new FlowSyncRuntimeException(FlowSyncErrorCodes.MAPPING_IS_DELETED,
                                Map.of("nativeId", nativeId, "environmentId", environmentId)))
                        : Mono.just(row));
    }

    private Mono<Boolean> isCanonicalDeleted(String tenantId, String canonicalId) {
        if (canonicalId == null) {
            return Mono.just(false);
        }
        return canonicalWorkflowStore.findById(tenantId, canonicalId)
                .map(found -> found.map(CanonicalWorkflow::isDeleted).orElse(false));
    }

    private static FlowSyncRuntimeException conflict(String environmentId, String canonicalId, String conflictingNativeId) {
        return new FlowSyncRuntimeException(FlowSyncErrorCodes.MAPPING_CONFLICT, Map.of(
                "canonicalId", String.valueOf(canonicalId),
                "conflictingNativeId", String.valueOf(conflictingNativeId),
                "environmentId", environmentId));
    }

    private static OnboardItemResult itemResult(String environmentId, String nativeId, OnboardOutcome outcome,
                                                String canonicalId, String reason) {
        return OnboardItemResult.builder()
                .environmentId(environmentId)
                .nativeId(nativeId)
                .outcome(outcome)
                .canonicalId(canonicalId)
                .reason(reason)
                .build();
    }
}
