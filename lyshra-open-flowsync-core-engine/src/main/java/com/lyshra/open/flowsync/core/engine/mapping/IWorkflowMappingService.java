package com.lyshra.open.flowsync.core.engine.mapping;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.sync.OnboardResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Read and administrative operations on environment mappings.
 */
public interface IWorkflowMappingService {

    /**
     * Current lifecycle status of a canonical workflow in an environment, computed by the
     * status resolver from the stored facts. The live (non-MISSING) row wins over MISSING ones.
     *
     * @return empty when the workflow has never been mapped in the environment
     */
    Mono<Optional<WorkflowMappingStatus>> getMappingStatus(String tenantId, String environmentId, String canonicalId);

    Flux<EnvironmentMapping> listUntracked(String tenantId, String environmentId);

    /**
     * Gives each selected untracked workflow a new canonical identity and links it.
     * Rows that already carry a canonical id are skipped; every item reports its own outcome.
     */
    Mono<OnboardResult> onboard(String tenantId, String environmentId, List<String> nativeIds, String actor);

    /**
     * Links a native workflow to an existing canonical workflow.
     * Fails when the canonical workflow is unknown or deleted, or already bound to another
     * native workflow in this environment.
     */
    Mono<EnvironmentMapping> link(String tenantId, String environmentId, String nativeId, String canonicalId, String actor);

    Mono<EnvironmentMapping> ignore(String tenantId, String environmentId, String nativeId);

    /**
     * Leaves IGNORED; the new status is recomputed from the stored facts.
     */
    Mono<EnvironmentMapping> unignore(String tenantId, String environmentId, String nativeId);

    /**
     * Terminal: no sync or administrative operation moves the row out of DELETED.
     */
    Mono<EnvironmentMapping> markDeleted(String tenantId, String environmentId, String nativeId);
}
