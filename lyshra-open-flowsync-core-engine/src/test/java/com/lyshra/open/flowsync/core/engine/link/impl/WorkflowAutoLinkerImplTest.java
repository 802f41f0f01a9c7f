package com.lyshra.open.flowsync.core.engine.link.impl;

import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryCanonicalWorkflowStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryEnvironmentMapStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryGitStateStore;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Optional;

class WorkflowAutoLinkerImplTest {

    private static final String TENANT = "acme";
    private static final String ENV = "prod";
    private static final String H1 = "h1";

    private InMemoryGitStateStore gitStateStore;
    private InMemoryEnvironmentMapStore environmentMapStore;
    private InMemoryCanonicalWorkflowStore canonicalStore;
    private WorkflowAutoLinkerImpl autoLinker;

    @BeforeEach
    void setUp() {
        gitStateStore = new InMemoryGitStateStore();
        environmentMapStore = new InMemoryEnvironmentMapStore();
        canonicalStore = new InMemoryCanonicalWorkflowStore();
        autoLinker = new WorkflowAutoLinkerImpl(gitStateStore, environmentMapStore, canonicalStore);
    }

    private void canonical(String canonicalId, String hash) {
        canonicalStore.save(CanonicalWorkflow.builder().tenantId(TENANT).canonicalId(canonicalId).build()).block();
        gitStateStore.save(GitState.builder()
                .tenantId(TENANT)
                .environmentId(ENV)
                .canonicalId(canonicalId)
                .path("workflows/" + canonicalId + ".json")
                .contentHash(hash)
                .build()).block();
    }

    private void mapping(String nativeId, String canonicalId, WorkflowMappingStatus status) {
        environmentMapStore.save(EnvironmentMapping.builder()
                .tenantId(TENANT)
                .environmentId(ENV)
                .nativeId(nativeId)
                .canonicalId(canonicalId)
                .status(status)
                .presentInRuntime(status != WorkflowMappingStatus.MISSING)
                .build()).block();
    }

    @Test
    @DisplayName("should link to the single canonical workflow with a matching git state hash")
    void shouldLinkUniqueMatch() {
        // Given
        canonical("aaaa-1111", H1);

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "203", H1))
                .expectNext(Optional.of("aaaa-1111"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should refuse when two canonical workflows share the hash")
    void shouldRejectAmbiguousMatch() {
        // Given
        canonical("aaaa-1111", H1);
        canonical("bbbb-2222", H1);

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "203", H1))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    @DisplayName("should refuse when the canonical workflow is bound to another native workflow")
    void shouldRejectConflictingBinding() {
        // Given
        canonical("aaaa-1111", H1);
        mapping("A", "aaaa-1111", WorkflowMappingStatus.LINKED);

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "B", H1))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    @DisplayName("should allow linking when the previous binding went MISSING")
    void shouldIgnoreMissingBinding() {
        // Given
        canonical("aaaa-1111", H1);
        mapping("A", "aaaa-1111", WorkflowMappingStatus.MISSING);

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "B", H1))
                .expectNext(Optional.of("aaaa-1111"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should refuse a soft-deleted canonical workflow")
    void shouldRejectDeletedCanonical() {
        // Given
        canonical("aaaa-1111", H1);
        canonicalStore.save(CanonicalWorkflow.builder()
                .tenantId(TENANT)
                .canonicalId("aaaa-1111")
                .deletedAt(Instant.now())
                .build()).block();

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "203", H1))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    @DisplayName("should return empty when nothing matches or no hash is known")
    void shouldReturnEmptyWithoutMatch() {
        // Given
        canonical("aaaa-1111", H1);

        // When / Then
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "203", "other"))
                .expectNext(Optional.empty())
                .verifyComplete();
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, ENV, "203", null))
                .expectNext(Optional.empty())
                .verifyComplete();
        StepVerifier.create(autoLinker.tryAutoLink(TENANT, "staging", "203", H1))
                .expectNext(Optional.empty())
                .verifyComplete();
    }
}
