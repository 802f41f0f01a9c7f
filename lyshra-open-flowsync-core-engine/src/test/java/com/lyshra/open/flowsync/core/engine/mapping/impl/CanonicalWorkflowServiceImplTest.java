package com.lyshra.open.flowsync.core.engine.mapping.impl;

import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryCanonicalWorkflowStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryGitStateStore;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalWorkflowServiceImplTest {

    private static final String TENANT = "acme";

    private InMemoryGitStateStore gitStateStore;
    private CanonicalWorkflowServiceImpl service;

    @BeforeEach
    void setUp() {
        gitStateStore = new InMemoryGitStateStore();
        service = new CanonicalWorkflowServiceImpl(new InMemoryCanonicalWorkflowStore(), gitStateStore);
    }

    @Test
    @DisplayName("should mint a UUID when no canonical id is given")
    void shouldMintId() {
        // When
        CanonicalWorkflow created = service.create(TENANT, null, "billing", "user:alice").block();

        // Then
        assertNotNull(UUID.fromString(created.getCanonicalId()));
        assertEquals("user:alice", created.getCreatedBy());
        assertNotNull(created.getCreatedAt());
    }

    @Test
    @DisplayName("should return the existing row when the id is taken")
    void shouldKeepExistingRow() {
        // Given
        service.create(TENANT, "aaaa-1111", "billing", "user:alice").block();

        // When
        CanonicalWorkflow again = service.create(TENANT, "aaaa-1111", "renamed", "user:bob").block();

        // Then
        assertEquals("billing", again.getDisplayName());
        assertEquals("user:alice", again.getCreatedBy());
    }

    @Test
    @DisplayName("should hide soft-deleted workflows unless asked for them")
    void shouldSoftDelete() {
        // Given
        service.create(TENANT, "aaaa-1111", "billing", "user:alice").block();
        service.create(TENANT, "bbbb-2222", "reports", "user:alice").block();

        // When
        CanonicalWorkflow deleted = service.softDelete(TENANT, "aaaa-1111").block();
        Instant firstDeletion = deleted.getDeletedAt();
        CanonicalWorkflow deletedAgain = service.softDelete(TENANT, "aaaa-1111").block();

        // Then
        assertEquals(firstDeletion, deletedAgain.getDeletedAt());
        assertTrue(service.get(TENANT, "aaaa-1111").block().isEmpty());
        StepVerifier.create(service.list(TENANT, false).map(CanonicalWorkflow::getCanonicalId))
                .expectNext("bbbb-2222")
                .verifyComplete();
        StepVerifier.create(service.list(TENANT, true).map(CanonicalWorkflow::getCanonicalId))
                .expectNext("aaaa-1111", "bbbb-2222")
                .verifyComplete();
    }

    @Test
    @DisplayName("should rename live workflows and reject deleted or unknown ones")
    void shouldUpdateDisplayName() {
        // Given
        service.create(TENANT, "aaaa-1111", "billing", "user:alice").block();

        // When
        CanonicalWorkflow renamed = service.updateDisplayName(TENANT, "aaaa-1111", "billing v2").block();

        // Then
        assertEquals("billing v2", renamed.getDisplayName());
        StepVerifier.create(service.updateDisplayName(TENANT, "nope", "x"))
                .expectErrorSatisfies(error -> assertEquals("FLOWSYNC_ERR_0008",
                        ((FlowSyncRuntimeException) error).getErrorCode()))
                .verify();
        service.softDelete(TENANT, "aaaa-1111").block();
        StepVerifier.create(service.updateDisplayName(TENANT, "aaaa-1111", "x"))
                .expectErrorSatisfies(error -> assertEquals("FLOWSYNC_ERR_0009",
                        ((FlowSyncRuntimeException) error).getErrorCode()))
                .verify();
    }

    @Test
    @DisplayName("should expose git state per environment")
    void shouldReadGitState() {
        // Given
        gitStateStore.save(GitState.builder().tenantId(TENANT).environmentId("prod").canonicalId("aaaa-1111")
                .path("prod/aaaa-1111.json").contentHash("h1").build()).block();

        // When / Then
        assertEquals("h1", service.getGitState(TENANT, "prod", "aaaa-1111").block().orElseThrow().getContentHash());
        assertTrue(service.getGitState(TENANT, "dev", "aaaa-1111").block().isEmpty());
        StepVerifier.create(service.listGitStates(TENANT, "prod").map(GitState::getCanonicalId))
                .expectNext("aaaa-1111")
                .verifyComplete();
    }
}
