package com.lyshra.open.flowsync.core.engine.store.impl;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEnvironmentMapStoreTest {

    private InMemoryEnvironmentMapStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEnvironmentMapStore();
    }

    private static EnvironmentMapping mapping(String environmentId, String nativeId, String canonicalId,
                                              WorkflowMappingStatus status) {
        return EnvironmentMapping.builder()
                .tenantId("acme")
                .environmentId(environmentId)
                .nativeId(nativeId)
                .canonicalId(canonicalId)
                .status(status)
                .presentInRuntime(status != WorkflowMappingStatus.MISSING)
                .build();
    }

    @Test
    @DisplayName("should reject a second live row for the same canonical id")
    void shouldRejectDuplicateCanonical() {
        // Given
        store.save(mapping("prod", "10", "aaaa-1111", WorkflowMappingStatus.LINKED)).block();

        // When / Then
        StepVerifier.create(store.save(mapping("prod", "11", "aaaa-1111", WorkflowMappingStatus.LINKED)))
                .expectErrorSatisfies(error -> {
                    DuplicateMappingException duplicate = assertInstanceOf(DuplicateMappingException.class, error);
                    assertEquals("10", duplicate.getConflictingNativeId());
                })
                .verify();
    }

    @Test
    @DisplayName("should allow a live row next to MISSING rows and in other environments")
    void shouldAllowNonConflictingRows() {
        // Given
        store.save(mapping("prod", "10", "aaaa-1111", WorkflowMappingStatus.MISSING)).block();

        // When
        store.save(mapping("prod", "11", "aaaa-1111", WorkflowMappingStatus.LINKED)).block();
        store.save(mapping("dev", "10", "aaaa-1111", WorkflowMappingStatus.LINKED)).block();

        // Then
        StepVerifier.create(store.findByCanonicalId("acme", "prod", "aaaa-1111").count())
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should update a row in place by native id")
    void shouldUpsertByNativeId() {
        // Given
        store.save(mapping("prod", "10", null, WorkflowMappingStatus.UNTRACKED)).block();

        // When
        store.save(mapping("prod", "10", "aaaa-1111", WorkflowMappingStatus.LINKED)).block();

        // Then
        EnvironmentMapping row = store.findByNativeId("acme", "prod", "10").block().orElseThrow();
        assertEquals(WorkflowMappingStatus.LINKED, row.getStatus());
        StepVerifier.create(store.findByEnvironment("acme", "prod").count())
                .expectNext(1L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should reject a LINKED row without a canonical id")
    void shouldRejectLinkedWithoutCanonical() {
        // When / Then
        StepVerifier.create(store.save(mapping("prod", "10", null, WorkflowMappingStatus.LINKED)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
