package com.lyshra.open.flowsync.core.engine.hash;

import com.lyshra.open.flowsync.core.engine.hash.impl.InMemoryHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.normalize.impl.WorkflowNormalizerImpl;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryContentHashRegistryStore;
import com.lyshra.open.flowsync.core.engine.support.WorkflowDefinitions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowContentHasherTest {

    private static final String COLLIDING_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    /**
     * Maps every unsalted payload to one digest; salted payloads get a real digest.
     */
    private static final IContentDigester COLLIDING_DIGESTER = payload ->
            payload.contains(WorkflowContentHasher.CANONICAL_ID_SALT_KEY)
                    ? Sha256ContentDigester.getInstance().digest(payload)
                    : COLLIDING_HASH;

    private InMemoryHashCollisionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryHashCollisionRegistry(new InMemoryContentHashRegistryStore());
    }

    private WorkflowContentHasher hasher(IContentDigester digester) {
        return new WorkflowContentHasher(WorkflowNormalizerImpl.getInstance(), digester, registry);
    }

    @Nested
    @DisplayName("Fingerprints")
    class FingerprintTests {

        @Test
        @DisplayName("should return a 64 character lowercase hex SHA-256 digest")
        void shouldReturnHexDigest() {
            // When
            FingerprintResult result = hasher(Sha256ContentDigester.getInstance())
                    .computeFingerprint(WorkflowDefinitions.workflow("billing", "v1"), null)
                    .block();

            // Then
            assertNotNull(result);
            assertTrue(result.getContentHash().matches("[0-9a-f]{64}"));
            assertFalse(result.isCollisionDetected());
            assertEquals(result.getContentHash(), result.getOriginalHash());
        }

        @Test
        @DisplayName("should be stable across repeated computation and deployments")
        void shouldBeStable() {
            // Given
            WorkflowContentHasher hasher = hasher(Sha256ContentDigester.getInstance());
            Map<String, Object> source = WorkflowDefinitions.workflow("billing", "v1");

            // When
            String first = hasher.computeFingerprint(source, null).block().getContentHash();
            String again = hasher.computeFingerprint(source, "aaaa-1111").block().getContentHash();
            String deployed = hasher.computeFingerprint(WorkflowDefinitions.deployedCopy(source, "203"), null)
                    .block().getContentHash();

            // Then
            assertEquals(first, again);
            assertEquals(first, deployed);
            assertEquals(1, registry.size());
        }
    }

    @Nested
    @DisplayName("Collisions")
    class CollisionTests {

        @Test
        @DisplayName("should derive a distinct fallback hash when a canonical id is available")
        void shouldResolveWithCanonicalId() {
            // Given
            WorkflowContentHasher hasher = hasher(COLLIDING_DIGESTER);
            FingerprintResult a = hasher.computeFingerprint(WorkflowDefinitions.workflow("a", "v1"), null).block();

            // When
            FingerprintResult b = hasher.computeFingerprint(WorkflowDefinitions.workflow("b", "v2"), "bbbb-2222").block();

            // Then
            assertEquals(COLLIDING_HASH, a.getContentHash());
            assertNotEquals(a.getContentHash(), b.getContentHash());
            assertTrue(b.isCollisionDetected());
            assertTrue(b.isResolved());
            assertEquals(COLLIDING_HASH, b.getOriginalHash());
        }

        @Test
        @DisplayName("should return the same fallback hash for the same workflow every time")
        void shouldReturnStableFallback() {
            // Given
            WorkflowContentHasher hasher = hasher(COLLIDING_DIGESTER);
            hasher.computeFingerprint(WorkflowDefinitions.workflow("a", "v1"), null).block();

            // When
            String first = hasher.computeFingerprint(WorkflowDefinitions.workflow("b", "v2"), "bbbb-2222").block().getContentHash();
            String second = hasher.computeFingerprint(WorkflowDefinitions.workflow("b", "v2"), "bbbb-2222").block().getContentHash();

            // Then
            assertEquals(first, second);
        }

        @Test
        @DisplayName("should flag an unresolved collision when no canonical id is available")
        void shouldFlagUnresolvedCollision() {
            // Given
            WorkflowContentHasher hasher = hasher(COLLIDING_DIGESTER);
            hasher.computeFingerprint(WorkflowDefinitions.workflow("a", "v1"), null).block();

            // When / Then
            StepVerifier.create(hasher.computeFingerprint(WorkflowDefinitions.workflow("b", "v2"), null))
                    .assertNext(result -> {
                        assertEquals(COLLIDING_HASH, result.getContentHash());
                        assertTrue(result.isUnresolvedCollision());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not report a collision for the same payload seen twice")
        void shouldNotReportSamePayload() {
            // Given
            WorkflowContentHasher hasher = hasher(COLLIDING_DIGESTER);
            hasher.computeFingerprint(WorkflowDefinitions.workflow("a", "v1"), null).block();

            // When
            FingerprintResult again = hasher.computeFingerprint(WorkflowDefinitions.workflow("a", "v1"), null).block();

            // Then
            assertFalse(again.isCollisionDetected());
        }
    }
}
