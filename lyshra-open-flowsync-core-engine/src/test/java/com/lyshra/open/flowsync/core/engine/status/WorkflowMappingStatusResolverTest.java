package com.lyshra.open.flowsync.core.engine.status;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowMappingStatusResolverTest {

    @Nested
    @DisplayName("Precedence table")
    class PrecedenceTests {

        @Test
        @DisplayName("should resolve every combination of facts to exactly the documented status")
        void shouldHonorPrecedenceForAllCombinations() {
            for (int mask = 0; mask < 32; mask++) {
                boolean deleted = (mask & 1) != 0;
                boolean ignored = (mask & 2) != 0;
                boolean present = (mask & 4) != 0;
                String canonicalId = (mask & 8) != 0 ? "aaaa-1111" : null;
                String nativeId = (mask & 16) != 0 ? "203" : null;

                WorkflowMappingStatus status = WorkflowMappingStatusResolver.resolve(canonicalId, nativeId, present, deleted, ignored);

                String facts = "deleted=" + deleted + " ignored=" + ignored + " present=" + present
                        + " canonical=" + canonicalId + " native=" + nativeId;
                if (deleted) {
                    assertEquals(WorkflowMappingStatus.DELETED, status, facts);
                } else if (ignored) {
                    assertEquals(WorkflowMappingStatus.IGNORED, status, facts);
                } else if (!present && nativeId != null) {
                    assertEquals(WorkflowMappingStatus.MISSING, status, facts);
                } else if (present && canonicalId != null) {
                    assertEquals(WorkflowMappingStatus.LINKED, status, facts);
                } else {
                    assertEquals(WorkflowMappingStatus.UNTRACKED, status, facts);
                }
                if (canonicalId == null) {
                    assertNotEquals(WorkflowMappingStatus.LINKED, status, facts);
                }
            }
        }

        @Test
        @DisplayName("should let DELETED beat IGNORED")
        void deletedBeatsIgnored() {
            assertEquals(WorkflowMappingStatus.DELETED,
                    WorkflowMappingStatusResolver.resolve("aaaa-1111", "203", true, true, true));
        }

        @Test
        @DisplayName("should let IGNORED beat MISSING")
        void ignoredBeatsMissing() {
            assertEquals(WorkflowMappingStatus.IGNORED,
                    WorkflowMappingStatusResolver.resolve("aaaa-1111", "203", false, false, true));
        }

        @Test
        @DisplayName("should default inconsistent facts to UNTRACKED")
        void inconsistentDefaultsToUntracked() {
            assertEquals(WorkflowMappingStatus.UNTRACKED,
                    WorkflowMappingStatusResolver.resolve("aaaa-1111", null, false, false, false));
        }
    }

    @Nested
    @DisplayName("Stored rows")
    class StoredRowTests {

        @Test
        @DisplayName("should keep an IGNORED row ignored while absent from the runtime")
        void shouldKeepIgnored() {
            // Given
            EnvironmentMapping row = EnvironmentMapping.builder()
                    .canonicalId("aaaa-1111")
                    .nativeId("203")
                    .status(WorkflowMappingStatus.IGNORED)
                    .presentInRuntime(false)
                    .build();

            // When / Then
            assertEquals(WorkflowMappingStatus.IGNORED, WorkflowMappingStatusResolver.resolve(row, false));
        }

        @Test
        @DisplayName("should resolve a row of a soft-deleted canonical workflow as DELETED")
        void shouldFollowCanonicalDeletion() {
            // Given
            EnvironmentMapping row = EnvironmentMapping.builder()
                    .canonicalId("aaaa-1111")
                    .nativeId("203")
                    .status(WorkflowMappingStatus.LINKED)
                    .presentInRuntime(true)
                    .build();

            // When / Then
            assertEquals(WorkflowMappingStatus.DELETED, WorkflowMappingStatusResolver.resolve(row, true));
            assertEquals(WorkflowMappingStatus.LINKED, WorkflowMappingStatusResolver.resolve(row, false));
        }
    }
}
