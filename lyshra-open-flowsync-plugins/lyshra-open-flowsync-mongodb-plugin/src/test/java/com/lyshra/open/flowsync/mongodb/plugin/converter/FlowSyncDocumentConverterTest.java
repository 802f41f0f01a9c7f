package com.lyshra.open.flowsync.mongodb.plugin.converter;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the identity row document mapping.
 */
class FlowSyncDocumentConverterTest {

    private static final Instant LINKED_AT = Instant.parse("2024-06-02T08:30:00.123Z");

    @Test
    void testEnvironmentMapping_StoresStatusValueAndDates() {
        EnvironmentMapping mapping = EnvironmentMapping.builder()
                .tenantId("acme")
                .environmentId("prod")
                .canonicalId("aaaa-1111")
                .nativeId("203")
                .status(WorkflowMappingStatus.LINKED)
                .presentInRuntime(true)
                .linkedAt(LINKED_AT)
                .linkedBy("system:auto-link")
                .build();

        Document document = FlowSyncDocumentConverter.toDocument(mapping);

        assertEquals("linked", document.getString("status"));
        assertEquals(Date.from(LINKED_AT), document.getDate("linkedAt"));
        assertTrue(document.getBoolean("presentInRuntime"));
        assertNull(document.get("workflowData"));
        assertEquals(mapping, FlowSyncDocumentConverter.toEnvironmentMapping(document));
    }

    @Test
    void testEnvironmentMapping_NestedWorkflowData() {
        Map<String, Object> workflowData = Map.of(
                "name", "billing",
                "nodes", List.of(Map.of("name", "Call API", "position", List.of(100, 200))),
                "updatedAt", LINKED_AT);
        EnvironmentMapping mapping = EnvironmentMapping.builder()
                .tenantId("acme")
                .environmentId("prod")
                .nativeId("203")
                .status(WorkflowMappingStatus.UNTRACKED)
                .presentInRuntime(true)
                .workflowData(workflowData)
                .build();

        Document document = FlowSyncDocumentConverter.toDocument(mapping);
        Document stored = (Document) document.get("workflowData");

        assertInstanceOf(Document.class, ((List<?>) stored.get("nodes")).get(0));
        assertInstanceOf(Date.class, stored.get("updatedAt"));
        EnvironmentMapping read = FlowSyncDocumentConverter.toEnvironmentMapping(document);
        assertEquals(workflowData, read.getWorkflowData());
        assertNull(read.getCanonicalId());
    }

    @Test
    void testEnvironmentMapping_IgnoresStorageId() {
        Document document = new Document("_id", new ObjectId())
                .append("tenantId", "acme")
                .append("environmentId", "prod")
                .append("nativeId", "203")
                .append("status", "missing")
                .append("presentInRuntime", false);

        EnvironmentMapping read = FlowSyncDocumentConverter.toEnvironmentMapping(document);

        assertEquals(WorkflowMappingStatus.MISSING, read.getStatus());
        assertFalse(read.isPresentInRuntime());
        assertNull(read.getWorkflowData());
    }

    @Test
    void testCanonicalWorkflow_SoftDeleteSurvives() {
        CanonicalWorkflow workflow = CanonicalWorkflow.builder()
                .tenantId("acme")
                .canonicalId("aaaa-1111")
                .displayName("billing")
                .createdAt(LINKED_AT)
                .createdBy("user:alice")
                .deletedAt(LINKED_AT.plusSeconds(60))
                .build();

        CanonicalWorkflow read = FlowSyncDocumentConverter.toCanonicalWorkflow(FlowSyncDocumentConverter.toDocument(workflow));

        assertTrue(read.isDeleted());
        assertEquals(workflow, read);
    }

    @Test
    void testRegistryEntry_UsesHashAsId() {
        ContentHashRegistryEntry entry = ContentHashRegistryEntry.builder()
                .contentHash("ab12")
                .normalizedPayload("{\"name\":\"billing\"}")
                .registeredAt(LINKED_AT)
                .build();

        Document document = FlowSyncDocumentConverter.toDocument(entry);

        assertEquals("ab12", document.getString("_id"));
        assertEquals(entry, FlowSyncDocumentConverter.toContentHashRegistryEntry(document));
    }
}
