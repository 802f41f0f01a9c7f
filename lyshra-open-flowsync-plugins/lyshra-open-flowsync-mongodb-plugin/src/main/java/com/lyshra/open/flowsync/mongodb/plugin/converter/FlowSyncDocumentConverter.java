package com.lyshra.open.flowsync.mongodb.plugin.converter;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts identity rows to and from BSON documents.
 *
 * <p>Timestamps are stored as BSON dates, mapping statuses by their lower-case value, and
 * the cached runtime payload as a nested document. Documents read back never expose the
 * storage {@code _id}.</p>
 */
public final class FlowSyncDocumentConverter {

    public static final String ID = "_id";
    public static final String TENANT_ID = "tenantId";
    public static final String ENVIRONMENT_ID = "environmentId";
    public static final String CANONICAL_ID = "canonicalId";
    public static final String NATIVE_ID = "nativeId";
    public static final String DISPLAY_NAME = "displayName";
    public static final String CREATED_AT = "createdAt";
    public static final String CREATED_BY = "createdBy";
    public static final String DELETED_AT = "deletedAt";
    public static final String PATH = "path";
    public static final String COMMIT_REFERENCE = "commitReference";
    public static final String CONTENT_HASH = "contentHash";
    public static final String LAST_SYNC_AT = "lastSyncAt";
    public static final String NATIVE_UPDATED_AT = "nativeUpdatedAt";
    public static final String STATUS = "status";
    public static final String PRESENT_IN_RUNTIME = "presentInRuntime";
    public static final String LINKED_AT = "linkedAt";
    public static final String LINKED_BY = "linkedBy";
    public static final String WORKFLOW_DATA = "workflowData";
    public static final String LAST_ENV_SYNC_AT = "lastEnvSyncAt";
    public static final String NORMALIZED_PAYLOAD = "normalizedPayload";
    public static final String REGISTERED_AT = "registeredAt";

    private FlowSyncDocumentConverter() {
        // Utility class
    }

    public static Document toDocument(CanonicalWorkflow workflow) {
        return new Document()
                .append(TENANT_ID, workflow.getTenantId())
                .append(CANONICAL_ID, workflow.getCanonicalId())
                .append(DISPLAY_NAME, workflow.getDisplayName())
                .append(CREATED_AT, toDate(workflow.getCreatedAt()))
                .append(CREATED_BY, workflow.getCreatedBy())
                .append(DELETED_AT, toDate(workflow.getDeletedAt()));
    }

    public static CanonicalWorkflow toCanonicalWorkflow(Document document) {
        return CanonicalWorkflow.builder()
                .tenantId(document.getString(TENANT_ID))
                .canonicalId(document.getString(CANONICAL_ID))
                .displayName(document.getString(DISPLAY_NAME))
                .createdAt(toInstant(document.getDate(CREATED_AT)))
                .createdBy(document.getString(CREATED_BY))
                .deletedAt(toInstant(document.getDate(DELETED_AT)))
                .build();
    }

    public static Document toDocument(GitState gitState) {
        return new Document()
                .append(TENANT_ID, gitState.getTenantId())
                .append(ENVIRONMENT_ID, gitState.getEnvironmentId())
                .append(CANONICAL_ID, gitState.getCanonicalId())
                .append(PATH, gitState.getPath())
                .append(COMMIT_REFERENCE, gitState.getCommitReference())
                .append(CONTENT_HASH, gitState.getContentHash())
                .append(LAST_SYNC_AT, toDate(gitState.getLastSyncAt()));
    }

    public static GitState toGitState(Document document) {
        return GitState.builder()
                .tenantId(document.getString(TENANT_ID))
                .environmentId(document.getString(ENVIRONMENT_ID))
                .canonicalId(document.getString(CANONICAL_ID))
                .path(document.getString(PATH))
                .commitReference(document.getString(COMMIT_REFERENCE))
                .contentHash(document.getString(CONTENT_HASH))
                .lastSyncAt(toInstant(document.getDate(LAST_SYNC_AT)))
                .build();
    }

    public static Document toDocument(EnvironmentMapping mapping) {
        return new Document()
                .append(TENANT_ID, mapping.getTenantId())
                .append(ENVIRONMENT_ID, mapping.getEnvironmentId())
                .append(CANONICAL_ID, mapping.getCanonicalId())
                .append(NATIVE_ID, mapping.getNativeId())
                .append(CONTENT_HASH, mapping.getContentHash())
                .append(NATIVE_UPDATED_AT, toDate(mapping.getNativeUpdatedAt()))
                .append(STATUS, mapping.getStatus() == null ? null : mapping.getStatus().getValue())
                .append(PRESENT_IN_RUNTIME, mapping.isPresentInRuntime())
                .append(LINKED_AT, toDate(mapping.getLinkedAt()))
                .append(LINKED_BY, mapping.getLinkedBy())
                .append(DISPLAY_NAME, mapping.getDisplayName())
                .append(WORKFLOW_DATA, toBsonDocument(mapping.getWorkflowData()))
                .append(LAST_ENV_SYNC_AT, toDate(mapping.getLastEnvSyncAt()));
    }

    @SuppressWarnings("unchecked")
    public static EnvironmentMapping toEnvironmentMapping(Document document) {
        String status = document.getString(STATUS);
        Object workflowData = fromBsonValue(document.get(WORKFLOW_DATA));
        return EnvironmentMapping.builder()
                .tenantId(document.getString(TENANT_ID))
                .environmentId(document.getString(ENVIRONMENT_ID))
                .canonicalId(document.getString(CANONICAL_ID))
                .nativeId(document.getString(NATIVE_ID))
                .contentHash(document.getString(CONTENT_HASH))
                .nativeUpdatedAt(toInstant(document.getDate(NATIVE_UPDATED_AT)))
                .status(status == null ? null : WorkflowMappingStatus.fromValue(status))
                .presentInRuntime(Boolean.TRUE.equals(document.getBoolean(PRESENT_IN_RUNTIME)))
                .linkedAt(toInstant(document.getDate(LINKED_AT)))
                .linkedBy(document.getString(LINKED_BY))
                .displayName(document.getString(DISPLAY_NAME))
                .workflowData(workflowData instanceof Map ? (Map<String, Object>) workflowData : null)
                .lastEnvSyncAt(toInstant(document.getDate(LAST_ENV_SYNC_AT)))
                .build();
    }

    /**
     * The content hash doubles as the document id, which makes registration first-writer-wins.
     */
    public static Document toDocument(ContentHashRegistryEntry entry) {
        return new Document()
                .append(ID, entry.getContentHash())
                .append(NORMALIZED_PAYLOAD, entry.getNormalizedPayload())
                .append(REGISTERED_AT, toDate(entry.getRegisteredAt()));
    }

    public static ContentHashRegistryEntry toContentHashRegistryEntry(Document document) {
        return ContentHashRegistryEntry.builder()
                .contentHash(document.getString(ID))
                .normalizedPayload(document.getString(NORMALIZED_PAYLOAD))
                .registeredAt(toInstant(document.getDate(REGISTERED_AT)))
                .build();
    }

    static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    /**
     * Converts a runtime payload into a nested document. Java time values become BSON dates,
     * {@link BigDecimal} becomes {@link Decimal128}, everything else is stored as is.
     */
    static Document toBsonDocument(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        Document document = new Document();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            document.put(entry.getKey(), toBsonValue(entry.getValue()));
        }
        return document;
    }

    @SuppressWarnings("unchecked")
    static Object toBsonValue(Object value) {
        if (value instanceof Map) {
            return toBsonDocument((Map<String, Object>) value);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(FlowSyncDocumentConverter::toBsonValue).toList();
        }
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof BigDecimal bigDecimal) {
            return new Decimal128(bigDecimal);
        }
        return value;
    }

    /**
     * Inverse of {@link #toBsonValue(Object)}: documents become maps, dates become
     * {@link Instant}, {@link ObjectId} becomes its hex string.
     */
    static Object fromBsonValue(Object value) {
        if (value instanceof Document document) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                result.put(entry.getKey(), fromBsonValue(entry.getValue()));
            }
            return result;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(FlowSyncDocumentConverter::fromBsonValue).toList();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Decimal128 decimal128) {
            return decimal128.bigDecimalValue();
        }
        if (value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (value instanceof Binary binary) {
            return binary.getData();
        }
        return value;
    }
}
