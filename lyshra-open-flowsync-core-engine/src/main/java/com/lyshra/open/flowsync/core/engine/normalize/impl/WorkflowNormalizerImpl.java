package com.lyshra.open.flowsync.core.engine.normalize.impl;

import com.lyshra.open.flowsync.core.engine.normalize.IWorkflowNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizer for node-graph workflow definitions ({@code name}, {@code nodes},
 * {@code connections}, {@code settings}).
 *
 * <p>Removed at the top level: timestamps, version ids, execution counters, cached
 * static data, activation flag, tags, sharing metadata and pinned data. Within
 * {@code settings}: execution bookkeeping options; an emptied {@code settings}
 * object is dropped. Within each node: position and selection state, runtime
 * identifiers, and credential ids (credentials keep only their logical name).</p>
 */
public class WorkflowNormalizerImpl implements IWorkflowNormalizer {

    static final Set<String> VOLATILE_WORKFLOW_FIELDS = Set.of(
            "id", "createdAt", "updatedAt", "versionId",
            "triggerCount", "staticData", "meta", "hash",
            "executionOrder", "homeProject", "sharedWithProjects",
            "_comment", "pinData",
            "active",
            "tags", "tagIds",
            "shared", "scopes", "usedCredentials");

    static final Set<String> VOLATILE_SETTINGS_FIELDS = Set.of(
            "executionOrder", "saveDataErrorExecution", "saveDataSuccessExecution",
            "callerPolicy", "timezone", "saveManualExecutions", "availableInMCP");

    static final Set<String> VOLATILE_NODE_FIELDS = Set.of(
            "position", "positionAbsolute", "selected", "selectedNodes",
            "executionData", "typeVersion", "onError", "id",
            "webhookId", "extendsCredential", "notesInFlow");

    private static final String SETTINGS = "settings";
    private static final String NODES = "nodes";
    private static final String CREDENTIALS = "credentials";
    private static final String NAME = "name";

    private static final Comparator<Map<String, Object>> NODE_ORDER =
            Comparator.comparing(node -> String.valueOf(node.getOrDefault(NAME, "")));

    private WorkflowNormalizerImpl() {
    }

    private static final class SingletonHelper {
        private static final WorkflowNormalizerImpl INSTANCE = new WorkflowNormalizerImpl();
    }

    public static IWorkflowNormalizer getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public Map<String, Object> normalize(Map<String, Object> definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Workflow definition cannot be null");
        }
        Map<String, Object> normalized = deepCopy(definition);
        VOLATILE_WORKFLOW_FIELDS.forEach(normalized::remove);

        if (normalized.get(SETTINGS) instanceof Map) {
            Map<String, Object> settings = asMap(normalized.get(SETTINGS));
            VOLATILE_SETTINGS_FIELDS.forEach(settings::remove);
            if (settings.isEmpty()) {
                normalized.remove(SETTINGS);
            }
        }

        if (normalized.get(NODES) instanceof List) {
            List<Object> nodes = asList(normalized.get(NODES));
            List<Map<String, Object>> mapNodes = new ArrayList<>();
            List<Object> otherNodes = new ArrayList<>();
            for (Object node : nodes) {
                if (node instanceof Map) {
                    Map<String, Object> mapNode = asMap(node);
                    normalizeNode(mapNode);
                    mapNodes.add(mapNode);
                } else {
                    otherNodes.add(node);
                }
            }
            mapNodes.sort(NODE_ORDER);
            List<Object> ordered = new ArrayList<>(mapNodes);
            ordered.addAll(otherNodes);
            normalized.put(NODES, ordered);
        }
        return normalized;
    }

    private void normalizeNode(Map<String, Object> node) {
        VOLATILE_NODE_FIELDS.forEach(node::remove);
        if (!(node.get(CREDENTIALS) instanceof Map)) {
            return;
        }
        Map<String, Object> credentials = asMap(node.get(CREDENTIALS));
        Map<String, Object> byName = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : credentials.entrySet()) {
            if (entry.getValue() instanceof Map) {
                Map<String, Object> reference = new LinkedHashMap<>();
                reference.put(NAME, asMap(entry.getValue()).get(NAME));
                byName.put(entry.getKey(), reference);
            } else {
                byName.put(entry.getKey(), entry.getValue());
            }
        }
        node.put(CREDENTIALS, byName);
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return (List<Object>) value;
    }
}
