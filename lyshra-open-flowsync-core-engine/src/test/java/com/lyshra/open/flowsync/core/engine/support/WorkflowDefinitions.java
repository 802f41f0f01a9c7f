package com.lyshra.open.flowsync.core.engine.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds node-graph workflow definitions for tests.
 */
public final class WorkflowDefinitions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowDefinitions() {
    }

    /**
     * A two-node workflow. {@code variant} changes the HTTP node's URL, i.e. the logic.
     */
    public static Map<String, Object> workflow(String name, String variant) {
        Map<String, Object> trigger = new LinkedHashMap<>();
        trigger.put("id", "node-trigger-" + name);
        trigger.put("name", "Schedule");
        trigger.put("type", "scheduleTrigger");
        trigger.put("position", new ArrayList<>(List.of(100, 200)));
        trigger.put("parameters", new LinkedHashMap<>(Map.of("interval", 5)));

        Map<String, Object> credential = new LinkedHashMap<>();
        credential.put("id", "cred-dev-17");
        credential.put("name", "Billing API");

        Map<String, Object> http = new LinkedHashMap<>();
        http.put("id", "node-http-" + name);
        http.put("name", "Call API");
        http.put("type", "httpRequest");
        http.put("position", new ArrayList<>(List.of(300, 200)));
        http.put("parameters", new LinkedHashMap<>(Map.of("url", "https://api.example.com/" + variant)));
        http.put("credentials", new LinkedHashMap<>(Map.of("httpHeaderAuth", credential)));

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("id", "wf-" + name);
        definition.put("name", name);
        definition.put("active", false);
        definition.put("nodes", new ArrayList<>(List.of(trigger, http)));
        definition.put("connections", new LinkedHashMap<>(Map.of("Schedule", Map.of("main", List.of()))));
        definition.put("settings", new LinkedHashMap<>(Map.of("executionOrder", "v1")));
        definition.put("updatedAt", "2024-05-01T10:00:00.000Z");
        return definition;
    }

    /**
     * The same workflow as it looks after being deployed elsewhere: different runtime ids,
     * positions, activation flag, tags and credential id.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deployedCopy(Map<String, Object> definition, String runtimeId) {
        Map<String, Object> copy = (Map<String, Object>) MAPPER.convertValue(definition, Map.class);
        copy.put("id", runtimeId);
        copy.put("active", true);
        copy.put("tags", List.of(Map.of("id", "tag-9", "name", "billing")));
        copy.put("updatedAt", "2024-06-02T08:30:00.000Z");
        List<Object> nodes = new ArrayList<>((List<Object>) copy.get("nodes"));
        Collections.reverse(nodes);
        for (Object node : nodes) {
            Map<String, Object> mapNode = (Map<String, Object>) node;
            mapNode.put("id", "runtime-" + mapNode.get("name"));
            mapNode.put("position", List.of(999, 999));
            Object credentials = mapNode.get("credentials");
            if (credentials instanceof Map) {
                for (Object reference : ((Map<String, Object>) credentials).values()) {
                    ((Map<String, Object>) reference).put("id", "cred-prod-42");
                }
            }
        }
        copy.put("nodes", nodes);
        return copy;
    }

    public static String toJson(Map<String, Object> definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
