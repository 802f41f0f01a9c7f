package com.lyshra.open.flowsync.core.engine.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Reads repository workflow files into plain maps. The format is chosen by extension:
 * {@code .json} as JSON, {@code .yaml}/{@code .yml} as YAML.
 */
@Slf4j
public final class WorkflowDefinitionParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper JSON_MAPPER;
    private static final ObjectMapper YAML_MAPPER;

    static {
        JSON_MAPPER = new ObjectMapper();
        configureMapper(JSON_MAPPER);

        YAML_MAPPER = new ObjectMapper(new YAMLFactory());
        configureMapper(YAML_MAPPER);
    }

    private static void configureMapper(ObjectMapper mapper) {
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private WorkflowDefinitionParser() {
        // Utility class
    }

    public static boolean isYaml(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    public static boolean isJson(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    public static Map<String, Object> parse(String path, String content) {
        ObjectMapper mapper;
        if (isJson(path)) {
            mapper = JSON_MAPPER;
        } else if (isYaml(path)) {
            mapper = YAML_MAPPER;
        } else {
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.WORKFLOW_DEFINITION_FORMAT_UNSUPPORTED, Map.of("path", path));
        }
        if (content == null || content.isBlank()) {
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.WORKFLOW_DEFINITION_PARSE_FAILED,
                    Map.of("path", path, "reason", "file is empty"));
        }
        try {
            Map<String, Object> definition = mapper.readValue(content, MAP_TYPE);
            if (definition == null) {
                throw new FlowSyncRuntimeException(FlowSyncErrorCodes.WORKFLOW_DEFINITION_PARSE_FAILED,
                        Map.of("path", path, "reason", "document is null"));
            }
            return definition;
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse workflow definition {}: {}", path, e.getOriginalMessage());
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.WORKFLOW_DEFINITION_PARSE_FAILED,
                    Map.of("path", path, "reason", String.valueOf(e.getOriginalMessage())), e);
        }
    }

    /**
     * Workflow display name from the definition's {@code name} field.
     */
    public static String displayNameOf(Map<String, Object> definition) {
        Object name = definition.get("name");
        return name == null ? null : name.toString();
    }
}
