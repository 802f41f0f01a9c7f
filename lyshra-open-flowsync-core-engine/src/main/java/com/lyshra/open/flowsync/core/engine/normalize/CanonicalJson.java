package com.lyshra.open.flowsync.core.engine.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Stable serialization used for hashing and payload comparison: sorted keys at every
 * level, compact output, no insignificant whitespace. Equivalent inputs always yield
 * byte-identical output regardless of key insertion order.
 */
@Slf4j
public final class CanonicalJson {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private CanonicalJson() {
        // Utility class
    }

    public static String write(Map<String, Object> payload) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize workflow payload: {}", e.getMessage(), e);
            throw new FlowSyncRuntimeException(FlowSyncErrorCodes.WORKFLOW_NORMALIZATION_FAILED,
                    Map.of("reason", String.valueOf(e.getOriginalMessage())), e);
        }
    }
}
