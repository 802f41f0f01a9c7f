package com.lyshra.open.flowsync.integration.models.source;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * A live workflow instance as reported by a runtime environment.
 */
@Data
@Builder
public class RuntimeWorkflow {

    private final String nativeId;

    private final String name;

    /**
     * Raw definition as returned by the runtime.
     */
    private final Map<String, Object> definition;

    /**
     * Runtime last-modified timestamp in the runtime's own representation (ISO-8601).
     */
    private final String updatedAt;
}
