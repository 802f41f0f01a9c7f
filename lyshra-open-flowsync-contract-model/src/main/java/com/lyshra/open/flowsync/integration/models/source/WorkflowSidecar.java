package com.lyshra.open.flowsync.integration.models.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Companion metadata document stored next to a workflow file, used to bootstrap
 * environment mappings during repository sync.
 *
 * <pre>{@code
 * {
 *   "canonical_workflow_id": "aaaa-1111",
 *   "environments": {
 *     "dev": { "native_id": "203", "content_hash": "...", "last_seen_at": "2024-05-01T10:00:00Z" }
 *   }
 * }
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowSidecar {

    @NotBlank(message = "canonical_workflow_id must not be blank")
    @JsonProperty("canonical_workflow_id")
    private String canonicalWorkflowId;

    @Valid
    @Builder.Default
    @JsonProperty("environments")
    private Map<String, SidecarEnvironmentEntry> environments = new LinkedHashMap<>();
}
