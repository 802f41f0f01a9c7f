package com.lyshra.open.flowsync.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Lifecycle status of a workflow's runtime representation in one environment.
 *
 * <p>Precedence when several facts apply at once (highest first):</p>
 * <ol>
 *   <li>{@link #DELETED} - terminal, overrides everything</li>
 *   <li>{@link #IGNORED} - explicitly excluded from reconciliation</li>
 *   <li>{@link #MISSING} - was known in the runtime, no longer present</li>
 *   <li>{@link #UNTRACKED} - present in the runtime without a canonical identity</li>
 *   <li>{@link #LINKED} - present in the runtime and bound to a canonical identity</li>
 * </ol>
 */
@Getter
@AllArgsConstructor
public enum WorkflowMappingStatus {

    LINKED("linked"),
    UNTRACKED("untracked"),
    MISSING("missing"),
    IGNORED("ignored"),
    DELETED("deleted");

    private final String value;

    /**
     * Whether this status participates in the "one live mapping per canonical id" constraint.
     */
    public boolean occupiesCanonicalSlot() {
        return this != MISSING;
    }

    public static WorkflowMappingStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Mapping status cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowMappingStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown mapping status: " + value);
    }
}
