package com.lyshra.open.flowsync.integration.models.identity;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;

/**
 * Latest version-controlled representation of a canonical workflow in one environment.
 * Unique per (tenantId, environmentId, canonicalId).
 */
@Data
@Builder(toBuilder = true)
public class GitState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;

    private final String environmentId;

    private final String canonicalId;

    /**
     * Repository-relative location of the stored definition.
     */
    private final String path;

    /**
     * Revision in which {@link #contentHash} was observed.
     */
    private final String commitReference;

    private final String contentHash;

    private final Instant lastSyncAt;
}
