package com.lyshra.open.flowsync.integration.enumerations;

/**
 * Controls what an environment sync persists for each runtime workflow.
 */
public enum EnvironmentClass {

    /** The full runtime payload is cached on the environment-map row. */
    FULL,

    /** Only the content hash is retained; the repository stays authoritative for content. */
    OBSERVATIONAL;

    public boolean cachesPayload() {
        return this == FULL;
    }
}
