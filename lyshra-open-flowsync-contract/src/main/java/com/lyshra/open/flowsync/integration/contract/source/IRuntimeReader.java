package com.lyshra.open.flowsync.integration.contract.source;

import com.lyshra.open.flowsync.integration.models.source.RuntimeWorkflow;
import reactor.core.publisher.Flux;

/**
 * Read-only view of the workflows currently deployed in a runtime environment.
 */
public interface IRuntimeReader {

    /**
     * Lists live workflows with native id, raw definition and the runtime's own
     * last-modified timestamp.
     *
     * @param tenantId      the tenant identifier
     * @param environmentId the environment identifier
     * @return stream of runtime workflows
     */
    Flux<RuntimeWorkflow> listWorkflows(String tenantId, String environmentId);
}
