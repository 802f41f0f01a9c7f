package com.lyshra.open.flowsync.integration.contract.source;

import com.lyshra.open.flowsync.integration.models.source.RepositoryWorkflowFile;
import reactor.core.publisher.Flux;

/**
 * Read-only view of the version-controlled workflow definitions tracked for an environment.
 *
 * <p>Implementations are supplied by the host application (git checkout,
 * hosting provider API, plain directory). The engine never writes through this interface.</p>
 */
public interface IRepositoryReader {

    /**
     * Lists every workflow definition file for the environment, with its raw
     * content, commit reference and, when present, its companion metadata file.
     *
     * @param tenantId      the tenant identifier
     * @param environmentId the environment identifier
     * @return stream of definition files; may error with
     *         {@link com.lyshra.open.flowsync.integration.exception.WorkflowSourceReadException}
     */
    Flux<RepositoryWorkflowFile> listWorkflowFiles(String tenantId, String environmentId);
}
