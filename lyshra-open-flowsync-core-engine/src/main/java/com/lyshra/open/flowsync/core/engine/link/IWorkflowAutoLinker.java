package com.lyshra.open.flowsync.core.engine.link;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Associates an untracked runtime workflow with an existing canonical identity purely
 * from content hash equality. Prefers leaving a workflow untracked over a wrong match.
 */
public interface IWorkflowAutoLinker {

    /**
     * @return the canonical id to link to, or empty when there is no match, the match is
     *         ambiguous, or the canonical id is already bound to another native workflow
     */
    Mono<Optional<String>> tryAutoLink(String tenantId, String environmentId, String nativeId, String contentHash);
}
