package com.lyshra.open.flowsync.core.engine.source;

import java.nio.file.Path;

/**
 * Supplies the version-control revision a checked-out directory corresponds to.
 */
@FunctionalInterface
public interface ICommitReferenceResolver {

    String resolve(Path repositoryRoot, String environmentId);

    static ICommitReferenceResolver fixed(String commitReference) {
        return (repositoryRoot, environmentId) -> commitReference;
    }
}
