package com.lyshra.open.flowsync.integration.models.source;

import lombok.Builder;
import lombok.Data;

/**
 * A workflow definition file as read from the repository, with its optional companion sidecar.
 */
@Data
@Builder
public class RepositoryWorkflowFile {

    /**
     * Repository-relative path, e.g. {@code workflows/aaaa-1111.json}.
     */
    private final String path;

    /**
     * Raw file content (JSON or YAML, detected from the path extension).
     */
    private final String content;

    private final String commitReference;

    private final String sidecarPath;

    /**
     * Raw companion metadata document, null when the file has none.
     */
    private final String sidecarContent;

    public boolean hasSidecar() {
        return sidecarContent != null && !sidecarContent.isBlank();
    }
}
