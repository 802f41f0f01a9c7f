package com.lyshra.open.flowsync.integration.exception;

import lombok.Getter;

/**
 * A repository or runtime source could not be read.
 * Treated as transient by the sync orchestrators and retried.
 */
@Getter
public class WorkflowSourceReadException extends FlowSyncRuntimeException {

    private final String source;

    public WorkflowSourceReadException(String source, String message) {
        super(message);
        this.source = source;
    }

    public WorkflowSourceReadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
