package com.lyshra.open.flowsync.integration.exception;

import java.util.Map;

/**
 * The persistence layer cannot be written or read at all.
 *
 * <p>Unlike every other failure this one aborts the running sync and is
 * surfaced to the caller of {@code syncRepository}/{@code syncEnvironment}.</p>
 */
public class FlowSyncStorageException extends FlowSyncRuntimeException {

    public FlowSyncStorageException(String message) {
        super(message);
    }

    public FlowSyncStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public FlowSyncStorageException(IFlowSyncErrorInfo errorInfo, Map<String, String> templateVariables, Throwable cause) {
        super(errorInfo, templateVariables, cause);
    }
}
