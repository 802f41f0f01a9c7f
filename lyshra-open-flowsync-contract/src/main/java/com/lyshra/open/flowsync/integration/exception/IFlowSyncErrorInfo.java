package com.lyshra.open.flowsync.integration.exception;

/**
 * Error code plus message template. Templates reference variables as {@code {name}}.
 */
public interface IFlowSyncErrorInfo {

    String getErrorCode();

    String getErrorTemplate();
}
