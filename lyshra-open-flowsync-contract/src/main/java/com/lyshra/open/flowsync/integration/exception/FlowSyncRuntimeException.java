package com.lyshra.open.flowsync.integration.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class FlowSyncRuntimeException extends RuntimeException {

    private final transient IFlowSyncErrorInfo errorInfo;
    private final Map<String, String> templateVariables;

    public FlowSyncRuntimeException(String message) {
        super(message);
        this.errorInfo = null;
        this.templateVariables = Map.of();
    }

    public FlowSyncRuntimeException(String message, Throwable cause) {
        super(message, cause);
        this.errorInfo = null;
        this.templateVariables = Map.of();
    }

    public FlowSyncRuntimeException(IFlowSyncErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null);
    }

    public FlowSyncRuntimeException(IFlowSyncErrorInfo errorInfo, Map<String, String> templateVariables, Throwable cause) {
        super(render(errorInfo, templateVariables), cause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
    }

    public String getErrorCode() {
        return errorInfo == null ? null : errorInfo.getErrorCode();
    }

    private static String render(IFlowSyncErrorInfo errorInfo, Map<String, String> templateVariables) {
        String message = errorInfo.getErrorTemplate();
        if (templateVariables != null) {
            for (Map.Entry<String, String> entry : templateVariables.entrySet()) {
                message = message.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
            }
        }
        return "[" + errorInfo.getErrorCode() + "] " + message;
    }
}
