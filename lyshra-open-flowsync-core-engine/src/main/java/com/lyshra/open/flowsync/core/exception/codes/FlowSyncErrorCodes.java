package com.lyshra.open.flowsync.core.exception.codes;

import com.lyshra.open.flowsync.integration.exception.IFlowSyncErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum FlowSyncErrorCodes implements IFlowSyncErrorInfo {

    WORKFLOW_DEFINITION_PARSE_FAILED(
            "FLOWSYNC_ERR_0001",
            "Workflow definition {path} could not be parsed: {reason}"
    ),

    WORKFLOW_DEFINITION_FORMAT_UNSUPPORTED(
            "FLOWSYNC_ERR_0002",
            "Workflow definition {path} has an unsupported file format"
    ),

    SIDECAR_PARSE_FAILED(
            "FLOWSYNC_ERR_0003",
            "Companion metadata file {path} could not be parsed: {reason}"
    ),

    SIDECAR_CONSTRAINT_VIOLATION(
            "FLOWSYNC_ERR_0004",
            "Companion metadata file {path} is invalid: {violations}"
    ),

    SIDECAR_CANONICAL_ID_MISMATCH(
            "FLOWSYNC_ERR_0005",
            "Companion metadata file {path} declares canonical id {declared} but the workflow resolves to {resolved}"
    ),

    CANONICAL_ID_UNRESOLVABLE(
            "FLOWSYNC_ERR_0006",
            "No canonical id could be derived for {path}"
    ),

    WORKFLOW_NORMALIZATION_FAILED(
            "FLOWSYNC_ERR_0007",
            "Workflow definition could not be serialized for hashing: {reason}"
    ),

    CANONICAL_WORKFLOW_NOT_FOUND(
            "FLOWSYNC_ERR_0008",
            "Canonical workflow {canonicalId} does not exist for tenant {tenantId}"
    ),

    CANONICAL_WORKFLOW_DELETED(
            "FLOWSYNC_ERR_0009",
            "Canonical workflow {canonicalId} is deleted"
    ),

    MAPPING_NOT_FOUND(
            "FLOWSYNC_ERR_0010",
            "No mapping for native workflow {nativeId} in environment {environmentId}"
    ),

    MAPPING_IS_DELETED(
            "FLOWSYNC_ERR_0011",
            "Mapping for native workflow {nativeId} in environment {environmentId} is deleted and cannot change"
    ),

    MAPPING_CONFLICT(
            "FLOWSYNC_ERR_0012",
            "Canonical workflow {canonicalId} is already linked to native workflow {conflictingNativeId} in environment {environmentId}"
    ),

    SYNC_IN_PROGRESS(
            "FLOWSYNC_ERR_0013",
            "A sync for {tenantId}/{environmentId} is already running (held by {owner})"
    ),

    SOURCE_LISTING_FAILED(
            "FLOWSYNC_ERR_0014",
            "Listing workflows for {tenantId}/{environmentId} failed: {reason}"
    ),

    CONTENT_HASH_REGISTRY_UNAVAILABLE(
            "FLOWSYNC_ERR_0015",
            "Content hash registry could not be loaded: {reason}"
    ),

    SYNC_LOCK_LOST(
            "FLOWSYNC_ERR_0016",
            "The sync guard for {tenantId}/{environmentId} expired or was taken over during the run"
    ),

    DUPLICATE_CANONICAL_ID(
            "FLOWSYNC_ERR_0017",
            "Workflow file {path} resolves to canonical id {canonicalId}, which is also claimed by {others}"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
}
