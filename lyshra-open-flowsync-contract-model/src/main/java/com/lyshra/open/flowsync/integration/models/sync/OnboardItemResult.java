package com.lyshra.open.flowsync.integration.models.sync;

import com.lyshra.open.flowsync.integration.enumerations.OnboardOutcome;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OnboardItemResult {

    private final String environmentId;

    private final String nativeId;

    private final OnboardOutcome outcome;

    private final String canonicalId;

    private final String reason;
}
