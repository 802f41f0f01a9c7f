package com.lyshra.open.flowsync.integration.enumerations;

public enum OnboardOutcome {
    ONBOARDED,
    SKIPPED,
    FAILED
}
