package com.lyshra.open.flowsync.integration.models.sync;

import com.lyshra.open.flowsync.integration.enumerations.OnboardOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of onboarding a selection of untracked runtime workflows.
 * Each item succeeds or fails independently.
 */
@Getter
@Builder
@ToString
public final class OnboardResult {

    private final List<OnboardItemResult> results;

    private OnboardResult(List<OnboardItemResult> results) {
        this.results = results != null
                ? Collections.unmodifiableList(new ArrayList<>(results))
                : Collections.emptyList();
    }

    public long getOnboardedCount() {
        return count(OnboardOutcome.ONBOARDED);
    }

    public long getSkippedCount() {
        return count(OnboardOutcome.SKIPPED);
    }

    public long getFailedCount() {
        return count(OnboardOutcome.FAILED);
    }

    private long count(OnboardOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
