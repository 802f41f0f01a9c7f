package com.lyshra.open.flowsync.core.engine.config;

import com.lyshra.open.flowsync.integration.enumerations.EnvironmentClass;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the reconciliation engine.
 *
 * Encapsulates batching, timeout, retry and locking parameters of both sync
 * orchestrators plus the repository layout conventions.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class FlowSyncConfig {

    // Batching
    @Builder.Default
    private final int batchSize = 25;

    @Builder.Default
    private final int batchConcurrency = 4;

    // Timeouts
    @Builder.Default
    private final Duration itemTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration listingTimeout = Duration.ofMinutes(2);

    // Retry
    @Builder.Default
    private final int maxRetries = 2;

    @Builder.Default
    private final Duration initialRetryBackoff = Duration.ofMillis(200);

    @Builder.Default
    private final Duration maxRetryBackoff = Duration.ofSeconds(5);

    // Sync-in-progress guard
    /**
     * Guard lease. A running sync renews it after every batch, so it only needs to cover
     * the listing and one batch.
     */
    @Builder.Default
    private final Duration syncLockDuration = Duration.ofMinutes(15);

    private final String lockOwnerId;

    // Environment classes
    @Builder.Default
    private final EnvironmentClass defaultEnvironmentClass = EnvironmentClass.OBSERVATIONAL;

    @Builder.Default
    private final Map<String, EnvironmentClass> environmentClasses = Map.of();

    // Repository layout
    @Builder.Default
    private final List<String> workflowFileExtensions = List.of(".json", ".yaml", ".yml");

    @Builder.Default
    private final String sidecarSuffix = ".meta.json";

    @Builder.Default
    private final String autoLinkActor = "system:auto-link";

    @Builder.Default
    private final String sidecarActor = "system:sidecar";

    /**
     * Creates a default configuration with a generated lock owner id.
     */
    public static FlowSyncConfig defaultConfig() {
        return FlowSyncConfig.builder()
                .lockOwnerId(generateDefaultOwnerId())
                .build();
    }

    /**
     * Creates a configuration suited for tests: small batches, short timeouts, no backoff delay.
     */
    public static FlowSyncConfig forTesting() {
        return FlowSyncConfig.builder()
                .lockOwnerId("test-" + generateDefaultOwnerId())
                .batchSize(2)
                .batchConcurrency(2)
                .itemTimeout(Duration.ofSeconds(2))
                .listingTimeout(Duration.ofSeconds(5))
                .maxRetries(1)
                .initialRetryBackoff(Duration.ofMillis(1))
                .maxRetryBackoff(Duration.ofMillis(5))
                .build();
    }

    public EnvironmentClass environmentClassOf(String environmentId) {
        return environmentClasses.getOrDefault(environmentId, defaultEnvironmentClass);
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (lockOwnerId == null || lockOwnerId.isBlank()) {
            throw new IllegalStateException("lockOwnerId must not be blank");
        }
        if (batchSize <= 0) {
            throw new IllegalStateException("batchSize must be positive");
        }
        if (batchConcurrency <= 0) {
            throw new IllegalStateException("batchConcurrency must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalStateException("maxRetries must not be negative");
        }
        requirePositive(itemTimeout, "itemTimeout");
        requirePositive(listingTimeout, "listingTimeout");
        requirePositive(initialRetryBackoff, "initialRetryBackoff");
        requirePositive(syncLockDuration, "syncLockDuration");
        if (maxRetryBackoff.compareTo(initialRetryBackoff) < 0) {
            throw new IllegalStateException("maxRetryBackoff must not be shorter than initialRetryBackoff");
        }
        if (syncLockDuration.compareTo(listingTimeout) < 0) {
            throw new IllegalStateException("syncLockDuration should be at least listingTimeout");
        }
        if (workflowFileExtensions == null || workflowFileExtensions.isEmpty()) {
            throw new IllegalStateException("workflowFileExtensions must not be empty");
        }
        if (sidecarSuffix == null || sidecarSuffix.isBlank()) {
            throw new IllegalStateException("sidecarSuffix must not be blank");
        }
        Objects.requireNonNull(defaultEnvironmentClass, "defaultEnvironmentClass");
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalStateException(name + " must be positive");
        }
    }

    private static String generateDefaultOwnerId() {
        return "flowsync-" + java.util.UUID.randomUUID().toString().substring(0, 8);
    }
}
