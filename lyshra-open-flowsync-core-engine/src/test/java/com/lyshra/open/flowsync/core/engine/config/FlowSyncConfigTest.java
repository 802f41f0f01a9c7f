package com.lyshra.open.flowsync.core.engine.config;

import com.lyshra.open.flowsync.integration.enumerations.EnvironmentClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowSyncConfigTest {

    @Nested
    @DisplayName("Presets")
    class PresetTests {

        @Test
        @DisplayName("should provide valid production defaults")
        void defaultConfigIsValid() {
            FlowSyncConfig config = FlowSyncConfig.defaultConfig();

            assertDoesNotThrow(config::validate);
            assertEquals(25, config.getBatchSize());
            assertEquals(4, config.getBatchConcurrency());
            assertEquals(Duration.ofSeconds(30), config.getItemTimeout());
            assertEquals(2, config.getMaxRetries());
            assertEquals(".meta.json", config.getSidecarSuffix());
            assertEquals(List.of(".json", ".yaml", ".yml"), config.getWorkflowFileExtensions());
            assertTrue(config.getLockOwnerId().startsWith("flowsync-"));
        }

        @Test
        @DisplayName("should provide a valid testing preset")
        void testingConfigIsValid() {
            FlowSyncConfig config = FlowSyncConfig.forTesting();

            assertDoesNotThrow(config::validate);
            assertEquals(2, config.getBatchSize());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should require a lock owner id")
        void shouldRequireOwner() {
            FlowSyncConfig config = FlowSyncConfig.builder().build();

            assertThrows(IllegalStateException.class, config::validate);
        }

        @Test
        @DisplayName("should reject non-positive batching values")
        void shouldRejectBatching() {
            FlowSyncConfig base = FlowSyncConfig.defaultConfig();

            assertThrows(IllegalStateException.class, () -> base.toBuilder().batchSize(0).build().validate());
            assertThrows(IllegalStateException.class, () -> base.toBuilder().batchConcurrency(-1).build().validate());
        }

        @Test
        @DisplayName("should reject inconsistent durations")
        void shouldRejectDurations() {
            FlowSyncConfig base = FlowSyncConfig.defaultConfig();

            assertThrows(IllegalStateException.class, () -> base.toBuilder().itemTimeout(Duration.ZERO).build().validate());
            assertThrows(IllegalStateException.class, () -> base.toBuilder()
                    .initialRetryBackoff(Duration.ofSeconds(10))
                    .maxRetryBackoff(Duration.ofSeconds(1))
                    .build().validate());
            assertThrows(IllegalStateException.class, () -> base.toBuilder()
                    .syncLockDuration(Duration.ofSeconds(30))
                    .build().validate());
        }

        @Test
        @DisplayName("should reject an empty extension list")
        void shouldRejectExtensions() {
            FlowSyncConfig config = FlowSyncConfig.defaultConfig().toBuilder().workflowFileExtensions(List.of()).build();

            assertThrows(IllegalStateException.class, config::validate);
        }
    }

    @Test
    @DisplayName("should resolve per-environment classes with a default")
    void shouldResolveEnvironmentClass() {
        FlowSyncConfig config = FlowSyncConfig.defaultConfig().toBuilder()
                .environmentClasses(Map.of("prod", EnvironmentClass.FULL))
                .build();

        assertEquals(EnvironmentClass.FULL, config.environmentClassOf("prod"));
        assertEquals(EnvironmentClass.OBSERVATIONAL, config.environmentClassOf("dev"));
    }
}
