package com.graphgate.bootstrap;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphgateSettingsTest {

    @Test
    void fromEnvironment_defaults() {
        GraphgateSettings settings = GraphgateSettings.fromEnvironment(Map.of());
        assertEquals("config", settings.getConfigDir());
        assertEquals(List.of("gateway.json"), settings.getConfigFiles());
        assertEquals(List.of(Path.of("config", "gateway.json")), settings.getConfigPaths());
        assertFalse(settings.isCompress());
        assertFalse(settings.isEncodeSteps());
        assertEquals(0, settings.getRetryWaitSeconds());
        assertNull(settings.getEffectiveConfigOut());
    }

    @Test
    void fromEnvironment_readsVariables() {
        GraphgateSettings settings = GraphgateSettings.fromEnvironment(Map.of(
                GraphgateSettings.ENV_CONFIG_DIR, "/etc/graphgate",
                GraphgateSettings.ENV_CONFIG_FILES, " base.json, ,overrides.json ",
                GraphgateSettings.ENV_CONFIG_COMPRESS, "TRUE",
                GraphgateSettings.ENV_ENCODE_STEPS, "1",
                GraphgateSettings.ENV_CONFIG_RETRY_WAIT_SECONDS, "15",
                GraphgateSettings.ENV_EFFECTIVE_CONFIG_OUT, "/tmp/effective.json"));

        assertEquals("/etc/graphgate", settings.getConfigDir());
        assertEquals(List.of("base.json", "overrides.json"), settings.getConfigFiles());
        assertEquals(Path.of("/etc/graphgate", "overrides.json"), settings.getConfigPaths().get(1));
        assertTrue(settings.isCompress());
        assertTrue(settings.isEncodeSteps());
        assertEquals(15, settings.getRetryWaitSeconds());
        assertEquals("/tmp/effective.json", settings.getEffectiveConfigOut());
    }

    @Test
    void fromEnvironment_invalidNumbersFallBackToDefault() {
        GraphgateSettings settings = GraphgateSettings.fromEnvironment(Map.of(
                GraphgateSettings.ENV_CONFIG_RETRY_WAIT_SECONDS, "soon",
                GraphgateSettings.ENV_CONFIG_COMPRESS, "yes"));
        assertEquals(0, settings.getRetryWaitSeconds());
        assertFalse(settings.isCompress());
    }

    @Test
    void builder_clampsNegativeRetry() {
        assertEquals(0, GraphgateSettings.builder().retryWaitSeconds(-5).build().getRetryWaitSeconds());
    }
}
