package com.graphgate.bootstrap;

import com.graphgate.config.GatewayConfiguration;
import com.graphgate.config.transcode.Blueprint;

import java.util.Objects;

/**
 * Result of {@link GatewayBootstrap#initialize}: the settings used, the effective configuration
 * and the blueprint built from it.
 */
public final class BootstrapContext {

    private final GraphgateSettings settings;
    private final GatewayConfiguration configuration;
    private final Blueprint blueprint;

    public BootstrapContext(GraphgateSettings settings, GatewayConfiguration configuration, Blueprint blueprint) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.blueprint = Objects.requireNonNull(blueprint, "blueprint");
    }

    public GraphgateSettings getSettings() {
        return settings;
    }

    /** Merged and, when {@link GraphgateSettings#isCompress()} is set, compressed configuration. */
    public GatewayConfiguration getConfiguration() {
        return configuration;
    }

    public Blueprint getBlueprint() {
        return blueprint;
    }
}
