package com.graphgate.config.load;

import com.graphgate.config.GatewayConfiguration;
import com.graphgate.config.codec.ConfigDecodeException;
import com.graphgate.config.codec.GatewayConfigCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads gateway configuration from one or more {@link ConfigSource}s. Sources are layered in list
 * order with {@link GatewayConfiguration#mergeRight}, so a later source overrides an earlier one.
 * Missing sources are skipped; a source that cannot be read or decoded is logged and skipped so the
 * remaining sources still load. If no source yields a configuration, loading waits for the configured
 * retry seconds and repeats.
 */
public final class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final int retryWaitSeconds;

    /**
     * @param retryWaitSeconds seconds to wait before retrying when no source yields a configuration;
     *                         0 = fail immediately
     */
    public ConfigurationLoader(int retryWaitSeconds) {
        this.retryWaitSeconds = Math.max(0, retryWaitSeconds);
    }

    /**
     * Loads a single source.
     *
     * @throws ConfigLoadException when the source is missing, unreadable or does not decode
     */
    public GatewayConfiguration load(ConfigSource source) throws ConfigLoadException {
        Objects.requireNonNull(source, "source");
        Optional<String> json;
        try {
            json = source.read();
        } catch (IOException e) {
            throw new ConfigLoadException(source.describe(), "Failed to read configuration from " + source.describe() + ": " + e.getMessage(), e);
        }
        if (json.isEmpty()) {
            throw ConfigLoadException.notFound(source.describe());
        }
        try {
            return GatewayConfigCodec.fromJson(json.get());
        } catch (ConfigDecodeException e) {
            throw new ConfigLoadException(source.describe(), "Invalid configuration in " + source.describe() + " at " + e.getMessage(), e);
        }
    }

    /**
     * Loads a single source; returns empty (and logs) when it is missing or invalid.
     */
    public Optional<GatewayConfiguration> tryLoad(ConfigSource source) {
        try {
            GatewayConfiguration config = load(source);
            log.info("Gateway configuration loaded from {} (version={}, types={})",
                    source.describe(), config.getVersion(), config.getGraphQL().getTypes().size());
            return Optional.of(config);
        } catch (ConfigLoadException e) {
            if (e.isNotFound()) {
                log.debug("Skipping configuration source {}: not found", source.describe());
            } else {
                log.warn("Skipping configuration source {}: {}", source.describe(), e.getMessage());
            }
            return Optional.empty();
        }
    }

    /**
     * One attempt over all sources: loads every available source and merges them in order.
     *
     * @return the merged configuration, or empty when no source yielded one
     */
    public Optional<GatewayConfiguration> loadMerged(List<ConfigSource> sources) {
        List<GatewayConfiguration> loaded = new ArrayList<>();
        for (ConfigSource source : sources) {
            tryLoad(source).ifPresent(loaded::add);
        }
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        GatewayConfiguration merged = loaded.get(0);
        for (int i = 1; i < loaded.size(); i++) {
            merged = merged.mergeRight(loaded.get(i));
        }
        log.debug("Merged {} of {} configuration sources", loaded.size(), sources.size());
        return Optional.of(merged);
    }

    /**
     * Loads and merges the sources, retrying every {@code retryWaitSeconds} until at least one
     * source yields a configuration.
     *
     * @return the effective configuration (never null)
     * @throws ConfigLoadException when no source yields a configuration and retry is disabled, or when interrupted
     */
    public GatewayConfiguration loadConfiguration(List<ConfigSource> sources) throws ConfigLoadException {
        Objects.requireNonNull(sources, "sources");
        while (true) {
            Optional<GatewayConfiguration> config = loadMerged(sources);
            if (config.isPresent()) {
                return config.get();
            }
            List<String> names = new ArrayList<>();
            sources.forEach(s -> names.add(s.describe()));
            if (retryWaitSeconds == 0) {
                throw new ConfigLoadException(null,
                        "No gateway configuration found in " + names + ". Configure at least one source or set retry.");
            }
            log.warn("No gateway configuration found in {}; retrying in {}s", names, retryWaitSeconds);
            try {
                Thread.sleep(retryWaitSeconds * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConfigLoadException(null, "Interrupted while waiting for configuration", e);
            }
        }
    }
}
