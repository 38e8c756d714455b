package com.graphgate.bootstrap;

import com.graphgate.config.GatewayConfiguration;
import com.graphgate.config.codec.GatewayConfigCodec;
import com.graphgate.config.load.ConfigLoadException;
import com.graphgate.config.load.ConfigSink;
import com.graphgate.config.load.ConfigSource;
import com.graphgate.config.load.ConfigurationLoader;
import com.graphgate.config.load.FileConfigSink;
import com.graphgate.config.load.FileConfigSource;
import com.graphgate.config.transcode.Blueprint;
import com.graphgate.config.transcode.TranscodeException;
import com.graphgate.config.transcode.Transcoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bootstrap for the gateway: loads the configuration files named in the settings, merges them in
 * order, optionally compresses the result, writes the effective configuration when requested and
 * builds the blueprint. Failures are reported to the caller; the JVM is never stopped here.
 */
public final class GatewayBootstrap {

    private static final Logger log = LoggerFactory.getLogger(GatewayBootstrap.class);

    private GatewayBootstrap() {
    }

    /**
     * Reads settings from the environment and initializes the gateway configuration.
     *
     * @see #initialize(GraphgateSettings, Transcoder)
     */
    public static BootstrapContext initialize(Transcoder transcoder) throws ConfigLoadException, TranscodeException {
        log.info("Bootstrap: loading settings from environment");
        return initialize(GraphgateSettings.fromEnvironment(), transcoder);
    }

    /**
     * @param settings   gateway settings
     * @param transcoder builds the blueprint from the effective configuration
     * @return context with the effective configuration and its blueprint
     * @throws ConfigLoadException when no configuration file could be loaded
     * @throws TranscodeException  when the blueprint cannot be built
     */
    public static BootstrapContext initialize(GraphgateSettings settings, Transcoder transcoder)
            throws ConfigLoadException, TranscodeException {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(transcoder, "transcoder");
        log.info("Bootstrap: configDir={}, files={}, compress={}, encodeSteps={}, retryWaitSeconds={}",
                Path.of(settings.getConfigDir()).toAbsolutePath(), settings.getConfigFiles(),
                settings.isCompress(), settings.isEncodeSteps(), settings.getRetryWaitSeconds());

        List<ConfigSource> sources = new ArrayList<>();
        for (Path file : settings.getConfigPaths()) {
            sources.add(new FileConfigSource(file));
        }
        ConfigurationLoader loader = new ConfigurationLoader(settings.getRetryWaitSeconds());
        GatewayConfiguration configuration = loader.loadConfiguration(sources);
        if (settings.isCompress()) {
            configuration = configuration.compress();
        }
        log.info("Bootstrap: effective configuration version={} query={} mutation={} types={}",
                configuration.getVersion(),
                configuration.getGraphQL().getSchema().getQuery(),
                configuration.getGraphQL().getSchema().getMutation(),
                configuration.getGraphQL().getTypes().keySet());

        if (settings.getEffectiveConfigOut() != null) {
            writeEffectiveConfig(new FileConfigSink(Path.of(settings.getEffectiveConfigOut())), configuration);
        }

        Blueprint blueprint = configuration.toBlueprint(transcoder, settings.isEncodeSteps());
        log.info("Bootstrap: blueprint built for configuration version={}", configuration.getVersion());
        return new BootstrapContext(settings, configuration, blueprint);
    }

    /** Writes the configuration to the sink; a write failure is logged and does not stop the bootstrap. */
    static void writeEffectiveConfig(ConfigSink sink, GatewayConfiguration configuration) {
        try {
            sink.write(GatewayConfigCodec.toJsonPretty(configuration));
            log.info("Effective configuration written to {}", sink.describe());
        } catch (IOException e) {
            log.warn("Failed to write effective configuration to {}: {}", sink.describe(), e.getMessage());
        }
    }
}
