package com.graphgate.bootstrap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Gateway settings loaded from environment variables.
 * <p>
 * Configuration files: GRAPHGATE_CONFIG_DIR (default {@code config}) and GRAPHGATE_CONFIG_FILES
 * (comma-separated, merged in order so later files win; default {@code gateway.json}).
 * GRAPHGATE_CONFIG_COMPRESS and GRAPHGATE_ENCODE_STEPS are booleans (default false).
 * GRAPHGATE_EFFECTIVE_CONFIG_OUT, when set, is the file the effective configuration is written to.
 */
public final class GraphgateSettings {

    static final String ENV_CONFIG_DIR = "GRAPHGATE_CONFIG_DIR";
    static final String ENV_CONFIG_FILES = "GRAPHGATE_CONFIG_FILES";
    static final String ENV_CONFIG_COMPRESS = "GRAPHGATE_CONFIG_COMPRESS";
    static final String ENV_ENCODE_STEPS = "GRAPHGATE_ENCODE_STEPS";
    static final String ENV_CONFIG_RETRY_WAIT_SECONDS = "GRAPHGATE_CONFIG_RETRY_WAIT_SECONDS";
    static final String ENV_EFFECTIVE_CONFIG_OUT = "GRAPHGATE_EFFECTIVE_CONFIG_OUT";

    private static final String DEFAULT_CONFIG_DIR = "config";
    private static final String DEFAULT_CONFIG_FILE = "gateway.json";
    private static final int DEFAULT_CONFIG_RETRY_WAIT_SECONDS = 0;

    private final String configDir;
    private final List<String> configFiles;
    private final boolean compress;
    private final boolean encodeSteps;
    private final int retryWaitSeconds;
    private final String effectiveConfigOut;

    private GraphgateSettings(Builder b) {
        this.configDir = b.configDir != null ? b.configDir : DEFAULT_CONFIG_DIR;
        this.configFiles = b.configFiles.isEmpty()
                ? List.of(DEFAULT_CONFIG_FILE)
                : Collections.unmodifiableList(new ArrayList<>(b.configFiles));
        this.compress = b.compress;
        this.encodeSteps = b.encodeSteps;
        this.retryWaitSeconds = Math.max(0, b.retryWaitSeconds);
        this.effectiveConfigOut = b.effectiveConfigOut;
    }

    public static GraphgateSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from the given variables (e.g. in tests). */
    public static GraphgateSettings fromEnvironment(Map<String, String> env) {
        return builder()
                .configDir(getEnv(env, ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR))
                .configFiles(parseCommaSeparated(env.get(ENV_CONFIG_FILES)))
                .compress(parseBoolean(env.get(ENV_CONFIG_COMPRESS), false))
                .encodeSteps(parseBoolean(env.get(ENV_ENCODE_STEPS), false))
                .retryWaitSeconds(parseInt(env.get(ENV_CONFIG_RETRY_WAIT_SECONDS), DEFAULT_CONFIG_RETRY_WAIT_SECONDS))
                .effectiveConfigOut(getEnv(env, ENV_EFFECTIVE_CONFIG_OUT, null))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Directory for configuration files. Default {@code config}. */
    public String getConfigDir() {
        return configDir;
    }

    /** Configuration file names in merge order (later wins). Default {@code [gateway.json]}. */
    public List<String> getConfigFiles() {
        return configFiles;
    }

    /** Configuration files resolved against {@link #getConfigDir()}. */
    public List<Path> getConfigPaths() {
        Path dir = Path.of(configDir);
        return configFiles.stream().map(dir::resolve).collect(Collectors.toList());
    }

    /** Whether the effective configuration is compressed before use. */
    public boolean isCompress() {
        return compress;
    }

    /** Passed to the transcoder: whether step pipelines are embedded in encoded form. */
    public boolean isEncodeSteps() {
        return encodeSteps;
    }

    /** Seconds between load attempts when no file is found; 0 = fail immediately. */
    public int getRetryWaitSeconds() {
        return retryWaitSeconds;
    }

    /** File to write the effective configuration to; null = do not write. */
    public String getEffectiveConfigOut() {
        return effectiveConfigOut;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "GraphgateSettings{configDir=" + configDir + ", configFiles=" + configFiles
                + ", compress=" + compress + ", encodeSteps=" + encodeSteps
                + ", retryWaitSeconds=" + retryWaitSeconds + ", effectiveConfigOut=" + effectiveConfigOut + "}";
    }

    public static final class Builder {
        private String configDir;
        private List<String> configFiles = List.of();
        private boolean compress;
        private boolean encodeSteps;
        private int retryWaitSeconds = DEFAULT_CONFIG_RETRY_WAIT_SECONDS;
        private String effectiveConfigOut;

        private Builder() {
        }

        public Builder configDir(String configDir) {
            this.configDir = configDir;
            return this;
        }

        public Builder configFiles(List<String> configFiles) {
            this.configFiles = Objects.requireNonNull(configFiles, "configFiles");
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder encodeSteps(boolean encodeSteps) {
            this.encodeSteps = encodeSteps;
            return this;
        }

        public Builder retryWaitSeconds(int retryWaitSeconds) {
            this.retryWaitSeconds = retryWaitSeconds;
            return this;
        }

        public Builder effectiveConfigOut(String effectiveConfigOut) {
            this.effectiveConfigOut = effectiveConfigOut;
            return this;
        }

        public GraphgateSettings build() {
            return new GraphgateSettings(this);
        }
    }
}
