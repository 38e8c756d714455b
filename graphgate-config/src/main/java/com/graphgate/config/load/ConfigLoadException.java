package com.graphgate.config.load;

/**
 * Thrown when configuration cannot be loaded: a source is missing, unreadable or does not decode,
 * or no source yields a configuration at all.
 */
public final class ConfigLoadException extends Exception {

    private final String source;
    private final boolean notFound;

    public ConfigLoadException(String source, String message) {
        this(source, message, null, false);
    }

    public ConfigLoadException(String source, String message, Throwable cause) {
        this(source, message, cause, false);
    }

    private ConfigLoadException(String source, String message, Throwable cause, boolean notFound) {
        super(message, cause);
        this.source = source;
        this.notFound = notFound;
    }

    /** The source exists in the list but holds no configuration (e.g. the file is absent). */
    public static ConfigLoadException notFound(String source) {
        return new ConfigLoadException(source, "Configuration source not found: " + source, null, true);
    }

    /** Description of the failing source (see {@link ConfigSource#describe()}); null when no single source is at fault. */
    public String getSource() {
        return source;
    }

    public boolean isNotFound() {
        return notFound;
    }
}
