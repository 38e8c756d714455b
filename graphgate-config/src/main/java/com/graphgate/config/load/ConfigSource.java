package com.graphgate.config.load;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Source of one configuration document (a file, an inline string, a remote store).
 * Implementations other than {@link FileConfigSource} are provided by the runtime.
 */
public interface ConfigSource {

    /**
     * Human-readable name used in logs and errors (e.g. {@code file:config/gateway.json}).
     */
    String describe();

    /**
     * Reads the configuration JSON.
     *
     * @return the JSON text, or empty when the source does not exist
     * @throws IOException when the source exists but cannot be read
     */
    Optional<String> read() throws IOException;

    /** In-memory source, e.g. for defaults compiled into the gateway or tests. */
    static ConfigSource ofJson(String name, String json) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(json, "json");
        return new ConfigSource() {
            @Override
            public String describe() {
                return name;
            }

            @Override
            public Optional<String> read() {
                return Optional.of(json);
            }
        };
    }
}
