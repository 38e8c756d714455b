package com.graphgate.config.load;

import com.graphgate.config.AbsoluteUrl;
import com.graphgate.config.GatewayConfiguration;
import com.graphgate.config.codec.ConfigDecodeException;
import com.graphgate.config.schema.Field;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationLoaderTest {

    private static final String BASE_JSON = """
            {
              "version": 1,
              "server": { "baseURL": "https://base.example.com" },
              "graphQL": {
                "schema": { "query": "Query" },
                "types": {
                  "Query": { "users": { "type": "User", "isList": true, "steps": [ { "http": { "path": "/users" } } ] } },
                  "User": { "id": { "type": "Int" }, "name": { "type": "String" } }
                }
              }
            }
            """;

    private static final String OVERRIDE_JSON = """
            {
              "version": 2,
              "graphQL": {
                "schema": { "mutation": "Mutation" },
                "types": {
                  "User": { "email": { "type": "String" } }
                }
              }
            }
            """;

    /** Source that exists but cannot be read. */
    private static final ConfigSource BROKEN_SOURCE = new ConfigSource() {
        @Override
        public String describe() {
            return "broken";
        }

        @Override
        public Optional<String> read() throws IOException {
            throw new IOException("connection reset");
        }
    };

    @TempDir
    Path tempDir;

    private Path configDir;

    @BeforeEach
    void setUp() throws Exception {
        configDir = Files.createDirectories(tempDir.resolve("config"));
    }

    @Test
    void load_readsSingleFile() throws Exception {
        Files.writeString(configDir.resolve("gateway.json"), BASE_JSON);
        ConfigurationLoader loader = new ConfigurationLoader(0);

        GatewayConfiguration config = loader.load(new FileConfigSource(configDir.resolve("gateway.json")));

        assertEquals(1, config.getVersion());
        assertEquals(AbsoluteUrl.parse("https://base.example.com"), config.getServer().getBaseUrl());
        assertEquals("Query", config.getGraphQL().getSchema().getQuery());
    }

    @Test
    void load_missingFileIsNotFound() {
        ConfigurationLoader loader = new ConfigurationLoader(0);
        ConfigLoadException e = assertThrows(ConfigLoadException.class,
                () -> loader.load(new FileConfigSource(configDir.resolve("absent.json"))));
        assertTrue(e.isNotFound());
        assertTrue(e.getSource().endsWith("absent.json"));
    }

    @Test
    void load_invalidConfigurationCarriesDecodeError() throws Exception {
        Files.writeString(configDir.resolve("bad.json"), "{\"server\":{\"baseURL\":\"not a url\"}}");
        ConfigurationLoader loader = new ConfigurationLoader(0);

        ConfigLoadException e = assertThrows(ConfigLoadException.class,
                () -> loader.load(new FileConfigSource(configDir.resolve("bad.json"))));

        assertFalse(e.isNotFound());
        assertTrue(e.getCause() instanceof ConfigDecodeException);
        assertEquals("$.server.baseURL", ((ConfigDecodeException) e.getCause()).getPath());
        assertTrue(e.getMessage().contains("not a url"));
    }

    @Test
    void load_unreadableSourceIsReported() {
        ConfigurationLoader loader = new ConfigurationLoader(0);
        ConfigLoadException e = assertThrows(ConfigLoadException.class, () -> loader.load(BROKEN_SOURCE));
        assertEquals("broken", e.getSource());
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void tryLoad_returnsEmptyInsteadOfFailing() {
        ConfigurationLoader loader = new ConfigurationLoader(0);
        assertTrue(loader.tryLoad(BROKEN_SOURCE).isEmpty());
        assertTrue(loader.tryLoad(ConfigSource.ofJson("inline", "{\"version\":")).isEmpty());
        assertEquals(Optional.of(GatewayConfiguration.empty().withVersion(7)),
                loader.tryLoad(ConfigSource.ofJson("inline", "{\"version\":7}")));
    }

    @Test
    void loadConfiguration_mergesSourcesInOrder() throws Exception {
        Files.writeString(configDir.resolve("base.json"), BASE_JSON);
        Files.writeString(configDir.resolve("override.json"), OVERRIDE_JSON);
        ConfigurationLoader loader = new ConfigurationLoader(0);

        GatewayConfiguration config = loader.loadConfiguration(List.of(
                new FileConfigSource(configDir.resolve("base.json")),
                new FileConfigSource(configDir.resolve("override.json"))));

        assertEquals(2, config.getVersion());
        assertEquals(AbsoluteUrl.parse("https://base.example.com"), config.getServer().getBaseUrl());
        assertEquals("Query", config.getGraphQL().getSchema().getQuery());
        assertEquals("Mutation", config.getGraphQL().getSchema().getMutation());
        assertEquals(Map.of("email", Field.string()), config.getGraphQL().getType("User"));
        assertTrue(config.getGraphQL().getType("Query").containsKey("users"));
    }

    @Test
    void loadConfiguration_skipsMissingAndInvalidSources() throws Exception {
        Files.writeString(configDir.resolve("base.json"), BASE_JSON);
        Files.writeString(configDir.resolve("broken.json"), "{\"graphQL\":{\"types\":{\"T\":{\"f\":{}}}}}");
        ConfigurationLoader loader = new ConfigurationLoader(0);

        GatewayConfiguration config = loader.loadConfiguration(List.of(
                new FileConfigSource(configDir.resolve("absent.json")),
                new FileConfigSource(configDir.resolve("base.json")),
                new FileConfigSource(configDir.resolve("broken.json")),
                BROKEN_SOURCE));

        assertEquals(1, config.getVersion());
        assertEquals(2, config.getGraphQL().getTypes().size());
    }

    @Test
    void loadConfiguration_failsWhenNothingLoadsAndRetryDisabled() {
        ConfigurationLoader loader = new ConfigurationLoader(0);
        ConfigLoadException e = assertThrows(ConfigLoadException.class, () -> loader.loadConfiguration(List.of(
                new FileConfigSource(configDir.resolve("absent.json")), BROKEN_SOURCE)));
        assertTrue(e.getMessage().contains("absent.json"));
        assertTrue(e.getMessage().contains("broken"));
    }

    @Test
    void loadMerged_emptyWhenNoSources() {
        assertTrue(new ConfigurationLoader(0).loadMerged(List.of()).isEmpty());
    }

    @Test
    void fileSink_writesAndCreatesDirectories() throws Exception {
        Path out = tempDir.resolve("out/effective/gateway.json");
        new FileConfigSink(out).write("{\"version\":3}");
        assertEquals("{\"version\":3}", Files.readString(out));
        assertEquals(GatewayConfiguration.empty().withVersion(3),
                new ConfigurationLoader(0).load(new FileConfigSource(out)));
    }
}
