package com.graphgate.config.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Writes configuration JSON to a local UTF-8 file, creating parent directories as needed. */
public final class FileConfigSink implements ConfigSink {

    private final Path file;

    public FileConfigSink(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String describe() {
        return "file:" + file;
    }

    @Override
    public void write(String json) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, json, StandardCharsets.UTF_8);
    }
}
