package com.graphgate.config.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** Reads a configuration document from a local UTF-8 file; a missing file is an absent source. */
public final class FileConfigSource implements ConfigSource {

    private final Path file;

    public FileConfigSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String describe() {
        return "file:" + file;
    }

    @Override
    public Optional<String> read() throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }
}
