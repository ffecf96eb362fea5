package com.questrail.busgen.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Introspection XML read from a local file. Described by its file name.
 */
public final class FileIntrospectionSource implements IntrospectionSource
{
    private final Path file;

    public FileIntrospectionSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String description() {
        Path name = file.getFileName();
        return name == null ? file.toString() : name.toString();
    }

    @Override
    public InputStream open() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "not a readable file");
        }
        return Files.newInputStream(file);
    }
}
