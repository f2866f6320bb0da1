package io.tsvstream.error;

import java.nio.file.Path;

public class SourceNotFoundException extends TsvStreamException {
    private final Path path;

    public SourceNotFoundException(Path path) {
        super("Cannot find file at path: " + path);
        this.path = path;
    }

    public Path path() { return path; }
}
