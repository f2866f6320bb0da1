package io.tsvstream.source;

import io.tsvstream.core.LineSource;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a record stream reads from. Exactly one variant is chosen by the caller.
 */
public interface Input {

    static Input file(Path path) { return new FileInput(path); }

    static Input stream(InputStream in) { return new StreamInput(in); }

    static Input source(LineSource source) { return new SourceInput(source); }

    /** A file that must exist when the stream is built. */
    record FileInput(Path path) implements Input {
        public FileInput { Objects.requireNonNull(path, "path"); }
    }

    /** An already open byte stream, e.g. a socket's input stream. */
    record StreamInput(InputStream in) implements Input {
        public StreamInput { Objects.requireNonNull(in, "in"); }
    }

    /** A caller-supplied line producer. */
    record SourceInput(LineSource source) implements Input {
        public SourceInput { Objects.requireNonNull(source, "source"); }
    }
}
