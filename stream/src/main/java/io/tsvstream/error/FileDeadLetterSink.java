package io.tsvstream.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends rejected lines as JSON lines: {"ts":..,"line":..,"error":..,"text":..}.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger LOG = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(MalformedRecordException e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"line\":%d,\"error\":\"%s\",\"text\":\"%s\"}%n",
                Instant.now(), e.lineNumber(), escape(e.reason()), escape(e.line() == null ? "" : e.line())
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            LOG.warn("could not write dead letter for line {} to {}", e.lineNumber(), file, io);
        }
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c)); else sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
