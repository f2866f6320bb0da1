package io.tsvstream.error;

import java.io.IOException;

/**
 * The line source failed while reading. Delivered after every record read before the failure.
 */
public class SourceReadException extends TsvStreamException {
    public SourceReadException(String sourceName, IOException cause) {
        super("read failed on " + sourceName + ": " + cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
