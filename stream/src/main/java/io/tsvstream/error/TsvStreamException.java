package io.tsvstream.error;

/**
 * Base of all errors raised by the streaming reader.
 */
public class TsvStreamException extends RuntimeException {
    public TsvStreamException(String message) { super(message); }
    public TsvStreamException(String message, Throwable cause) { super(message, cause); }
}
