package io.tsvstream.error;

/**
 * Invalid construction options. Raised before any input is opened.
 */
public class ConfigurationException extends TsvStreamException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
