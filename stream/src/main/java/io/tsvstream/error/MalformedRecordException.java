package io.tsvstream.error;

/**
 * A line could not be decoded by the record model. Models throw it without a line number;
 * the stream rethrows a copy positioned at the offending line.
 */
public class MalformedRecordException extends TsvStreamException {
    private final String reason;
    private final String line;
    private final long lineNumber; // -1 when unknown

    public MalformedRecordException(String message, String line) {
        this(message, line, -1, null);
    }

    public MalformedRecordException(String message, String line, Throwable cause) {
        this(message, line, -1, cause);
    }

    private MalformedRecordException(String message, String line, long lineNumber, Throwable cause) {
        super(lineNumber < 0 ? message : "line " + lineNumber + ": " + message, cause);
        this.reason = message;
        this.line = line;
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException atLine(long lineNumber) {
        return new MalformedRecordException(reason(), line, lineNumber, getCause());
    }

    /** Message without the line prefix. */
    public String reason() { return reason; }

    public String line() { return line; }
    public long lineNumber() { return lineNumber; }
}
