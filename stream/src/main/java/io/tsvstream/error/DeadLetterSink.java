package io.tsvstream.error;

public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(MalformedRecordException e);
    @Override default void close() {}
}
