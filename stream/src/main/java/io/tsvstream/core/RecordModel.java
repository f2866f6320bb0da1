package io.tsvstream.core;

import io.tsvstream.error.MalformedRecordException;

/**
 * Maps one non-empty line of text to a typed value.
 * Implementations must be stateless or confined to the source thread; they are called once per line, in order.
 */
public interface RecordModel<T> {
    T parseLine(String line) throws MalformedRecordException;
}
