package io.tsvstream.runtime;

import io.tsvstream.core.Record;
import io.tsvstream.error.TsvStreamException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Blocking {@link Iterator} adapter over {@link RecordStream#next()}.
 */
final class RecordIterator<T> implements Iterator<Record<T>> {
    private final RecordStream<T> stream;
    private Record<T> next;
    private boolean done = false;

    RecordIterator(RecordStream<T> stream) {
        this.stream = stream;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (done) return false;
        try {
            Optional<Record<T>> r = stream.next();
            if (r.isEmpty()) {
                done = true;
                return false;
            }
            next = r.get();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TsvStreamException("interrupted while waiting for the next record", e);
        }
    }

    @Override
    public Record<T> next() {
        if (!hasNext()) throw new NoSuchElementException();
        Record<T> r = next;
        next = null;
        return r;
    }
}
