package io.tsvstream.core;

import java.util.Objects;

/**
 * A parsed record plus its position in the input: seq counts delivered records, lineNumber counts physical lines.
 */
public final class Record<T> {
    private final long seq; // 0-based, increases by one per parsed line
    private final long lineNumber; // 1-based, blank lines included
    private final T payload;

    public Record(long seq, long lineNumber, T payload) {
        this.seq = seq;
        this.lineNumber = lineNumber;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public long lineNumber() { return lineNumber; }
    public T payload() { return payload; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && lineNumber == that.lineNumber && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, lineNumber, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", lineNumber=" + lineNumber +
                ", payload=" + payload +
                '}';
    }
}
