package io.tsvstream.error;

import java.util.Locale;

/**
 * What the stream does with a line the record model rejects.
 */
public enum MalformedRecordPolicy {
    /** Throw from next() at the position of the bad line; later calls continue with the following lines. */
    FAIL,
    /** Log, count, and hand the line to the dead-letter sink; never surfaces to the consumer. */
    SKIP;

    public static MalformedRecordPolicy fromString(String s) {
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown malformed record policy: " + s, e);
        }
    }
}
