package io.tsvstream.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RecordTest {
    @Test
    void equality_covers_position_and_payload() {
        Record<String> r = new Record<>(0, 1, "a");
        assertEquals(new Record<>(0, 1, "a"), r);
        assertEquals(new Record<>(0, 1, "a").hashCode(), r.hashCode());
        assertNotEquals(new Record<>(0, 2, "a"), r, "same record at another line");
        assertNotEquals(new Record<>(1, 1, "a"), r);
        assertNotEquals(new Record<>(0, 1, "b"), r);
        assertEquals("Record{seq=0, lineNumber=1, payload=a}", r.toString());
    }
}
