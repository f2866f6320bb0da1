package io.tsvstream.config;

import io.tsvstream.error.ConfigurationException;
import io.tsvstream.error.MalformedRecordPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class StreamConfigTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("tsvstream.capacity");
        System.clearProperty("tsvstream.lowWatermark");
        System.clearProperty("tsvstream.malformed");
        System.clearProperty("tsvstream.separator");
    }

    @Test
    void defaults_match_documented_values() {
        StreamConfig c = StreamConfig.defaults();
        assertEquals(100, c.maxCapacity());
        assertEquals(0, c.lowWatermark());
        assertEquals(MalformedRecordPolicy.FAIL, c.malformedPolicy());
        assertEquals('\t', c.separator());
        assertEquals(StandardCharsets.UTF_8, c.charset());
    }

    @Test
    void reads_system_properties() {
        System.setProperty("tsvstream.capacity", "16");
        System.setProperty("tsvstream.lowWatermark", "4");
        System.setProperty("tsvstream.malformed", "skip");
        System.setProperty("tsvstream.separator", "|");
        StreamConfig c = StreamConfig.fromEnv();
        assertEquals(16, c.maxCapacity());
        assertEquals(4, c.lowWatermark());
        assertEquals(MalformedRecordPolicy.SKIP, c.malformedPolicy());
        assertEquals('|', c.separator());
    }

    @Test
    void rejects_invalid_values() {
        assertThrows(ConfigurationException.class, () -> StreamConfig.defaults().withMaxCapacity(0));
        assertThrows(ConfigurationException.class, () -> StreamConfig.defaults().withLowWatermark(100));
        assertThrows(ConfigurationException.class, () -> StreamConfig.parseSeparator("ab"));
        System.setProperty("tsvstream.capacity", "lots");
        assertThrows(ConfigurationException.class, StreamConfig::fromEnv);
        System.setProperty("tsvstream.capacity", "10");
        System.setProperty("tsvstream.malformed", "explode");
        assertThrows(ConfigurationException.class, StreamConfig::fromEnv);
    }

    @Test
    void tab_separator_spellings() {
        assertEquals('\t', StreamConfig.parseSeparator("\\t"));
        assertEquals('\t', StreamConfig.parseSeparator("TAB"));
        assertEquals('\t', StreamConfig.parseSeparator("\t"));
    }
}
