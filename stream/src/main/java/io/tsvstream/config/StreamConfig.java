package io.tsvstream.config;

import io.tsvstream.error.ConfigurationException;
import io.tsvstream.error.MalformedRecordPolicy;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Stream tuning. maxCapacity is the backpressure bound; the source is resumed once a dequeue leaves
 * lowWatermark or fewer records buffered.
 */
public record StreamConfig(
        int maxCapacity,
        int lowWatermark,
        MalformedRecordPolicy malformedPolicy,
        char separator,
        Charset charset
) {
    public static final int DEFAULT_CAPACITY = 100;

    public StreamConfig {
        if (maxCapacity < 1) throw new ConfigurationException("maxCapacity must be positive but was " + maxCapacity);
        if (lowWatermark < 0 || lowWatermark >= maxCapacity) {
            throw new ConfigurationException("lowWatermark must be in [0, " + maxCapacity + ") but was " + lowWatermark);
        }
        if (malformedPolicy == null) throw new ConfigurationException("malformedPolicy is required");
        if (charset == null) throw new ConfigurationException("charset is required");
    }

    public static StreamConfig defaults() {
        return new StreamConfig(DEFAULT_CAPACITY, 0, MalformedRecordPolicy.FAIL, '\t', StandardCharsets.UTF_8);
    }

    public StreamConfig withMaxCapacity(int n) { return new StreamConfig(n, lowWatermark, malformedPolicy, separator, charset); }
    public StreamConfig withLowWatermark(int n) { return new StreamConfig(maxCapacity, n, malformedPolicy, separator, charset); }
    public StreamConfig withMalformedPolicy(MalformedRecordPolicy p) { return new StreamConfig(maxCapacity, lowWatermark, p, separator, charset); }
    public StreamConfig withSeparator(char c) { return new StreamConfig(maxCapacity, lowWatermark, malformedPolicy, c, charset); }
    public StreamConfig withCharset(Charset c) { return new StreamConfig(maxCapacity, lowWatermark, malformedPolicy, separator, c); }

    public static StreamConfig fromEnv() {
        int capacity = parseInt("tsvstream.capacity", get("tsvstream.capacity", "TSVSTREAM_CAPACITY", String.valueOf(DEFAULT_CAPACITY)));
        int low = parseInt("tsvstream.lowWatermark", get("tsvstream.lowWatermark", "TSVSTREAM_LOW_WATERMARK", "0"));
        MalformedRecordPolicy policy = MalformedRecordPolicy.fromString(get("tsvstream.malformed", "TSVSTREAM_MALFORMED", "FAIL"));
        String sep = get("tsvstream.separator", "TSVSTREAM_SEPARATOR", "\\t");
        String cs = get("tsvstream.charset", "TSVSTREAM_CHARSET", "UTF-8");
        Charset charset;
        try {
            charset = Charset.forName(cs);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unsupported charset: " + cs, e);
        }
        return new StreamConfig(capacity, low, policy, parseSeparator(sep), charset);
    }

    /** Accepts a single character, or {@code \t} / {@code tab} for the tab character. */
    public static char parseSeparator(String s) {
        if (s.equals("\\t") || s.equalsIgnoreCase("tab")) return '\t';
        if (s.length() != 1) throw new ConfigurationException("separator must be a single character but was '" + s + "'");
        return s.charAt(0);
    }

    private static String get(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer but was '" + value + "'", e);
        }
    }
}
