package io.tsvstream.model;

import io.tsvstream.error.ConfigurationException;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Field types a column can be declared with. Empty fields decode to null except for TEXT.
 */
public enum ColumnType {
    TEXT {
        @Override Object decode(String raw) { return raw; }
    },
    INTEGER {
        @Override Object decode(String raw) { return Integer.valueOf(raw.trim()); }
    },
    LONG {
        @Override Object decode(String raw) { return Long.valueOf(raw.trim()); }
    },
    DOUBLE {
        @Override Object decode(String raw) { return Double.valueOf(raw.trim()); }
    },
    BOOLEAN {
        @Override Object decode(String raw) {
            String s = raw.trim();
            if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
            if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
            throw new IllegalArgumentException("not a boolean: " + raw);
        }
    },
    DATE {
        @Override Object decode(String raw) { return LocalDate.parse(raw.trim()); }
    };

    /**
     * @throws RuntimeException when the text is not a valid value of this type
     */
    abstract Object decode(String raw);

    public Object parse(String raw) {
        if (raw.isEmpty() && this != TEXT) return null;
        return decode(raw);
    }

    public static ColumnType fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "text", "string", "str" -> TEXT;
            case "int", "integer" -> INTEGER;
            case "long", "bigint" -> LONG;
            case "double", "float", "number" -> DOUBLE;
            case "bool", "boolean" -> BOOLEAN;
            case "date" -> DATE;
            default -> throw new ConfigurationException("unknown column type: " + name);
        };
    }
}
