package io.tsvstream.model;

import io.tsvstream.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses textual column specifications such as {@code name:text,age:integer}.
 * Unnamed entries ({@code text,integer}) are named c0, c1, ...
 */
public final class ColumnSpec {
    private ColumnSpec() {}

    public static List<Column> parse(String spec) {
        if (spec == null || spec.isBlank()) throw new ConfigurationException("empty column specification");
        String[] parts = spec.split(",");
        List<Column> out = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i].trim();
            if (p.isEmpty()) throw new ConfigurationException("empty column at position " + i + " in '" + spec + "'");
            int colon = p.indexOf(':');
            if (colon < 0) {
                out.add(new Column("c" + i, ColumnType.fromName(p)));
            } else {
                String name = p.substring(0, colon).trim();
                if (name.isEmpty()) throw new ConfigurationException("empty column name at position " + i + " in '" + spec + "'");
                out.add(new Column(name, ColumnType.fromName(p.substring(colon + 1))));
            }
        }
        return out;
    }

    public static List<Column> of(ColumnType... types) {
        List<Column> out = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) out.add(new Column("c" + i, types[i]));
        return out;
    }
}
