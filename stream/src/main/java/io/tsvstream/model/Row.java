package io.tsvstream.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable decoded line. Values keep column order; lookup by name goes through the shared column index.
 */
public final class Row {
    private final Map<String, Integer> index;
    private final Object[] values;

    Row(Map<String, Integer> index, Object[] values) {
        this.index = index;
        this.values = values;
    }

    public int size() { return values.length; }

    public Object get(int i) { return values[i]; }

    public Object get(String column) {
        Integer i = index.get(column);
        if (i == null) throw new IllegalArgumentException("no such column: " + column);
        return values[i];
    }

    public String getString(String column) { return (String) get(column); }
    public Integer getInt(String column) { return (Integer) get(column); }
    public Long getLong(String column) { return (Long) get(column); }
    public Double getDouble(String column) { return (Double) get(column); }
    public Boolean getBoolean(String column) { return (Boolean) get(column); }
    public LocalDate getDate(String column) { return (LocalDate) get(column); }

    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Objects.toString(values[i]));
        }
        return sb.append(')').toString();
    }
}
