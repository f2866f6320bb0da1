package io.tsvstream.model;

import java.util.Objects;

public record Column(String name, ColumnType type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Column of(String name, ColumnType type) { return new Column(name, type); }

    @Override
    public String toString() { return name + ":" + type.name().toLowerCase(java.util.Locale.ROOT); }
}
