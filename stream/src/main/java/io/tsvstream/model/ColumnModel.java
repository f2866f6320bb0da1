package io.tsvstream.model;

import io.tsvstream.core.RecordModel;
import io.tsvstream.error.ConfigurationException;
import io.tsvstream.error.MalformedRecordException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Default record model: splits a line on a single separator character and decodes each field by its column type.
 * No quoting or escaping; the field count must match the column count exactly.
 */
public class ColumnModel implements RecordModel<Row> {
    public static final char TAB = '\t';

    private final List<Column> columns;
    private final char separator;
    private final Map<String, Integer> index;

    public ColumnModel(List<Column> columns) { this(columns, TAB); }

    public ColumnModel(List<Column> columns, char separator) {
        if (columns == null || columns.isEmpty()) throw new ConfigurationException("at least one column is required");
        this.columns = List.copyOf(columns);
        this.separator = separator;
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (idx.put(this.columns.get(i).name(), i) != null) {
                throw new ConfigurationException("duplicate column name: " + this.columns.get(i).name());
            }
        }
        this.index = Map.copyOf(idx);
    }

    public List<Column> columns() { return columns; }
    public char separator() { return separator; }

    @Override
    public Row parseLine(String line) {
        Object[] values = new Object[columns.size()];
        int field = 0;
        int start = 0;
        while (true) {
            int end = line.indexOf(separator, start);
            String raw = end < 0 ? line.substring(start) : line.substring(start, end);
            if (field >= values.length) {
                throw new MalformedRecordException("expected " + values.length + " fields but found more", line);
            }
            values[field] = decode(columns.get(field), raw, line);
            field++;
            if (end < 0) break;
            start = end + 1;
        }
        if (field != values.length) {
            throw new MalformedRecordException("expected " + values.length + " fields but found " + field, line);
        }
        return new Row(index, values);
    }

    private static Object decode(Column column, String raw, String line) {
        try {
            return column.type().parse(raw);
        } catch (RuntimeException e) {
            throw new MalformedRecordException("column '" + column.name() + "' (" + column.type() + "): cannot decode '" + raw + "'", line, e);
        }
    }
}
