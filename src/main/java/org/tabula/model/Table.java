package org.tabula.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform in-memory form of one tabular result: ordered columns, fixed-arity rows and open metadata.
 * Columns and records are frozen at construction; only {@link #metadata()} may change afterwards.
 */
public final class Table {

    public static final String ROW_COUNT = "row_count";
    public static final String COLUMN_COUNT = "column_count";
    public static final String FILE_TYPE = "file_type";

    private final String name;
    private final List<String> columns;
    private final List<List<Object>> records;
    private final Map<String, Object> metadata;

    public Table(String name, List<String> columns, List<? extends List<?>> records, String fileType) {
        this(name, columns, records, fileType, null);
    }

    public Table(String name, List<String> columns, List<? extends List<?>> records, String fileType,
                 Map<String, Object> extraMetadata) {
        this.name = Objects.requireNonNull(name, "Table name cannot be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));

        List<List<Object>> rows = new ArrayList<>(records.size());
        int index = 0;
        for (List<?> record : records) {
            if (record.size() != this.columns.size()) {
                throw new IllegalArgumentException("Record " + index + " of table '" + name + "' has " + record.size()
                                                   + " values, expected " + this.columns.size());
            }
            rows.add(Collections.unmodifiableList(new ArrayList<>(record)));
            index++;
        }
        this.records = Collections.unmodifiableList(rows);

        this.metadata = new LinkedHashMap<>();
        this.metadata.put(ROW_COUNT, this.records.size());
        this.metadata.put(COLUMN_COUNT, this.columns.size());
        this.metadata.put(FILE_TYPE, fileType);
        if (extraMetadata != null) {
            extraMetadata.forEach((key, value) -> {
                if (!ROW_COUNT.equals(key) && !COLUMN_COUNT.equals(key)) {
                    this.metadata.put(key, value);
                }
            });
        }
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> records() {
        return records;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public int rowCount() {
        return records.size();
    }

    /**
     * Lazy row-as-map view, zipping {@link #columns()} with each record. Duplicate column names
     * resolve to the last position holding that name.
     */
    public List<Map<String, Object>> asDicts() {
        return new AbstractList<>() {
            @Override
            public Map<String, Object> get(int index) {
                List<Object> record = records.get(index);
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), record.get(i));
                }
                return Collections.unmodifiableMap(row);
            }

            @Override
            public int size() {
                return records.size();
            }
        };
    }

    /**
     * Header-block lines recorded by a spreadsheet read, as text; empty when the table has none.
     */
    public List<String> headerData() {
        Object value = metadata.get("header_data");
        if (value instanceof List<?> list) {
            List<String> lines = new ArrayList<>(list.size());
            for (Object line : list) {
                lines.add(line == null ? "" : String.valueOf(line));
            }
            return Collections.unmodifiableList(lines);
        }
        return List.of();
    }

    @Override
    public String toString() {
        return "Table[" + name + ", columns=" + columns.size() + ", rows=" + records.size() + "]";
    }
}
