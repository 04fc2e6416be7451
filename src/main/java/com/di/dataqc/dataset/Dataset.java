package com.di.dataqc.dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable in-memory columnar table.
 * <p>
 * Columns keep their declaration order and rows keep insertion order. Every transformation
 * ({@link #selectRows}, {@link #head}, {@link #withColumn}) returns a new instance; cell lists are never
 * shared mutably, so one dataset can be read by concurrent requests.
 */
public final class Dataset {

    private final List<Column> columns;
    private final Map<String, Integer> positions;
    private final List<List<CellValue>> data;
    private final int rowCount;

    private Dataset(List<Column> columns, List<List<CellValue>> data, int rowCount) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        Map<String, Integer> pos = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (pos.put(columns.get(i).name(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + columns.get(i).name());
            }
        }
        this.positions = Collections.unmodifiableMap(pos);
        List<List<CellValue>> copy = new ArrayList<>(data.size());
        for (List<CellValue> column : data) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column length " + column.size() + " does not match row count " + rowCount);
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        this.data = Collections.unmodifiableList(copy);
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of(), 0);
    }

    /**
     * Builds a dataset from row records. Column order follows first appearance of each key; types are inferred.
     */
    public static Dataset fromRecords(List<? extends Map<String, ?>> records) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            names.addAll(record.keySet());
        }
        Builder builder = builder();
        for (String name : names) {
            builder.column(name);
        }
        for (Map<String, ?> record : records) {
            Object[] values = new Object[names.size()];
            int i = 0;
            for (String name : names) {
                values[i++] = record.get(name);
            }
            builder.row(values);
        }
        return builder.build();
    }

    // ------------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------------

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).collect(Collectors.toList());
    }

    public boolean hasColumn(String name) {
        return positions.containsKey(name);
    }

    public Column column(String name) {
        return columns.get(position(name));
    }

    public ColumnType columnType(String name) {
        return column(name).type();
    }

    /** Names from {@code requested} that this dataset does not have, in request order. */
    public List<String> missingColumns(Collection<String> requested) {
        return requested.stream().filter(c -> !hasColumn(c)).collect(Collectors.toList());
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    // ------------------------------------------------------------------------
    // Access
    // ------------------------------------------------------------------------

    public CellValue cell(int row, String column) {
        return data.get(position(column)).get(row);
    }

    /** Column-wise access in row order. */
    public List<CellValue> values(String column) {
        return data.get(position(column));
    }

    /**
     * Numeric view of a column: values coerced with {@link TypeConverter#toNumber}, nulls and non-numeric skipped.
     */
    public double[] numericValues(String column) {
        List<CellValue> cells = values(column);
        double[] out = new double[cells.size()];
        int n = 0;
        for (CellValue cell : cells) {
            CellValue number = TypeConverter.toNumber(cell);
            if (!number.isNull()) {
                out[n++] = number.asDouble();
            }
        }
        return java.util.Arrays.copyOf(out, n);
    }

    /** Row {@code index} as an ordered column-to-cell map. */
    public Map<String, CellValue> row(int index) {
        if (index < 0 || index >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + index + " out of range [0, " + rowCount + ")");
        }
        Map<String, CellValue> row = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            row.put(columns.get(c).name(), data.get(c).get(index));
        }
        return Collections.unmodifiableMap(row);
    }

    public List<Map<String, CellValue>> rows() {
        List<Map<String, CellValue>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    /** Row {@code index} with plain JSON-safe values. */
    public Map<String, Object> record(int index) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            record.put(columns.get(c).name(), data.get(c).get(index).toPlain());
        }
        return record;
    }

    public List<Map<String, Object>> toRecords(int limit) {
        int n = Math.min(limit, rowCount);
        List<Map<String, Object>> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(record(i));
        }
        return records;
    }

    public List<Map<String, Object>> toRecords() {
        return toRecords(rowCount);
    }

    // ------------------------------------------------------------------------
    // Derivation (always returns a new dataset)
    // ------------------------------------------------------------------------

    public Dataset selectRows(List<Integer> indices) {
        List<List<CellValue>> selected = new ArrayList<>(columns.size());
        for (List<CellValue> column : data) {
            List<CellValue> values = new ArrayList<>(indices.size());
            for (int index : indices) {
                values.add(column.get(index));
            }
            selected.add(values);
        }
        return new Dataset(columns, selected, indices.size());
    }

    public Dataset head(int n) {
        int limit = Math.max(0, Math.min(n, rowCount));
        List<List<CellValue>> head = new ArrayList<>(columns.size());
        for (List<CellValue> column : data) {
            head.add(column.subList(0, limit));
        }
        return new Dataset(columns, head, limit);
    }

    /**
     * Returns a copy with {@code name} appended, or replaced if it already exists.
     */
    public Dataset withColumn(String name, ColumnType type, List<CellValue> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column " + name + " has " + values.size() + " values, expected " + rowCount);
        }
        List<Column> newColumns = new ArrayList<>(columns);
        List<List<CellValue>> newData = new ArrayList<>(data);
        Integer existing = positions.get(name);
        if (existing != null) {
            newColumns.set(existing, new Column(name, type));
            newData.set(existing, values);
        } else {
            newColumns.add(new Column(name, type));
            newData.add(values);
        }
        return new Dataset(newColumns, newData, rowCount);
    }

    public Dataset withColumn(String name, CellValue constant) {
        List<CellValue> values = Collections.nCopies(rowCount, constant);
        return withColumn(name, TypeConverter.inferColumnType(List.of(constant)), values);
    }

    private int position(String name) {
        Integer pos = positions.get(name);
        if (pos == null) {
            throw new IllegalArgumentException("Unknown column: " + name + ". Available: " + columnNames());
        }
        return pos;
    }

    @Override
    public String toString() {
        return "Dataset[" + rowCount + " rows x " + columns.size() + " columns " + columnNames() + "]";
    }

    /**
     * Row-wise builder. Columns declared without a type get one inferred from their cells at {@link #build()}.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<ColumnType> types = new ArrayList<>();
        private final List<List<CellValue>> cells = new ArrayList<>();
        private int rows;

        private Builder() {
        }

        public Builder column(String name) {
            return column(name, null);
        }

        public Builder column(String name, ColumnType type) {
            if (rows > 0) {
                throw new IllegalStateException("Columns must be declared before rows");
            }
            names.add(name);
            types.add(type);
            cells.add(new ArrayList<>());
            return this;
        }

        /** Appends a row; raw values are wrapped with {@link CellValue#of(Object)}. */
        public Builder row(Object... values) {
            if (values.length != names.size()) {
                throw new IllegalArgumentException("Row has " + values.length + " values, expected " + names.size());
            }
            for (int i = 0; i < values.length; i++) {
                cells.get(i).add(CellValue.of(values[i]));
            }
            rows++;
            return this;
        }

        public Builder cells(List<CellValue> values) {
            if (values.size() != names.size()) {
                throw new IllegalArgumentException("Row has " + values.size() + " values, expected " + names.size());
            }
            for (int i = 0; i < values.size(); i++) {
                cells.get(i).add(values.get(i));
            }
            rows++;
            return this;
        }

        public Dataset build() {
            List<Column> columns = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                ColumnType type = types.get(i) != null ? types.get(i) : TypeConverter.inferColumnType(cells.get(i));
                columns.add(new Column(names.get(i), type));
            }
            return new Dataset(columns, cells, rows);
        }
    }
}
