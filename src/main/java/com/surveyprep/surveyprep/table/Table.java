package com.surveyprep.surveyprep.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory survey table: ordered, unique column names and ordered rows of scalar cells.
 * A cell is {@code null} (empty), a {@link String} or a {@link Number}.
 *
 * <p>Stages never modify a table; they derive a new one through {@link #toBuilder()}.</p>
 */
public final class Table {

    private final List<String> columns;
    private final Map<String, Integer> columnIndex;
    private final List<List<Object>> rows;

    private Table(List<String> columns, List<List<Object>> rows) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            if (column == null) {
                throw new IllegalArgumentException("Column name must not be null");
            }
            if (index.putIfAbsent(column, i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column);
            }
        }

        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + row.size()
                        + " cells but table has " + columns.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }

        this.columns = List.copyOf(columns);
        this.columnIndex = Collections.unmodifiableMap(index);
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Table of(List<String> columns, List<List<Object>> rows) {
        return new Table(columns, rows);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns, List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public Object get(int row, String column) {
        Integer index = columnIndex.get(column);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(index);
    }

    public List<Object> row(int row) {
        return rows.get(row);
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            values.add(get(r, column));
        }
        return Collections.unmodifiableList(values);
    }

    public Map<String, Object> rowAsMap(int row) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<Object> cells = rows.get(row);
        for (int i = 0; i < columns.size(); i++) {
            values.put(columns.get(i), cells.get(i));
        }
        return values;
    }

    public Builder toBuilder() {
        return new Builder(columns, rows);
    }

    @Override
    public String toString() {
        return "Table[columns=" + columns + ", rows=" + rows.size() + "]";
    }

    /**
     * Mutable working copy used by a single stage while it derives its output table.
     */
    public static final class Builder {

        private final List<String> columns;
        private final Map<String, Integer> columnIndex = new HashMap<>();
        private final List<List<Object>> rows;

        private Builder(List<String> columns, List<List<Object>> rows) {
            this.columns = new ArrayList<>(columns);
            this.rows = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                this.rows.add(new ArrayList<>(row));
            }
            reindex();
        }

        public int rowCount() {
            return rows.size();
        }

        public List<String> columns() {
            return Collections.unmodifiableList(columns);
        }

        public boolean hasColumn(String column) {
            return columnIndex.containsKey(column);
        }

        public Object get(int row, String column) {
            return rows.get(row).get(indexOf(column));
        }

        public Builder set(int row, String column, Object value) {
            rows.get(row).set(indexOf(column), value);
            return this;
        }

        public Builder addRow(List<Object> row) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size()
                        + " cells but table has " + columns.size() + " columns");
            }
            rows.add(new ArrayList<>(row));
            return this;
        }

        /**
         * Appends a column; {@code values} must hold one cell per existing row.
         */
        public Builder addColumn(String column, List<Object> values) {
            if (columnIndex.containsKey(column)) {
                throw new IllegalArgumentException("Duplicate column name: " + column);
            }
            if (values.size() != rows.size()) {
                throw new IllegalArgumentException("Column " + column + " has " + values.size()
                        + " cells but table has " + rows.size() + " rows");
            }
            columnIndex.put(column, columns.size());
            columns.add(column);
            for (int r = 0; r < rows.size(); r++) {
                rows.get(r).add(values.get(r));
            }
            return this;
        }

        public Builder removeColumn(String column) {
            int index = indexOf(column);
            columns.remove(index);
            for (List<Object> row : rows) {
                row.remove(index);
            }
            reindex();
            return this;
        }

        public Builder renameColumn(String from, String to) {
            if (from.equals(to)) {
                return this;
            }
            if (columnIndex.containsKey(to)) {
                throw new IllegalArgumentException("Duplicate column name: " + to);
            }
            int index = indexOf(from);
            columns.set(index, to);
            columnIndex.remove(from);
            columnIndex.put(to, index);
            return this;
        }

        public Table build() {
            return new Table(columns, rows);
        }

        private int indexOf(String column) {
            Integer index = columnIndex.get(column);
            if (index == null) {
                throw new IllegalArgumentException("Unknown column: " + column);
            }
            return index;
        }

        private void reindex() {
            columnIndex.clear();
            for (int i = 0; i < columns.size(); i++) {
                columnIndex.put(columns.get(i), i);
            }
        }
    }
}
