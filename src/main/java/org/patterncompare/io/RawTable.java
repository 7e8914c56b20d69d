package org.patterncompare.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An already-parsed table whose cells are still text.
 * Column names are trimmed on construction; every row has exactly one cell per column.
 */
public final class RawTable {

    private final TableRole role;
    private final List<String> columns;
    private final List<List<String>> rows;

    public RawTable(TableRole role, List<String> columns, List<List<String>> rows) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");

        List<String> trimmed = new ArrayList<>(columns.size());
        for (String c : columns) {
            trimmed.add(c == null ? "" : c.strip());
        }
        this.columns = List.copyOf(trimmed);

        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = Objects.requireNonNull(rows.get(i), "row must not be null");
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException(
                        "Row " + (i + 1) + " of " + role + " table has " + row.size()
                                + " cells but the header has " + this.columns.size()
                );
            }
            // List.copyOf rejects nulls, blank cells are kept as ""
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(cell == null ? "" : cell);
            }
            copy.add(Collections.unmodifiableList(cells));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public TableRole role() {
        return role;
    }

    /** Trimmed column names in source order. */
    public List<String> columns() {
        return columns;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /** Index of a column by exact (trimmed) name. */
    public Optional<Integer> columnIndex(String name) {
        if (name == null) return Optional.empty();
        int idx = columns.indexOf(name.strip());
        return idx < 0 ? Optional.empty() : Optional.of(idx);
    }

    public boolean hasColumn(String name) {
        return columnIndex(name).isPresent();
    }

    public String cell(int row, int column) {
        return rows.get(row).get(column);
    }
}
