package org.patterncompare.model;

import java.util.List;
import java.util.Objects;

/**
 * Inner join of a reference and a reconstruction table.
 * Rows follow reference table order and the table is never empty.
 */
public final class AlignedTable {

    private final SampleSchema schema;
    private final List<AlignedRow> rows;
    private final int referenceSize;
    private final int reconstructionSize;

    public AlignedTable(SampleSchema schema, List<AlignedRow> rows, int referenceSize, int reconstructionSize) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("AlignedTable cannot be empty");
        }
        if (rows.size() > Math.min(referenceSize, reconstructionSize)) {
            throw new IllegalArgumentException(
                    "Aligned rows (" + rows.size() + ") exceed the smaller input table ("
                            + Math.min(referenceSize, reconstructionSize) + ")"
            );
        }
        this.rows = List.copyOf(rows);
        this.referenceSize = referenceSize;
        this.reconstructionSize = reconstructionSize;
    }

    public SampleSchema schema() {
        return schema;
    }

    public List<AlignedRow> rows() {
        return rows;
    }

    public AlignedRow row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    /** Reference rows whose key has no reconstruction counterpart. */
    public int unmatchedReferenceRows() {
        return referenceSize - rows.size();
    }

    /** Reconstruction rows whose key has no reference counterpart. */
    public int unmatchedReconstructionRows() {
        return reconstructionSize - rows.size();
    }
}
