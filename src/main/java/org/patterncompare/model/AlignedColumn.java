package org.patterncompare.model;

import java.util.function.ToDoubleFunction;

/**
 * Typed selector for a column of the aligned table (replaces lookups by column name).
 */
public enum AlignedColumn {

    REFERENCE(AlignedRow::reference),
    RECONSTRUCTION(AlignedRow::reconstruction),
    DIFFERENCE(AlignedRow::difference),
    SQUARED_ERROR(AlignedRow::squaredError),
    ABS_ERROR(AlignedRow::absError);

    private final ToDoubleFunction<AlignedRow> extractor;

    AlignedColumn(ToDoubleFunction<AlignedRow> extractor) {
        this.extractor = extractor;
    }

    public double valueOf(AlignedRow row) {
        return extractor.applyAsDouble(row);
    }
}
