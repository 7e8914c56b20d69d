package org.patterncompare.metrics;

import org.patterncompare.model.AlignedRow;

import java.util.Objects;

/**
 * An aligned row in the largest-errors report.
 *
 * @param rank     1 for the largest squared error
 * @param position index of the row in the aligned table
 * @param row      the aligned row itself
 */
public record RankedError(int rank, int position, AlignedRow row) {

    public RankedError {
        Objects.requireNonNull(row, "row must not be null");
        if (rank < 1) throw new IllegalArgumentException("rank must be >= 1");
        if (position < 0) throw new IllegalArgumentException("position must be >= 0");
    }

    public double squaredError() {
        return row.squaredError();
    }
}
