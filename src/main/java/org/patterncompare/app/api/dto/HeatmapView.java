package org.patterncompare.app.api.dto;

import java.util.Arrays;
import java.util.Objects;

/**
 * UI-safe heatmap: a row-major grid with NaN for missing cells, plus its axis extents.
 *
 * @param title      panel title
 * @param unitLabel  colour bar label
 * @param kind       value or error heatmap
 * @param values     values[row][col]; row 0 is the smallest row coordinate
 * @param rowMin     smallest row coordinate
 * @param rowMax     largest row coordinate
 * @param columnMin  smallest column coordinate
 * @param columnMax  largest column coordinate
 * @param min        smallest non-NaN cell (NaN if none)
 * @param max        largest non-NaN cell (NaN if none)
 */
public record HeatmapView(String title,
                          String unitLabel,
                          HeatmapKind kind,
                          double[][] values,
                          double rowMin,
                          double rowMax,
                          double columnMin,
                          double columnMax,
                          double min,
                          double max) {

    public HeatmapView {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(unitLabel, "unitLabel must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = copyOf(values);
    }

    /** A copy of the cells; the view itself is never modified. */
    @Override
    public double[][] values() {
        return copyOf(values);
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return values.length == 0 ? 0 : values[0].length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeatmapView other)) return false;
        return title.equals(other.title)
                && unitLabel.equals(other.unitLabel)
                && kind == other.kind
                && Arrays.deepEquals(values, other.values)
                && Double.compare(rowMin, other.rowMin) == 0
                && Double.compare(rowMax, other.rowMax) == 0
                && Double.compare(columnMin, other.columnMin) == 0
                && Double.compare(columnMax, other.columnMax) == 0
                && Double.compare(min, other.min) == 0
                && Double.compare(max, other.max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, unitLabel, kind, Arrays.deepHashCode(values), rowMin, rowMax, columnMin, columnMax, min, max);
    }

    @Override
    public String toString() {
        return "HeatmapView[" + title + ", " + rows() + "x" + columns() + ", " + kind + "]";
    }

    private static double[][] copyOf(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int r = 0; r < source.length; r++) {
            copy[r] = Objects.requireNonNull(source[r], "values row must not be null").clone();
        }
        return copy;
    }
}
