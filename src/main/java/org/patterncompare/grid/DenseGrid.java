package org.patterncompare.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable rectangular grid of doubles, indexed by sorted row and column coordinates.
 * Cells without data hold NaN.
 *
 * Rows follow the first coordinate (a), columns the second (b), both ascending.
 */
public final class DenseGrid {

    private final double[] rowCoords;
    private final double[] colCoords;
    private final double[][] values;

    /**
     * The inputs are copied to keep immutability.
     *
     * @param rowCoords strictly ascending row coordinates (non-empty)
     * @param colCoords strictly ascending column coordinates (non-empty)
     * @param values    row-major cells, values[row][col]
     */
    public DenseGrid(double[] rowCoords, double[] colCoords, double[][] values) {
        Objects.requireNonNull(rowCoords, "rowCoords must not be null");
        Objects.requireNonNull(colCoords, "colCoords must not be null");
        Objects.requireNonNull(values, "values must not be null");
        requireStrictlyAscending(rowCoords, "rowCoords");
        requireStrictlyAscending(colCoords, "colCoords");
        if (values.length != rowCoords.length) {
            throw new IllegalArgumentException(
                    "Expected " + rowCoords.length + " rows but got " + values.length);
        }

        this.rowCoords = rowCoords.clone();
        this.colCoords = colCoords.clone();
        this.values = new double[rowCoords.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != colCoords.length) {
                throw new IllegalArgumentException(
                        "Row " + r + " must have " + colCoords.length + " columns");
            }
            this.values[r] = values[r].clone();
        }
    }

    public int rows() {
        return rowCoords.length;
    }

    public int columns() {
        return colCoords.length;
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    /** @return the cell at (a, b), or NaN when either coordinate is not on the grid */
    public double valueAt(double a, double b) {
        int r = rowIndexOf(a);
        int c = columnIndexOf(b);
        return (r < 0 || c < 0) ? Double.NaN : values[r][c];
    }

    /** @return the row index of coordinate a, or a negative number if absent */
    public int rowIndexOf(double a) {
        return Arrays.binarySearch(rowCoords, a + 0.0);
    }

    /** @return the column index of coordinate b, or a negative number if absent */
    public int columnIndexOf(double b) {
        return Arrays.binarySearch(colCoords, b + 0.0);
    }

    public double[] rowCoordinates() {
        return rowCoords.clone();
    }

    public double[] columnCoordinates() {
        return colCoords.clone();
    }

    /** Defensive deep copy of the cells, row-major. */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    public boolean sameCoordinatesAs(DenseGrid other) {
        return Arrays.equals(rowCoords, other.rowCoords) && Arrays.equals(colCoords, other.colCoords);
    }

    public AxisRange rowRange() {
        return AxisRange.of(rowCoords);
    }

    public AxisRange columnRange() {
        return AxisRange.of(colCoords);
    }

    /** Number of non-NaN cells. */
    public int filledCells() {
        int n = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v)) n++;
            }
        }
        return n;
    }

    /** Smallest non-NaN cell, or NaN if the grid holds no data. */
    public double nanMin() {
        double min = Double.NaN;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) min = v;
            }
        }
        return min;
    }

    /** Largest non-NaN cell, or NaN if the grid holds no data. */
    public double nanMax() {
        double max = Double.NaN;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) max = v;
            }
        }
        return max;
    }

    private static void requireStrictlyAscending(double[] coords, String name) {
        if (coords.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        for (int i = 1; i < coords.length; i++) {
            if (!(coords[i - 1] < coords[i])) {
                throw new IllegalArgumentException(name + " must be strictly ascending at index " + i);
            }
        }
    }

    @Override
    public String toString() {
        return "DenseGrid[" + rows() + "x" + columns() + "]";
    }
}
