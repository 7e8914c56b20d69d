package org.patterncompare.grid;

import java.util.Objects;

/**
 * The three grids handed to presentation. All share the reconstruction grid's
 * row and column coordinates, so cells can be compared by position.
 */
public record GridSet(DenseGrid reconstruction, DenseGrid reference, DenseGrid error) {

    public GridSet {
        Objects.requireNonNull(reconstruction, "reconstruction must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(error, "error must not be null");
        if (!reconstruction.sameCoordinatesAs(reference) || !reconstruction.sameCoordinatesAs(error)) {
            throw new IllegalArgumentException("all grids must share the reconstruction grid's coordinates");
        }
    }

    public int rows() {
        return reconstruction.rows();
    }

    public int columns() {
        return reconstruction.columns();
    }

    public double[] rowCoordinates() {
        return reconstruction.rowCoordinates();
    }

    public double[] columnCoordinates() {
        return reconstruction.columnCoordinates();
    }

    public AxisRange rowRange() {
        return reconstruction.rowRange();
    }

    public AxisRange columnRange() {
        return reconstruction.columnRange();
    }
}
