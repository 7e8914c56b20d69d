package org.patterncompare.grid;

/**
 * Coordinate bounds of one grid axis, used for axis labels and image extents.
 */
public record AxisRange(double min, double max) {

    public AxisRange {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("range bounds must be finite");
        }
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max: " + min + " > " + max);
        }
    }

    /** Bounds of an ascending, non-empty coordinate sequence. */
    static AxisRange of(double[] sortedCoordinates) {
        if (sortedCoordinates.length == 0) {
            throw new IllegalArgumentException("coordinates must not be empty");
        }
        return new AxisRange(sortedCoordinates[0], sortedCoordinates[sortedCoordinates.length - 1]);
    }
}
