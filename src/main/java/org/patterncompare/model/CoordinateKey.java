package org.patterncompare.model;

import java.util.Comparator;

/**
 * Join key of a sample: the (a, b) angular position.
 * Equality is exact; -0.0 is stored as 0.0 so both match the same key.
 */
public record CoordinateKey(double a, double b) implements Comparable<CoordinateKey> {

    private static final Comparator<CoordinateKey> ORDER =
            Comparator.comparingDouble(CoordinateKey::a).thenComparingDouble(CoordinateKey::b);

    public CoordinateKey {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("coordinates must be finite: (" + a + ", " + b + ")");
        }
        a = a + 0.0;
        b = b + 0.0;
    }

    @Override
    public int compareTo(CoordinateKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + a + ", " + b + ")";
    }
}
