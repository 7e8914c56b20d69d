package org.patterncompare.model;

import java.util.Objects;

/**
 * One joined row: the same coordinate read from both tables, plus the derived error columns.
 */
public record AlignedRow(CoordinateKey key, double reference, double reconstruction) {

    public AlignedRow {
        Objects.requireNonNull(key, "key must not be null");
    }

    /** reconstruction - reference */
    public double difference() {
        return reconstruction - reference;
    }

    public double squaredError() {
        double d = difference();
        return d * d;
    }

    public double absError() {
        return Math.abs(difference());
    }
}
