package org.patterncompare.model;

import java.util.Objects;

/**
 * One typed record of a sample table.
 */
public record Sample(CoordinateKey key, double value) {

    public Sample {
        Objects.requireNonNull(key, "key must not be null");
    }

    public static Sample of(double a, double b, double value) {
        return new Sample(new CoordinateKey(a, b), value);
    }
}
