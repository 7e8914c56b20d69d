package org.patterncompare.app.api.dto;

/**
 * Display annotation for the sign of the mean bias.
 * A reconstruction that reads higher than the reference on average is "optimistic".
 */
public enum BiasDirection {
    OPTIMISTIC("Optimistic"),
    CONSERVATIVE("Conservative");

    private final String label;

    BiasDirection(String label) {
        this.label = label;
    }

    /** Zero bias counts as conservative. */
    public static BiasDirection of(double bias) {
        return bias > 0 ? OPTIMISTIC : CONSERVATIVE;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
