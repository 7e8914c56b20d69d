package org.patterncompare.io;

/**
 * Which side of the comparison a table plays.
 * {@link #toString()} gives the lowercase label used in error messages and log lines.
 */
public enum TableRole {
    REFERENCE("reference"),
    RECONSTRUCTION("reconstruction");

    private final String label;

    TableRole(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
