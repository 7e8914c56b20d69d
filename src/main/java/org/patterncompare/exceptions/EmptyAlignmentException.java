package org.patterncompare.exceptions;

/**
 * The join of reference and reconstruction produced no rows.
 * Usually the two files describe the same angles on different ranges
 * (e.g. -180..180 against 0..360), which is never normalized.
 */
public class EmptyAlignmentException extends ComparisonException {

    private final int referenceRows;
    private final int reconstructionRows;

    public EmptyAlignmentException(int referenceRows, int reconstructionRows) {
        super("No matching coordinates between reference (" + referenceRows + " rows) and reconstruction ("
                + reconstructionRows + " rows). Check that both tables use the same angle ranges"
                + " (e.g. -180..180 vs 0..360).");
        this.referenceRows = referenceRows;
        this.reconstructionRows = reconstructionRows;
    }

    public int referenceRows() {
        return referenceRows;
    }

    public int reconstructionRows() {
        return reconstructionRows;
    }
}
