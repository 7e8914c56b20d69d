package org.patterncompare.exceptions;

/**
 * Input could not be read or parsed into a table.
 */
public class IngestionException extends ComparisonException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
