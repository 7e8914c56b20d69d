package org.patterncompare.exceptions;

/**
 * Base type for every failure that ends a comparison run.
 * None of these are transient, so callers report and abort instead of retrying.
 */
public abstract class ComparisonException extends RuntimeException {

    protected ComparisonException(String message) {
        super(message);
    }

    protected ComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
