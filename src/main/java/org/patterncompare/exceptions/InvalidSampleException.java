package org.patterncompare.exceptions;

import org.patterncompare.io.TableRole;

/**
 * A required cell is blank, not a number, or not finite.
 * Row numbers are 1-based data rows (the header is not counted).
 */
public class InvalidSampleException extends ComparisonException {

    private final TableRole role;
    private final int row;
    private final String field;
    private final String rawValue;

    public InvalidSampleException(TableRole role, int row, String field, String rawValue) {
        super("Invalid value '" + rawValue + "' for field '" + field + "' in " + role + " table, row " + row);
        this.role = role;
        this.row = row;
        this.field = field;
        this.rawValue = rawValue;
    }

    public TableRole role() {
        return role;
    }

    public int row() {
        return row;
    }

    public String field() {
        return field;
    }

    public String rawValue() {
        return rawValue;
    }
}
