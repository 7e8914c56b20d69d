package org.patterncompare.exceptions;

import org.patterncompare.io.TableRole;
import org.patterncompare.model.CoordinateKey;

/**
 * A coordinate pair occurs more than once within a single table.
 */
public class DuplicateKeyException extends ComparisonException {

    private final TableRole role;
    private final CoordinateKey key;
    private final int firstRow;
    private final int duplicateRow;

    public DuplicateKeyException(TableRole role, CoordinateKey key, int firstRow, int duplicateRow) {
        super("Duplicate coordinate " + key + " in " + role + " table (rows " + firstRow + " and " + duplicateRow + ")");
        this.role = role;
        this.key = key;
        this.firstRow = firstRow;
        this.duplicateRow = duplicateRow;
    }

    public TableRole role() {
        return role;
    }

    public CoordinateKey key() {
        return key;
    }

    public int firstRow() {
        return firstRow;
    }

    public int duplicateRow() {
        return duplicateRow;
    }
}
