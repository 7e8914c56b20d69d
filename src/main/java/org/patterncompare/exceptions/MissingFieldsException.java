package org.patterncompare.exceptions;

import org.patterncompare.io.TableRole;

import java.util.List;
import java.util.Objects;

/**
 * A table lacks one or more of the fields the comparison requires.
 */
public class MissingFieldsException extends ComparisonException {

    private final TableRole role;
    private final List<String> missingFields;
    private final List<String> availableFields;

    public MissingFieldsException(TableRole role, List<String> missingFields, List<String> availableFields) {
        super(role + " table is missing required fields " + missingFields
                + " (available: " + availableFields + ")");
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.missingFields = List.copyOf(missingFields);
        this.availableFields = List.copyOf(availableFields);
    }

    public TableRole role() {
        return role;
    }

    public List<String> missingFields() {
        return missingFields;
    }

    public List<String> availableFields() {
        return availableFields;
    }
}
