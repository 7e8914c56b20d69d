package org.patterncompare.model;

import java.util.List;

/**
 * Names of the fields a comparison reads from both tables.
 * Names are trimmed; all three must be non-empty and distinct.
 *
 * @param coordAField first coordinate (grid rows), e.g. "Phi[deg]"
 * @param coordBField second coordinate (grid columns), e.g. "Theta[deg]"
 * @param valueField  compared value, e.g. "dB10normalize(GainTotal)"
 */
public record SampleSchema(String coordAField, String coordBField, String valueField) {

    /** Column layout of the antenna pattern exports. */
    public static final SampleSchema ANTENNA_DEFAULT =
            new SampleSchema("Phi[deg]", "Theta[deg]", "dB10normalize(GainTotal)");

    public SampleSchema {
        coordAField = requireName(coordAField, "coordAField");
        coordBField = requireName(coordBField, "coordBField");
        valueField = requireName(valueField, "valueField");
        if (coordAField.equals(coordBField) || coordAField.equals(valueField) || coordBField.equals(valueField)) {
            throw new IllegalArgumentException(
                    "schema fields must be distinct: " + coordAField + ", " + coordBField + ", " + valueField
            );
        }
    }

    /** Required fields in a fixed order: coordinates first, then the value. */
    public List<String> requiredFields() {
        return List.of(coordAField, coordBField, valueField);
    }

    private static String requireName(String name, String paramName) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(paramName + " must be non-empty");
        }
        return name.strip();
    }
}
