package org.patterncompare.model;

import org.patterncompare.exceptions.InvalidSampleException;
import org.patterncompare.exceptions.MissingFieldsException;
import org.patterncompare.io.RawTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a raw, text-celled table into a typed SampleTable.
 * This is the only place where fields are looked up by name; later stages work on records.
 */
public final class SampleTableAssembler {

    // Plain decimal with optional exponent; rejects Java literal forms such as 1d, 0x1p3, NaN, Infinity
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Checks that every required field is a column of the table.
     * Column names are already trimmed by RawTable, required names are trimmed here.
     *
     * @throws MissingFieldsException naming the table and the absent fields
     */
    public void validate(RawTable table, List<String> requiredFields) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(requiredFields, "requiredFields must not be null");

        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!table.hasColumn(field)) {
                missing.add(field == null ? "null" : field.strip());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldsException(table.role(), missing, table.columns());
        }
    }

    /**
     * Validates the table against the schema, then parses the coordinate and value cells.
     *
     * @throws MissingFieldsException if a schema field is absent
     * @throws InvalidSampleException if a required cell is blank, non-numeric or not finite
     * @throws org.patterncompare.exceptions.DuplicateKeyException if a coordinate pair repeats
     */
    public SampleTable assemble(RawTable table, SampleSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        validate(table, schema.requiredFields());

        int aCol = table.columnIndex(schema.coordAField()).orElseThrow();
        int bCol = table.columnIndex(schema.coordBField()).orElseThrow();
        int vCol = table.columnIndex(schema.valueField()).orElseThrow();

        List<Sample> samples = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            double a = parse(table, r, aCol, schema.coordAField());
            double b = parse(table, r, bCol, schema.coordBField());
            double v = parse(table, r, vCol, schema.valueField());
            samples.add(Sample.of(a, b, v));
        }
        return new SampleTable(table.role(), samples);
    }

    private static double parse(RawTable table, int row, int column, String field) {
        String raw = table.cell(row, column);
        String text = raw.strip();
        if (text.isEmpty() || !DECIMAL.matcher(text).matches()) {
            throw new InvalidSampleException(table.role(), row + 1, field, raw);
        }
        double value = Double.parseDouble(text);
        // 1e999 matches the pattern but overflows
        if (!Double.isFinite(value)) {
            throw new InvalidSampleException(table.role(), row + 1, field, raw);
        }
        return value;
    }
}
