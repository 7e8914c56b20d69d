package org.patterncompare.io.csv;

/**
 * Describes how a CSV export is laid out.
 * Example (first line is the header):
 * Phi[deg],Theta[deg],dB10normalize(GainTotal)
 * 0,0,-3.21
 */
public record CsvFormat(char separator) {

    public static final CsvFormat DEFAULT = new CsvFormat(',');

    public CsvFormat {
        if (separator == '"' || separator == '\n' || separator == '\r') {
            throw new IllegalArgumentException("separator must not be a quote or line break");
        }
    }
}
