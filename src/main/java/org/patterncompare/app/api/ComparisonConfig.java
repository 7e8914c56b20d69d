package org.patterncompare.app.api;

import org.patterncompare.metrics.ErrorRanking;
import org.patterncompare.model.SampleSchema;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Inputs of one comparison run.
 *
 * Built from command-line arguments:
 * <pre>
 *   [options] &lt;reconstruction-file&gt; &lt;reference-file&gt;
 *   --reconstruction=FILE --reference=FILE
 *   --coord-a=NAME --coord-b=NAME --value=NAME --top=N --separator=C
 * </pre>
 * Unset options fall back to the antenna export layout and a top-5 report.
 *
 * @param reconstructionPath file holding the reconstructed (interpolated) pattern
 * @param referencePath      file holding the actual (original) pattern
 * @param schema             coordinate and value field names
 * @param topN               number of largest differences to report
 * @param separator          CSV column separator
 */
public record ComparisonConfig(Path reconstructionPath,
                               Path referencePath,
                               SampleSchema schema,
                               int topN,
                               char separator) {

    public static final int DEFAULT_TOP_N = ErrorRanking.DEFAULT_TOP_N;
    public static final char DEFAULT_SEPARATOR = ',';

    public static final String USAGE =
            "Usage: [--coord-a=NAME] [--coord-b=NAME] [--value=NAME] [--top=N] [--separator=C] "
                    + "<reconstruction-file> <reference-file>";

    public ComparisonConfig {
        Objects.requireNonNull(reconstructionPath, "reconstructionPath must not be null");
        Objects.requireNonNull(referencePath, "referencePath must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
    }

    public static ComparisonConfig of(Path reconstructionPath, Path referencePath) {
        return new ComparisonConfig(reconstructionPath, referencePath, SampleSchema.ANTENNA_DEFAULT,
                DEFAULT_TOP_N, DEFAULT_SEPARATOR);
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on unknown options, bad values or missing file paths
     */
    public static ComparisonConfig fromArgs(String... args) {
        Objects.requireNonNull(args, "args must not be null");

        SampleSchema defaults = SampleSchema.ANTENNA_DEFAULT;
        String coordA = defaults.coordAField();
        String coordB = defaults.coordBField();
        String value = defaults.valueField();
        String reconstruction = null;
        String reference = null;
        int topN = DEFAULT_TOP_N;
        char separator = DEFAULT_SEPARATOR;
        List<String> positional = new ArrayList<>();

        for (String arg : args) {
            if (arg == null) continue;
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            int eq = arg.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Option needs a value (--name=value): " + arg + "\n" + USAGE);
            }
            String name = arg.substring(2, eq).toLowerCase(Locale.ROOT);
            String val = arg.substring(eq + 1);
            switch (name) {
                case "reconstruction" -> reconstruction = val;
                case "reference" -> reference = val;
                case "coord-a" -> coordA = val;
                case "coord-b" -> coordB = val;
                case "value" -> value = val;
                case "top" -> topN = parseTop(val);
                case "separator" -> separator = parseSeparator(val);
                default -> throw new IllegalArgumentException("Unknown option: --" + name + "\n" + USAGE);
            }
        }

        // Positional order: reconstruction first, then reference
        for (String p : positional) {
            if (reconstruction == null) {
                reconstruction = p;
            } else if (reference == null) {
                reference = p;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + p + "\n" + USAGE);
            }
        }
        if (reconstruction == null || reference == null) {
            throw new IllegalArgumentException("Both reconstruction and reference files are required.\n" + USAGE);
        }

        return new ComparisonConfig(Path.of(reconstruction), Path.of(reference),
                new SampleSchema(coordA, coordB, value), topN, separator);
    }

    private static int parseTop(String raw) {
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--top must be an integer: " + raw, e);
        }
    }

    private static char parseSeparator(String raw) {
        if ("tab".equalsIgnoreCase(raw) || "\\t".equals(raw)) {
            return '\t';
        }
        if (raw.length() != 1) {
            throw new IllegalArgumentException("--separator must be a single character or 'tab': " + raw);
        }
        return raw.charAt(0);
    }
}
