package org.patterncompare.io.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.patterncompare.exceptions.IngestionException;
import org.patterncompare.io.InputStreamSupplier;
import org.patterncompare.io.RawTable;
import org.patterncompare.io.SampleSource;
import org.patterncompare.io.TableRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * CSV implementation of SampleSource.
 *
 * Expected shape: a header row followed by data rows, e.g.
 * <pre>
 * Phi[deg], Theta[deg], dB10normalize(GainTotal)
 * 0, 0, -3.21
 * 0, 1, -3.19
 * </pre>
 * Cells stay text here; numeric parsing happens once the schema is known.
 */
public final class CsvSampleSource implements SampleSource {

    private static final Logger log = LoggerFactory.getLogger(CsvSampleSource.class);

    private static final char BOM = '\uFEFF';

    private final TableRole role;
    private final InputStreamSupplier streamSupplier;
    private final CsvFormat format;
    private final String description;

    // Cached after first load
    private volatile RawTable cached;

    private final Object lock = new Object();

    public CsvSampleSource(TableRole role, InputStreamSupplier streamSupplier, CsvFormat format, String description) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    public static CsvSampleSource ofFile(TableRole role, Path path, CsvFormat format) {
        Objects.requireNonNull(path, "path must not be null");
        return new CsvSampleSource(role, () -> Files.newInputStream(path), format, path.toString());
    }

    @Override
    public TableRole role() {
        return role;
    }

    @Override
    public RawTable load() {
        RawTable local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            log.info("Loading {} data: {}", role, description);
            this.cached = loadOnce();
            return this.cached;
        }
    }

    private RawTable loadOnce() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(format.separator());

        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             MappingIterator<String[]> it = mapper.readerFor(String[].class).with(schema).readValues(in)) {

            while (it.hasNextValue()) {
                String[] cells = it.nextValue();
                if (header == null) {
                    header = headerOf(cells);
                    continue;
                }
                rows.add(fitToHeader(cells, header.size(), rows.size() + 1));
            }
        } catch (NoSuchFileException e) {
            throw new IngestionException("File not found: " + e.getFile(), e);
        } catch (IOException e) {
            throw new IngestionException("Failed to read CSV for " + role + " table: " + description, e);
        }

        if (header == null) {
            throw new IngestionException("CSV has no header row for " + role + " table: " + description);
        }
        if (rows.isEmpty()) {
            throw new IngestionException("CSV has no data rows for " + role + " table: " + description);
        }

        log.debug("Read {} rows x {} columns for {} table", rows.size(), header.size(), role);
        return new RawTable(role, header, rows);
    }

    private static List<String> headerOf(String[] cells) {
        List<String> header = new ArrayList<>(Arrays.asList(cells));
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }
        return header;
    }

    /**
     * Short rows are padded with blank cells; long rows are accepted only when
     * the surplus cells are blank (trailing separators).
     */
    private List<String> fitToHeader(String[] cells, int width, int rowNumber) {
        List<String> row = new ArrayList<>(width);
        for (int i = 0; i < cells.length; i++) {
            if (i < width) {
                row.add(cells[i]);
            } else if (!cells[i].isBlank()) {
                throw new IngestionException(
                        "Row " + rowNumber + " of " + role + " table has " + cells.length
                                + " cells but the header has " + width + ": " + description
                );
            }
        }
        while (row.size() < width) {
            row.add("");
        }
        return row;
    }
}
