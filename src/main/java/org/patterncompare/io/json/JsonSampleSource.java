package org.patterncompare.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.*;

/**
 * JSON implementation of SampleSource.
 *
 * Expected JSON shape: array of flat objects
 * [
 *   { "Phi[deg]": 0, "Theta[deg]": 0, "gain": -3.21 },
 *   { "Phi[deg]": 0, "Theta[deg]": 1, "gain": -3.19 }
 * ]
 * Columns are the union of keys in first-seen order; absent keys become blank cells.
 */
public final class JsonSampleSource implements SampleSource {

    private static final Logger log = LoggerFactory.getLogger(JsonSampleSource.class);

    private final TableRole role;
    private final InputStreamSupplier streamSupplier;
    private final String description;

    // Cached after first load
    private volatile RawTable cached;

    private final Object lock = new Object();

    public JsonSampleSource(TableRole role, InputStreamSupplier streamSupplier, String description) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    public static JsonSampleSource ofFile(TableRole role, Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return new JsonSampleSource(role, () -> Files.newInputStream(path), path.toString());
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
        ObjectMapper mapper = new ObjectMapper();
        JsonFactory factory = mapper.getFactory();

        List<String> columns = new ArrayList<>();
        Map<String, Integer> columnIndex = new HashMap<>();
        List<Map<Integer, String>> records = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            if (p.nextToken() != JsonToken.START_ARRAY) {
                throw new IngestionException("JSON must start with an array of objects: " + description);
            }

            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken() != JsonToken.START_OBJECT) {
                    throw new IngestionException("Expected an object inside the array: " + description);
                }

                Map<Integer, String> record = new HashMap<>();
                while (p.nextToken() != JsonToken.END_OBJECT) {
                    String field = p.currentName().strip();
                    JsonToken value = p.nextToken();

                    if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
                        throw new IngestionException(
                                "Field '" + field + "' must hold a scalar value in " + role + " table: " + description
                        );
                    }

                    Integer idx = columnIndex.get(field);
                    if (idx == null) {
                        idx = columns.size();
                        columns.add(field);
                        columnIndex.put(field, idx);
                    }
                    record.put(idx, value == JsonToken.VALUE_NULL ? "" : p.getText());
                }
                records.add(record);
            }

        } catch (NoSuchFileException e) {
            throw new IngestionException("File not found: " + e.getFile(), e);
        } catch (IOException e) {
            throw new IngestionException("Failed to read JSON for " + role + " table: " + description, e);
        }

        if (records.isEmpty()) {
            throw new IngestionException("JSON array is empty for " + role + " table: " + description);
        }

        List<List<String>> rows = new ArrayList<>(records.size());
        for (Map<Integer, String> record : records) {
            List<String> row = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                row.add(record.getOrDefault(i, ""));
            }
            rows.add(row);
        }

        log.debug("Read {} rows x {} columns for {} table", rows.size(), columns.size(), role);
        return new RawTable(role, columns, rows);
    }
}
