package org.patterncompare.model;

import org.patterncompare.exceptions.DuplicateKeyException;
import org.patterncompare.io.TableRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, strongly-typed table of samples in source order.
 *
 * Strict mode:
 * - every coordinate key occurs at most once, duplicates are rejected.
 */
public final class SampleTable {

    private final TableRole role;
    private final List<Sample> samples;
    private final Map<CoordinateKey, Sample> byKey;

    public SampleTable(TableRole role, List<Sample> samples) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(samples, "samples must not be null");

        Map<CoordinateKey, Sample> index = new LinkedHashMap<>();
        Map<CoordinateKey, Integer> firstRow = new LinkedHashMap<>();
        for (int i = 0; i < samples.size(); i++) {
            Sample s = Objects.requireNonNull(samples.get(i), "sample must not be null");
            Integer seen = firstRow.putIfAbsent(s.key(), i + 1);
            if (seen != null) {
                throw new DuplicateKeyException(role, s.key(), seen, i + 1);
            }
            index.put(s.key(), s);
        }

        this.samples = List.copyOf(samples);
        this.byKey = Collections.unmodifiableMap(index);
    }

    public TableRole role() {
        return role;
    }

    public List<Sample> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public Optional<Sample> find(CoordinateKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    /** Keys in source order. */
    public Set<CoordinateKey> keys() {
        return byKey.keySet();
    }
}
