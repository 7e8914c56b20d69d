package org.patterncompare.io;

/**
 * A single table input:
 * - which table it is (reference or reconstruction)
 * - where its data comes from (file/stream/etc.)
 *
 * Implementations should:
 * - load the table once and cache it
 * - fail with IngestionException when the input cannot be parsed
 * - return an immutable table
 */
public interface SampleSource {

    /**
     * The role of the table this source provides.
     */
    TableRole role();

    /**
     * Loads (or returns cached) the parsed table.
     *
     * @throws org.patterncompare.exceptions.IngestionException if the input is unreadable or malformed
     */
    RawTable load();
}
