package org.tabula.plugin;

import org.tabula.errors.IngestException;
import org.tabula.model.Table;

import java.util.List;
import java.util.Map;

/**
 * Format-specific strategy that reads one external source into {@link Table}s.
 * Configuration is checked once, in the implementing constructor.
 */
public interface SourceAdapter {

    /**
     * Reads the source. Must not mutate the adapter configuration.
     *
     * @return zero or more tables
     * @throws org.tabula.errors.SourceNotFoundException if the addressed file or resource does not exist
     * @throws org.tabula.errors.SourceFormatException   if the content cannot be parsed under the declared format
     * @throws org.tabula.errors.SourceFetchException    on transport failures (HTTP status, tool exit code)
     */
    List<Table> fetch() throws IngestException;

    /**
     * Stamps provenance ({@code source}, {@code timestamp}) on each table's metadata. Columns and records are untouched.
     */
    List<Table> transform(List<Table> tables);

    /**
     * @return true when a single source fans out into a catalogue of tables
     */
    default boolean isMultiTable() {
        return false;
    }

    /**
     * File-level metadata gathered by the last {@link #fetch()}, empty for single-table sources.
     */
    default Map<String, Object> sourceMetadata() {
        return Map.of();
    }
}
