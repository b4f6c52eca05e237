package org.tabula.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of ingesting one source file, handed to storage and reflected in the run stats.
 *
 * @param tables         one table for single-table sources, one per exported table for multi-table sources
 * @param sourcePath     file the tables were read from
 * @param sourceType     json, csv, xlsx or mdb
 * @param multiTable     true when the adapter fanned the file out into a table catalogue
 * @param sourceMetadata file-level metadata reported by the adapter, empty for single-table sources
 * @param outputPaths    spreadsheets written for this file, empty until stored
 */
public record ProcessedData(List<Table> tables, Path sourcePath, String sourceType, boolean multiTable,
                            Map<String, Object> sourceMetadata, List<Path> outputPaths) {

    public ProcessedData {
        tables = List.copyOf(tables);
        sourceMetadata = sourceMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sourceMetadata));
        outputPaths = outputPaths == null ? List.of() : List.copyOf(outputPaths);
    }

    public ProcessedData(List<Table> tables, Path sourcePath, String sourceType, boolean multiTable,
                         Map<String, Object> sourceMetadata) {
        this(tables, sourcePath, sourceType, multiTable, sourceMetadata, List.of());
    }

    public ProcessedData withOutputPaths(List<Path> paths) {
        return new ProcessedData(tables, sourcePath, sourceType, multiTable, sourceMetadata, paths);
    }

    public boolean isMultiTable() {
        return multiTable;
    }
}
