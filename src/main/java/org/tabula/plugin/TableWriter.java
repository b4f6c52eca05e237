package org.tabula.plugin;

import org.tabula.errors.WriteException;
import org.tabula.model.Table;

import java.nio.file.Path;

/**
 * Persists a single table as one spreadsheet sheet.
 */
public interface TableWriter {

    void save(Table table, Path outputPath) throws WriteException;
}
