package org.tabula.adapters;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.tabula.errors.SourceFormatException;
import org.tabula.model.Table;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads delimited text into a {@link Table}: first record is the header, every later record one row, all values text.
 */
final class CsvTables {

    // header handled by hand so duplicate column names survive positionally
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private CsvTables() {
    }

    static Table read(String name, Reader reader, String fileType, Map<String, Object> metadata, Logger logger)
            throws IOException, SourceFormatException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            Iterator<CSVRecord> iterator = parser.iterator();
            if (!iterator.hasNext()) {
                throw new SourceFormatException("No header line found in " + name);
            }
            List<String> columns = new ArrayList<>();
            iterator.next().forEach(columns::add);

            List<List<Object>> records = new ArrayList<>();
            while (iterator.hasNext()) {
                CSVRecord record = iterator.next();
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    row.add(i < record.size() ? record.get(i) : null);
                }
                if (record.size() > columns.size()) {
                    logger.log(Level.WARNING, "{0}: record {1} has {2} values for {3} columns, extra values dropped",
                            new Object[]{name, record.getRecordNumber(), record.size(), columns.size()});
                }
                records.add(row);
            }
            return new Table(name, columns, records, fileType, metadata);
        } catch (UncheckedIOException | IllegalStateException e) {
            // commons-csv surfaces malformed input (e.g. unterminated quotes) through the iterator
            throw new SourceFormatException("Malformed delimited content in " + name + ": " + e.getMessage(), e);
        }
    }
}
