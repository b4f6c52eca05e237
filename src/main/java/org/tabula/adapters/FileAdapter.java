package org.tabula.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.input.BOMInputStream;
import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceFormatException;
import org.tabula.model.Table;
import org.tabula.util.FileUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapter for delimited text and JSON files. One table per file, named after the file stem.
 */
public class FileAdapter extends AbstractSourceAdapter {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_CSV = "csv";

    static final ConfigSchema SCHEMA = ConfigSchema.forAdapter("FileAdapter")
            .require("path", "format")
            .allow("format", FORMAT_JSON, FORMAT_CSV)
            .build();

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public FileAdapter(Map<String, ?> config, Logger logger) throws ConfigException {
        super(config, SCHEMA, logger);
    }

    @Override
    public List<Table> fetch() throws IngestException {
        markFetchStart();
        Path path = requireFile("path");
        String name = FileUtils.stem(path);
        String fileType = FileUtils.fileType(path);
        try {
            Table table;
            if (FORMAT_JSON.equals(config.getString("format"))) {
                JsonNode root = MAPPER.readTree(path.toFile());
                if (root == null || root.isMissingNode()) {
                    throw new SourceFormatException("No JSON content in " + path);
                }
                table = JsonTables.toTable(name, root, fileType, null, logger);
            } else {
                // Excel's "CSV UTF-8" export starts with a byte order mark
                try (InputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get();
                     Reader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    table = CsvTables.read(name, reader, fileType, null, logger);
                }
            }
            logger.log(Level.FINE, "Read {0}: {1} rows, {2} columns",
                    new Object[]{path, table.rowCount(), table.columns().size()});
            return List.of(table);
        } catch (JsonProcessingException e) {
            throw new SourceFormatException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SourceFormatException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }
}
