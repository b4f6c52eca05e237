package org.tabula.adapters;

import org.tabula.config.AppConfig;
import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceFetchException;
import org.tabula.errors.SourceFormatException;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.model.Table;
import org.tabula.util.FileUtils;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapter for Microsoft Access databases ({@code .mdb}/{@code .accdb}). Every table in the file is exported
 * through the mdbtools command line utilities and becomes its own {@link Table}.
 */
public class MdbAdapter extends AbstractSourceAdapter {

    public static final String TABLE_NAME = "table_name";

    static final ConfigSchema SCHEMA = ConfigSchema.forAdapter("MdbAdapter")
            .require("path")
            .build();

    private final CommandRunner runner;
    private final String tablesCommand;
    private final String exportCommand;
    private final Duration toolTimeout;
    private Map<String, Object> sourceMetadata = Map.of();

    public MdbAdapter(Map<String, ?> config, AppConfig settings, CommandRunner runner, Logger logger)
            throws ConfigException, ToolEnvironmentException {
        super(config, SCHEMA, logger);
        this.runner = runner;
        this.tablesCommand = settings.mdbTablesCommand();
        this.exportCommand = settings.mdbExportCommand();
        this.toolTimeout = Duration.ofSeconds(settings.toolTimeoutSeconds());
        checkTools(settings, runner, logger);
    }

    /**
     * Verifies the export tools are installed. Called eagerly so a missing install surfaces before any file is read.
     */
    public static void checkTools(AppConfig settings, CommandRunner runner, Logger logger) throws ToolEnvironmentException {
        List<String> missing = new ArrayList<>();
        for (String tool : List.of(settings.mdbTablesCommand(), settings.mdbExportCommand())) {
            if (!runner.isAvailable(tool)) {
                missing.add(tool);
            }
        }
        if (!missing.isEmpty()) {
            String message = "Required mdbtools are not installed. Please install mdbtools:\n"
                             + "  - macOS: brew install mdbtools\n"
                             + "  - Ubuntu/Debian: sudo apt-get install mdbtools\n"
                             + "  - Windows: install via WSL\n"
                             + "Missing tools: " + String.join(", ", missing);
            logger.log(Level.SEVERE, message);
            throw new ToolEnvironmentException(message, missing);
        }
    }

    @Override
    public boolean isMultiTable() {
        return true;
    }

    @Override
    public Map<String, Object> sourceMetadata() {
        return sourceMetadata;
    }

    @Override
    public List<Table> fetch() throws IngestException {
        markFetchStart();
        Path path = requireFile("path");
        String fileType = FileUtils.fileType(path);

        List<String> tableNames = listTables(path);
        if (tableNames.isEmpty()) {
            throw new SourceFormatException("No tables found in " + path);
        }
        logger.log(Level.INFO, "Fetching all tables: {0}", String.join(", ", tableNames));

        List<Table> tables = new ArrayList<>();
        for (String tableName : tableNames) {
            try {
                String csv = exportTable(path, tableName);
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put(TABLE_NAME, tableName);
                Table table = CsvTables.read(tableName, new StringReader(csv), fileType, metadata, logger);
                tables.add(table);
                logger.log(Level.INFO, "Fetched table ''{0}'': {1} rows, {2} columns",
                        new Object[]{tableName, table.rowCount(), table.columns().size()});
            } catch (IngestException | IOException e) {
                logger.log(Level.WARNING, "Failed to fetch table ''" + tableName + "'' from " + path + ": " + e.getMessage());
            }
        }
        if (tables.isEmpty()) {
            throw new SourceFormatException("None of the " + tableNames.size() + " tables in " + path + " could be exported");
        }

        Map<String, Object> fileMetadata = new LinkedHashMap<>();
        fileMetadata.put("file_path", path.toString());
        fileMetadata.put("file_type", fileType);
        fileMetadata.put("total_tables", tables.size());
        fileMetadata.put("table_names", tables.stream().map(Table::name).toList());
        this.sourceMetadata = Collections.unmodifiableMap(fileMetadata);
        return tables;
    }

    List<String> listTables(Path path) throws SourceFetchException {
        CommandResult result = invoke(List.of(tablesCommand, "-1", path.toString()), "Error getting tables from " + path);
        List<String> names = new ArrayList<>();
        for (String line : result.stdout().split("\\R")) {
            if (!line.isBlank()) names.add(line.strip());
        }
        return names;
    }

    // -B prints booleans as TRUE/FALSE; values stay quoted so embedded commas survive
    String exportTable(Path path, String tableName) throws SourceFetchException {
        return invoke(List.of(exportCommand, "-B", path.toString(), tableName),
                "Error exporting table " + tableName + " from " + path).stdout();
    }

    private CommandResult invoke(List<String> command, String failure) throws SourceFetchException {
        try {
            CommandResult result = runner.run(command, toolTimeout);
            if (!result.isSuccess()) {
                throw new SourceFetchException(failure + ": " + result.stderr().strip(), result.exitCode(), result.stderr());
            }
            return result;
        } catch (TimeoutException e) {
            throw new SourceFetchException(failure + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SourceFetchException(failure + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException(failure + ": interrupted", e);
        }
    }
}
