package org.tabula.processing;

import org.tabula.adapters.AdapterFactory;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.model.ProcessedData;
import org.tabula.model.Table;
import org.tabula.plugin.SourceAdapter;
import org.tabula.util.FileUtils;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes a file to the adapter for its extension and runs it. Per-file failures are logged and reported as empty.
 */
public class DataIngestion {

    /**
     * Extension (lower case, with dot) to source type.
     */
    public static final Map<String, String> SUPPORTED_FORMATS = Map.of(
            ".json", "json",
            ".csv", "csv",
            ".xlsx", "xlsx",
            ".xls", "xlsx",
            ".mdb", "mdb",
            ".accdb", "mdb");

    private final AdapterFactory adapterFactory;
    private final Logger logger;

    public DataIngestion(AdapterFactory adapterFactory, Logger logger) {
        this.adapterFactory = adapterFactory;
        this.logger = logger;
    }

    public static Optional<String> sourceTypeOf(Path path) {
        return Optional.ofNullable(SUPPORTED_FORMATS.get(FileUtils.fileType(path)));
    }

    public static boolean isSupported(Path path) {
        return sourceTypeOf(path).isPresent();
    }

    static String adapterTypeOf(String sourceType) {
        switch (sourceType) {
            case "xlsx":
                return "xlsx";
            case "mdb":
                return "mdb";
            default:
                return "file";
        }
    }

    /**
     * @throws ToolEnvironmentException when a source needs external tools that are not installed
     */
    public Optional<ProcessedData> processFile(Path filePath) throws ToolEnvironmentException {
        Optional<String> sourceType = sourceTypeOf(filePath);
        if (sourceType.isEmpty()) {
            logger.log(Level.WARNING, "Unsupported file format: {0}", filePath);
            return Optional.empty();
        }

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("path", filePath.toString());
        config.put("format", sourceType.get());

        try {
            SourceAdapter adapter = adapterFactory.create(adapterTypeOf(sourceType.get()), config);
            List<Table> tables = adapter.transform(adapter.fetch());
            return Optional.of(new ProcessedData(tables, filePath, sourceType.get(), adapter.isMultiTable(),
                    adapter.sourceMetadata()));
        } catch (ToolEnvironmentException e) {
            throw e;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Error processing file " + filePath + ": " + e.getMessage(), e);
            return Optional.empty();
        }
    }
}
