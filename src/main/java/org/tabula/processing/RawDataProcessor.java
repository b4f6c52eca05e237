package org.tabula.processing;

import org.tabula.adapters.AdapterFactory;
import org.tabula.adapters.CommandRunner;
import org.tabula.adapters.MdbAdapter;
import org.tabula.config.AppConfig;
import org.tabula.errors.IngestException;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.metrics.ExecutionInfo;
import org.tabula.metrics.FileInfo;
import org.tabula.metrics.ProcessingStats;
import org.tabula.metrics.StatusHelper;
import org.tabula.metrics.StatusWriter;
import org.tabula.model.ProcessedData;
import org.tabula.model.Table;
import org.tabula.util.FileUtils;
import org.tabula.validation.DataValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the input tree once, ingesting and storing every supported file. A failing file is tallied and the walk
 * continues; only a missing input directory or missing external tools end the run.
 */
public class RawDataProcessor {

    private final Path inputDir;
    private final Path outputDir;
    private final Logger logger;
    private final AppConfig settings;
    private final CommandRunner commandRunner;
    private final DataValidator validator;
    private final DataIngestion ingestion;
    private final RawDataStorage storage;

    /**
     * @param validator optional validation stage, null to store every ingested table unchecked
     */
    public RawDataProcessor(Path inputDir, Path outputDir, Logger logger, AppConfig settings,
                            CommandRunner commandRunner, DataValidator validator) throws IOException {
        this.inputDir = inputDir;
        this.outputDir = outputDir;
        this.logger = logger;
        this.settings = settings;
        this.commandRunner = commandRunner;
        this.validator = validator;
        AdapterFactory factory = new AdapterFactory(settings, commandRunner, logger);
        this.ingestion = new DataIngestion(factory, logger);
        this.storage = new RawDataStorage(outputDir, inputDir, factory, logger);
    }

    public ExecutionInfo process() throws IOException, ToolEnvironmentException {
        final Instant runStart = Instant.now();
        if (!Files.isDirectory(inputDir)) {
            throw new IOException("Input directory does not exist: " + inputDir);
        }
        logger.log(Level.INFO, "Starting raw data processing from {0}", inputDir);

        List<Path> files = FileUtils.findFiles(inputDir, null);
        preflight(files);

        ProcessingStats stats = new ProcessingStats();
        List<ProcessedData> results = new ArrayList<>();
        List<FileInfo> fileInfo = new ArrayList<>();

        for (Path file : files) {
            final Instant fileStart = Instant.now();
            stats.incrementTotal(FileUtils.fileType(file));
            Optional<String> sourceType = DataIngestion.sourceTypeOf(file);
            if (sourceType.isEmpty()) {
                logger.log(Level.WARNING, "Skipping unsupported file: {0}", file);
                stats.markSkipped();
                fileInfo.add(StatusHelper.createSkippedFileInfo(file, fileStart));
                continue;
            }

            logger.log(Level.INFO, "Processing file: {0}", file);
            Optional<ProcessedData> processed = ingestion.processFile(file);
            if (processed.isEmpty()) {
                stats.markFailed();
                fileInfo.add(StatusHelper.createFailedFileInfo(file, sourceType.get(), fileStart, "Ingestion failed"));
                continue;
            }

            List<String> errors = validate(processed.get());
            if (!errors.isEmpty()) {
                logger.log(Level.SEVERE, "Validation failed for {0}: {1}", new Object[]{file, errors});
                stats.markFailed();
                fileInfo.add(StatusHelper.createFailedFileInfo(file, sourceType.get(), fileStart, String.join("; ", errors)));
                continue;
            }

            Optional<List<Path>> saved = storage.saveProcessedData(processed.get());
            if (saved.isEmpty()) {
                stats.markFailed();
                fileInfo.add(StatusHelper.createFailedFileInfo(file, sourceType.get(), fileStart, "Storage failed"));
                continue;
            }

            ProcessedData stored = processed.get().withOutputPaths(saved.get());
            results.add(stored);
            stats.markProcessed();
            fileInfo.add(StatusHelper.createPassedFileInfo(stored, fileStart));
            logger.log(Level.INFO, "Successfully processed {0}", file);
        }

        stats.logSummary(logger);
        if (settings.isWriteStatusLedger()) {
            new StatusWriter(outputDir, logger).insertFileStatus(fileInfo);
        }
        Duration duration = Duration.between(runStart, Instant.now());
        logger.log(Level.INFO, "Raw data processing finished in {0} ms", duration.toMillis());
        return new ExecutionInfo(duration, List.copyOf(results), List.copyOf(fileInfo), stats);
    }

    // fail before any file work when the run needs tools that are not installed
    private void preflight(List<Path> files) throws ToolEnvironmentException {
        boolean needsMdbTools = files.stream()
                .anyMatch(f -> DataIngestion.sourceTypeOf(f).filter("mdb"::equals).isPresent());
        if (needsMdbTools) {
            MdbAdapter.checkTools(settings, commandRunner, logger);
        }
    }

    private List<String> validate(ProcessedData data) {
        if (validator == null) return List.of();
        List<String> errors = new ArrayList<>();
        for (Table table : data.tables()) {
            for (String error : validator.validateTable(table)) {
                errors.add(table.name() + ": " + error);
            }
        }
        return errors;
    }

    public List<Path> getStoredData(String prefix) throws IOException {
        return storage.getStoredFiles(prefix);
    }

    public List<Table> loadStoredData(Path filePath) throws IngestException {
        return storage.loadStoredData(filePath);
    }
}
