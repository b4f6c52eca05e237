package org.tabula.processing;

import org.tabula.adapters.AdapterFactory;
import org.tabula.adapters.ProcessCommandRunner;
import org.tabula.adapters.XlsxAdapter;
import org.tabula.config.AppConfig;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceNotFoundException;
import org.tabula.model.ProcessedData;
import org.tabula.model.Table;
import org.tabula.util.FileUtils;
import org.tabula.util.NameSanitizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Persists ingested tables as spreadsheets under {@code <output>/raw}, mirroring the input tree.
 * Output names carry the original extension so {@code a.csv} and {@code a.json} never collide.
 */
public class RawDataStorage {

    public static final String RAW_DIR = "raw";
    static final String OUTPUT_EXTENSION = ".xlsx";

    private final Path rawDir;
    private final Path inputDir;
    private final AdapterFactory adapterFactory;
    private final Logger logger;

    public RawDataStorage(Path outputDir, Path inputDir, Logger logger) throws IOException {
        this(outputDir, inputDir, new AdapterFactory(AppConfig.defaults(), new ProcessCommandRunner(logger), logger), logger);
    }

    public RawDataStorage(Path outputDir, Path inputDir, AdapterFactory adapterFactory, Logger logger) throws IOException {
        this.rawDir = outputDir.resolve(RAW_DIR);
        this.inputDir = inputDir;
        this.adapterFactory = adapterFactory;
        this.logger = logger;
        Files.createDirectories(rawDir);
    }

    public Path getRawDir() {
        return rawDir;
    }

    /**
     * Computes, and creates the parent directories of, the output file for one table of {@code sourcePath}.
     *
     * @param tableName  set for multi-table sources, which fan out into a directory named after the file
     * @param headerData header-block lines of a spreadsheet, appended as a sanitized suffix
     */
    public Path computeOutputPath(Path sourcePath, String tableName, List<String> headerData) throws IOException {
        Path relative = FileUtils.relativeTo(sourcePath, inputDir);
        Path parent = relative.getParent() == null ? rawDir : rawDir.resolve(relative.getParent());
        String stem = FileUtils.stem(sourcePath);
        String ext = FileUtils.extension(sourcePath);

        Path target;
        if (tableName != null) {
            String fileName = stem + "_" + NameSanitizer.tableName(tableName) + "_" + ext + OUTPUT_EXTENSION;
            target = parent.resolve(stem).resolve(fileName);
        } else {
            String suffix = NameSanitizer.headerSuffix(headerData);
            String base = suffix.isEmpty() ? stem : stem + "_" + suffix;
            target = parent.resolve(base + "_" + ext + OUTPUT_EXTENSION);
        }
        Files.createDirectories(target.getParent());
        return target;
    }

    /**
     * @return the written files, or empty when any table could not be stored
     */
    public Optional<List<Path>> saveProcessedData(ProcessedData data) {
        try {
            List<Path> saved = new ArrayList<>();
            if (data.isMultiTable()) {
                Set<Path> used = new HashSet<>();
                for (Table table : data.tables()) {
                    Path output = uniqueOutputPath(data.sourcePath(), table.name(), used);
                    write(table, output);
                    saved.add(output);
                }
                logger.log(Level.INFO, "Saved {0} tables from {1}", new Object[]{saved.size(), data.sourcePath()});
            } else {
                if (data.tables().isEmpty()) {
                    logger.log(Level.WARNING, "No table to store for {0}", data.sourcePath());
                    return Optional.empty();
                }
                Table table = data.tables().get(0);
                Path output = computeOutputPath(data.sourcePath(), null, table.headerData());
                write(table, output);
                saved.add(output);
                logger.log(Level.INFO, "Saved raw data to {0}", output);
            }
            return Optional.of(List.copyOf(saved));
        } catch (IngestException | IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Error saving data from " + data.sourcePath() + ": " + e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Distinct table names may sanitize to the same file name ({@code Q1/Q2} and {@code Q1:Q2}); later tables of the
     * fan-out get a {@code _2}, {@code _3}, ... suffix so no table overwrites another.
     */
    Path uniqueOutputPath(Path sourcePath, String tableName, Set<Path> used) throws IOException {
        Path output = computeOutputPath(sourcePath, tableName, null);
        int n = 1;
        while (!used.add(output)) {
            n++;
            output = computeOutputPath(sourcePath, tableName + "_" + n, null);
        }
        if (n > 1) {
            logger.log(Level.WARNING, "Table name ''{0}'' clashes with another table of {1}, stored as {2}",
                    new Object[]{tableName, sourcePath, output.getFileName()});
        }
        return output;
    }

    private void write(Table table, Path output) throws IngestException {
        adapterFactory.createWriter(output.toString()).save(table, output);
    }

    /**
     * @param prefix substring the file name must contain; null matches every file
     */
    public List<Path> getStoredFiles(String prefix) throws IOException {
        if (!Files.isDirectory(rawDir)) return List.of();
        try (Stream<Path> paths = Files.walk(rawDir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> prefix == null || p.getFileName().toString().contains(prefix))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public List<Table> loadStoredData(Path filePath) throws IngestException {
        if (!Files.isRegularFile(filePath)) {
            throw new SourceNotFoundException(filePath);
        }
        XlsxAdapter reader = adapterFactory.createWriter(filePath.toString());
        return reader.fetch();
    }
}
