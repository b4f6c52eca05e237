package org.tabula.metrics;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the per-file outcome ledger ({@code file_info.csv}) next to the run's output tree.
 */
public class StatusWriter {

    public static final String FILE_INFO_TABLE = "file_info.csv";
    static final String[] HEADER = {"file_name", "source_path", "file_type", "source_type", "status", "table_count",
            "output_count", "start_ts", "duration_ms", "message"};
    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final Path statusPath;
    private final Logger logger;

    public StatusWriter(Path statusDir, Logger logger) throws IOException {
        this.logger = logger;
        Files.createDirectories(statusDir);
        this.statusPath = statusDir.resolve(FILE_INFO_TABLE);
    }

    public Path insertFileStatus(List<FileInfo> fileStatus) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        try (BufferedWriter writer = Files.newBufferedWriter(statusPath, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (FileInfo p : fileStatus) {
                printer.printRecord(p.fileName(), p.sourcePath(), p.fileType(), p.sourceType(), p.status(),
                        p.tableCount(), p.outputCount(), p.startTs().toLocalDateTime().format(TS_FORMAT),
                        p.durationMillis(), p.message());
            }
        }
        logger.log(Level.INFO, "Wrote {0} file status records to {1}", new Object[]{fileStatus.size(), statusPath});
        return statusPath;
    }
}
