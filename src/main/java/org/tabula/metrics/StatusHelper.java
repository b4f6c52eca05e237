package org.tabula.metrics;

import org.tabula.model.ProcessedData;
import org.tabula.util.FileUtils;

import java.nio.file.Path;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Factory methods for {@link FileInfo} ledger records.
 */
public final class StatusHelper {

    private StatusHelper() {
    }

    public static FileInfo createPassedFileInfo(ProcessedData data, Instant start) {
        return new FileInfo(data.sourcePath().getFileName().toString(), data.sourcePath().toString(),
                FileUtils.fileType(data.sourcePath()), data.sourceType(), Status.PASS, data.tables().size(),
                data.outputPaths().size(), Timestamp.from(start), elapsed(start), "");
    }

    public static FileInfo createFailedFileInfo(Path path, String sourceType, Instant start, String message) {
        return new FileInfo(path.getFileName().toString(), path.toString(), FileUtils.fileType(path), sourceType,
                Status.FAIL, 0, 0, Timestamp.from(start), elapsed(start), message == null ? "" : message);
    }

    public static FileInfo createSkippedFileInfo(Path path, Instant start) {
        return new FileInfo(path.getFileName().toString(), path.toString(), FileUtils.fileType(path), "",
                Status.SKIP, 0, 0, Timestamp.from(start), elapsed(start), "Unsupported file format");
    }

    private static long elapsed(Instant start) {
        return Duration.between(start, Instant.now()).toMillis();
    }
}
