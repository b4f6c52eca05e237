package org.tabula.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-run counters. Owned by the orchestrating thread; not safe for concurrent mutation.
 */
public class ProcessingStats {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";
    public static final String NO_EXTENSION = "(none)";

    private int totalFiles;
    private int processedFiles;
    private int failedFiles;
    private int skippedFiles;
    private final Map<String, Integer> byType = new LinkedHashMap<>();
    private final Map<String, Integer> byStatus = new LinkedHashMap<>();

    public void incrementTotal(String fileType) {
        totalFiles++;
        byType.merge(fileType == null || fileType.isEmpty() ? NO_EXTENSION : fileType, 1, Integer::sum);
    }

    public void markProcessed() {
        processedFiles++;
        byStatus.merge(SUCCESS, 1, Integer::sum);
    }

    public void markFailed() {
        failedFiles++;
        byStatus.merge(FAILED, 1, Integer::sum);
    }

    public void markSkipped() {
        skippedFiles++;
        byStatus.merge(SKIPPED, 1, Integer::sum);
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getProcessedFiles() {
        return processedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public int getSkippedFiles() {
        return skippedFiles;
    }

    public Map<String, Integer> getByType() {
        return Collections.unmodifiableMap(byType);
    }

    public Map<String, Integer> getByStatus() {
        return Collections.unmodifiableMap(byStatus);
    }

    public void logSummary(Logger logger) {
        logger.log(Level.INFO, "Raw Layer Processing Summary:");
        logger.log(Level.INFO, "Total files found: {0}", totalFiles);
        logger.log(Level.INFO, "Successfully processed: {0}", processedFiles);
        logger.log(Level.INFO, "Failed to process: {0}", failedFiles);
        logger.log(Level.INFO, "Skipped (unsupported): {0}", skippedFiles);

        logger.log(Level.INFO, "File types processed:");
        byType.forEach((type, count) -> logger.log(Level.INFO, "  {0}: {1} files", new Object[]{type, count}));

        logger.log(Level.INFO, "Processing status:");
        byStatus.forEach((status, count) -> logger.log(Level.INFO, "  {0}: {1} files", new Object[]{status, count}));
    }
}
