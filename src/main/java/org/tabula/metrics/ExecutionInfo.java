package org.tabula.metrics;

import org.tabula.model.ProcessedData;

import java.time.Duration;
import java.util.List;

/**
 * Result of one processor run.
 *
 * @param totalDuration wall time of the walk
 * @param results       files ingested and stored successfully, with their output paths
 * @param fileInfo      one ledger record per file seen, in walk order
 * @param stats         aggregate counters
 */
public record ExecutionInfo(Duration totalDuration, List<ProcessedData> results, List<FileInfo> fileInfo,
                            ProcessingStats stats) {
}
