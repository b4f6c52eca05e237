package org.tabula.metrics;

import java.sql.Timestamp;

public record FileInfo(String fileName, String sourcePath, String fileType, String sourceType, Status status,
                       int tableCount, int outputCount, Timestamp startTs, long durationMillis, String message) {
}
