package org.tabula.metrics;

/**
 * Outcome of processing one input file.
 */
public enum Status {
    PASS, // ingested and stored
    FAIL, // ingestion, validation or storage failed
    SKIP  // extension not supported
}
