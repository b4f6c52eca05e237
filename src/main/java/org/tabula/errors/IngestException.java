package org.tabula.errors;

/**
 * Root of the checked failures raised while reading, converting or writing a source.
 * Per-file instances are caught at the ingestion and storage boundaries; they never abort a run.
 */
public class IngestException extends Exception {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
