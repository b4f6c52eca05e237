package org.tabula.errors;

/**
 * Content exists but cannot be read under its declared format, or a multi-table source exposes no tables.
 */
public class SourceFormatException extends IngestException {

    public SourceFormatException(String message) {
        super(message);
    }

    public SourceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
