package org.tabula.errors;

import java.nio.file.Path;

public class SourceNotFoundException extends IngestException {

    public SourceNotFoundException(Path path) {
        super("File not found: " + path);
    }

    public SourceNotFoundException(String message) {
        super(message);
    }
}
