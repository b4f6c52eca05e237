package org.tabula.errors;

import java.util.List;

/**
 * Required external command line tools are not installed on the host.
 * Raised eagerly, before any file is touched, and fatal to the whole run.
 */
public class ToolEnvironmentException extends IngestException {

    private final List<String> missingTools;

    public ToolEnvironmentException(String message, List<String> missingTools) {
        super(message);
        this.missingTools = List.copyOf(missingTools);
    }

    public List<String> getMissingTools() {
        return missingTools;
    }
}
