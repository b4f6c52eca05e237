package org.tabula.config;

/**
 * Run-wide settings, bound from YAML by {@link ConfigManager}. Absent keys fall back to the defaults below.
 */
public record AppConfig(Integer toolTimeoutSeconds, Integer httpTimeoutSeconds, String mdbTablesCommand,
                        String mdbExportCommand, Boolean writeStatusLedger) {

    public static final int DEFAULT_TOOL_TIMEOUT_SECONDS = 120;
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;

    public AppConfig {
        if (toolTimeoutSeconds == null || toolTimeoutSeconds <= 0) toolTimeoutSeconds = DEFAULT_TOOL_TIMEOUT_SECONDS;
        if (httpTimeoutSeconds == null || httpTimeoutSeconds <= 0) httpTimeoutSeconds = DEFAULT_HTTP_TIMEOUT_SECONDS;
        if (mdbTablesCommand == null || mdbTablesCommand.isBlank()) mdbTablesCommand = "mdb-tables";
        if (mdbExportCommand == null || mdbExportCommand.isBlank()) mdbExportCommand = "mdb-export";
        if (writeStatusLedger == null) writeStatusLedger = true;
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null);
    }

    public boolean isWriteStatusLedger() {
        return writeStatusLedger != null && writeStatusLedger;
    }
}
