package org.tabula.adapters;

import org.tabula.config.AppConfig;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.plugin.SourceAdapter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps an adapter tag to its variant. Construction validates the configuration, so a returned adapter is usable.
 * This is the single place a new source variant is registered.
 */
public class AdapterFactory {

    private final AppConfig settings;
    private final CommandRunner commandRunner;
    private final Logger logger;

    public AdapterFactory(AppConfig settings, CommandRunner commandRunner, Logger logger) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @throws ConfigException                             for an unknown tag or an invalid configuration
     * @throws org.tabula.errors.ToolEnvironmentException if the variant's external tools are missing
     */
    public SourceAdapter create(String sourceType, Map<String, ?> config) throws IngestException {
        SourceKind kind = SourceKind.fromTag(sourceType)
                .orElseThrow(() -> new ConfigException("Unsupported source type: " + sourceType));
        switch (kind) {
            case REST:
                return new RestAdapter(withDefaultTimeout(config), logger);
            case FILE:
                return new FileAdapter(config, logger);
            case DATABASE:
                return new DatabaseAdapter(config, logger);
            case XLSX:
                return new XlsxAdapter(config, logger);
            case MDB:
                return new MdbAdapter(config, settings, commandRunner, logger);
            default:
                throw new ConfigException("Unsupported source type: " + sourceType);
        }
    }

    /**
     * Spreadsheet writer used by storage to persist tables.
     */
    public XlsxAdapter createWriter(String outputPath) throws ConfigException {
        return new XlsxAdapter(Map.of("path", outputPath), logger);
    }

    private Map<String, ?> withDefaultTimeout(Map<String, ?> config) {
        if (config == null || config.containsKey("timeout")) return config;
        Map<String, Object> copy = new LinkedHashMap<>(config);
        copy.put("timeout", settings.httpTimeoutSeconds());
        return copy;
    }
}
