package org.tabula.adapters;

import org.tabula.config.AdapterConfig;
import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.errors.SourceNotFoundException;
import org.tabula.model.Table;
import org.tabula.plugin.SourceAdapter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Shared plumbing for adapters: schema validation at construction, fetch-time bookkeeping and provenance stamping.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";

    protected final AdapterConfig config;
    protected final Logger logger;
    private Instant fetchTime;

    protected AbstractSourceAdapter(Map<String, ?> config, ConfigSchema schema, Logger logger) throws ConfigException {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.config = new AdapterConfig(config, schema);
        schema.validate(this.config);
    }

    public AdapterConfig getConfig() {
        return config;
    }

    /**
     * Records the fetch start so that {@link #transform(List)} stamps a stable timestamp.
     */
    protected void markFetchStart() {
        this.fetchTime = Instant.now();
    }

    @Override
    public List<Table> transform(final List<Table> tables) {
        if (fetchTime == null) {
            fetchTime = Instant.now();
        }
        String stamp = fetchTime.toString();
        for (Table table : tables) {
            table.metadata().put(SOURCE, getClass().getSimpleName());
            table.metadata().put(TIMESTAMP, stamp);
        }
        return tables;
    }

    protected Path requireFile(final String key) throws SourceNotFoundException {
        Path path = Path.of(config.getString(key));
        if (!Files.exists(path)) {
            throw new SourceNotFoundException(path);
        }
        return path;
    }
}
