package org.tabula.adapters;

import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.model.Table;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Placeholder for relational database sources. Configuration is validated so callers can wire it,
 * but fetching is not implemented.
 */
public class DatabaseAdapter extends AbstractSourceAdapter {

    static final ConfigSchema SCHEMA = ConfigSchema.forAdapter("DatabaseAdapter")
            .require("connection_string", "query")
            .build();

    public DatabaseAdapter(Map<String, ?> config, Logger logger) throws ConfigException {
        super(config, SCHEMA, logger);
    }

    @Override
    public List<Table> fetch() {
        throw new UnsupportedOperationException("Database adapter not implemented");
    }
}
