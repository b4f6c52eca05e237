package org.tabula.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads {@link AppConfig} from YAML and installs the console logging setup shared by the CLI.
 */
public final class ConfigManager {

    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    static final String DEFAULTS_RESOURCE = "/tabula-defaults.yaml";
    static final String LOG_FORMAT = "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static volatile boolean loggingConfigured;

    private ConfigManager() {
    }

    /**
     * Reads settings from {@code configPath}; when that file is absent the bundled defaults resource is used,
     * and when that is absent too the record defaults apply.
     */
    public static AppConfig getConfig(final Path configPath, final Logger logger) throws IOException {
        if (configPath != null && Files.isRegularFile(configPath)) {
            logger.log(Level.CONFIG, "Loading settings from {0}", configPath);
            try (InputStream in = Files.newInputStream(configPath)) {
                return bind(in);
            }
        }
        try (InputStream in = ConfigManager.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.log(Level.CONFIG, "No settings file found, using built-in defaults");
                return AppConfig.defaults();
            }
            return bind(in);
        }
    }

    // an empty YAML document parses to a missing or null node
    private static AppConfig bind(final InputStream in) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(in);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return AppConfig.defaults();
        }
        return YAML_MAPPER.treeToValue(root, AppConfig.class);
    }

    public static synchronized void configureLogging(final Level level) {
        if (loggingConfigured) return;
        System.setProperty("java.util.logging.SimpleFormatter.format", LOG_FORMAT);
        Logger rootLogger = Logger.getLogger("");
        for (Handler existing : rootLogger.getHandlers()) {
            rootLogger.removeHandler(existing);
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(level);
        loggingConfigured = true;
    }
}
