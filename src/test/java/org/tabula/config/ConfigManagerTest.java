package org.tabula.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    private static final Logger LOGGER = Logger.getLogger(ConfigManagerTest.class.getName());

    @TempDir
    Path tempDir;

    @Test
    void testGetConfig_readsYamlAndDefaultsTheRest() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "toolTimeoutSeconds: 5\nmdbExportCommand: /opt/mdb/bin/mdb-export\nunknownKey: 1\n");

        AppConfig config = ConfigManager.getConfig(file, LOGGER);

        assertEquals(5, config.toolTimeoutSeconds());
        assertEquals("/opt/mdb/bin/mdb-export", config.mdbExportCommand());
        assertEquals("mdb-tables", config.mdbTablesCommand());
        assertEquals(AppConfig.DEFAULT_HTTP_TIMEOUT_SECONDS, config.httpTimeoutSeconds());
        assertTrue(config.isWriteStatusLedger());
    }

    @Test
    void testGetConfig_missingFileUsesBundledDefaults() throws IOException {
        AppConfig config = ConfigManager.getConfig(tempDir.resolve("absent.yaml"), LOGGER);

        assertEquals(AppConfig.defaults(), config);
    }

    @Test
    void testGetConfig_emptyFileUsesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertEquals(AppConfig.defaults(), ConfigManager.getConfig(file, LOGGER));
    }

    @Test
    void testAppConfig_nonPositiveTimeoutsFallBack() {
        AppConfig config = new AppConfig(0, -3, " ", null, false);

        assertEquals(AppConfig.DEFAULT_TOOL_TIMEOUT_SECONDS, config.toolTimeoutSeconds());
        assertEquals(AppConfig.DEFAULT_HTTP_TIMEOUT_SECONDS, config.httpTimeoutSeconds());
        assertEquals("mdb-tables", config.mdbTablesCommand());
        assertFalse(config.isWriteStatusLedger());
    }
}
