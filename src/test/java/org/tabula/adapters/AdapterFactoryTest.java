package org.tabula.adapters;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tabula.config.AppConfig;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.plugin.SourceAdapter;

import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdapterFactoryTest {

    private static final Logger LOGGER = Logger.getLogger(AdapterFactoryTest.class.getName());

    @Mock
    private CommandRunner runner;

    private AdapterFactory factory(AppConfig settings) {
        return new AdapterFactory(settings, runner, LOGGER);
    }

    @Test
    void testCreate_eachTag() throws IngestException {
        AdapterFactory factory = factory(AppConfig.defaults());

        assertInstanceOf(FileAdapter.class, factory.create("file", Map.of("path", "a.csv", "format", "csv")));
        assertInstanceOf(XlsxAdapter.class, factory.create("XLSX", Map.of("path", "a.xlsx")));
        assertInstanceOf(RestAdapter.class, factory.create("rest", Map.of("url", "http://localhost/x", "method", "GET")));
        assertInstanceOf(DatabaseAdapter.class,
                factory.create("database", Map.of("connection_string", "jdbc:h2:mem:x", "query", "select 1")));
    }

    @Test
    void testCreate_unknownTag() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> factory(AppConfig.defaults()).create("ftp", Map.of()));
        assertEquals("Unsupported source type: ftp", e.getMessage());
    }

    @Test
    void testCreate_invalidConfigSurfacesImmediately() {
        assertThrows(ConfigException.class, () -> factory(AppConfig.defaults()).create("xlsx", Map.of()));
    }

    @Test
    void testCreate_restTimeoutFromSettings() throws IngestException {
        SourceAdapter adapter = factory(new AppConfig(null, 9, null, null, null))
                .create("rest", Map.of("url", "http://localhost/x", "method", "GET"));

        assertEquals(9, ((RestAdapter) adapter).getConfig().getInt("timeout", 0));
    }

    @Test
    void testCreate_mdbChecksTools() {
        when(runner.isAvailable(anyString())).thenReturn(false);

        assertThrows(ToolEnvironmentException.class,
                () -> factory(AppConfig.defaults()).create("mdb", Map.of("path", "x.mdb")));
    }

    @Test
    void testDatabaseAdapter_fetchNotImplemented() throws IngestException {
        SourceAdapter adapter = factory(AppConfig.defaults())
                .create("database", Map.of("connection_string", "jdbc:h2:mem:x", "query", "select 1"));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class, adapter::fetch);
        assertEquals("Database adapter not implemented", e.getMessage());
    }

    @Test
    void testSourceKind_fromTag() {
        assertEquals(SourceKind.MDB, SourceKind.fromTag(" Mdb ").orElseThrow());
        assertTrue(SourceKind.fromTag(null).isEmpty());
        assertTrue(SourceKind.fromTag("ftp").isEmpty());
    }
}
