package org.tabula.processing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tabula.adapters.AdapterFactory;
import org.tabula.adapters.CommandResult;
import org.tabula.adapters.CommandRunner;
import org.tabula.config.AppConfig;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.model.ProcessedData;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataIngestionTest {

    private static final Logger LOGGER = Logger.getLogger(DataIngestionTest.class.getName());

    @Mock
    private CommandRunner runner;

    @TempDir
    Path tempDir;

    private DataIngestion ingestion;

    @BeforeEach
    void setUp() {
        ingestion = new DataIngestion(new AdapterFactory(AppConfig.defaults(), runner, LOGGER), LOGGER);
    }

    @Test
    void testSourceTypeOf_caseInsensitiveClosedTable() {
        assertEquals(Optional.of("xlsx"), DataIngestion.sourceTypeOf(Path.of("Budget.XLS")));
        assertEquals(Optional.of("mdb"), DataIngestion.sourceTypeOf(Path.of("legacy.accdb")));
        assertEquals(Optional.of("csv"), DataIngestion.sourceTypeOf(Path.of("a.Csv")));
        assertTrue(DataIngestion.sourceTypeOf(Path.of("notes.txt")).isEmpty());
        assertFalse(DataIngestion.isSupported(Path.of("Makefile")));
    }

    @Test
    void testAdapterTypeOf() {
        assertEquals("file", DataIngestion.adapterTypeOf("json"));
        assertEquals("file", DataIngestion.adapterTypeOf("csv"));
        assertEquals("xlsx", DataIngestion.adapterTypeOf("xlsx"));
        assertEquals("mdb", DataIngestion.adapterTypeOf("mdb"));
    }

    @Test
    void testProcessFile_csv() throws Exception {
        Path csv = tempDir.resolve("a.csv");
        Files.writeString(csv, "x,y\n1,2\n");

        ProcessedData data = ingestion.processFile(csv).orElseThrow();

        assertEquals("csv", data.sourceType());
        assertEquals(csv, data.sourcePath());
        assertFalse(data.isMultiTable());
        assertEquals(1, data.tables().size());
        assertEquals("FileAdapter", data.tables().get(0).metadata().get("source"));
        assertTrue(data.outputPaths().isEmpty());
    }

    @Test
    void testProcessFile_unsupportedAndBrokenAreEmpty() throws Exception {
        Path txt = tempDir.resolve("notes.txt");
        Files.writeString(txt, "hello");
        Path json = tempDir.resolve("broken.json");
        Files.writeString(json, "[{");

        assertTrue(ingestion.processFile(txt).isEmpty());
        assertTrue(ingestion.processFile(json).isEmpty());
        assertTrue(ingestion.processFile(tempDir.resolve("gone.csv")).isEmpty());
    }

    @Test
    void testProcessFile_mdbFansOut() throws Exception {
        Path mdb = Files.createFile(tempDir.resolve("db1.mdb"));
        when(runner.isAvailable(anyString())).thenReturn(true);
        when(runner.run(argThat(cmd -> cmd != null && cmd.get(0).equals("mdb-tables")), any(Duration.class)))
                .thenReturn(new CommandResult(0, "A\nB\n", ""));
        when(runner.run(argThat(cmd -> cmd != null && cmd.get(0).equals("mdb-export")), any(Duration.class)))
                .thenReturn(new CommandResult(0, "k\n1\n", ""));

        ProcessedData data = ingestion.processFile(mdb).orElseThrow();

        assertTrue(data.isMultiTable());
        assertEquals("mdb", data.sourceType());
        assertEquals(List.of("A", "B"), data.sourceMetadata().get("table_names"));
    }

    @Test
    void testProcessFile_missingToolsPropagate() throws Exception {
        Path mdb = Files.createFile(tempDir.resolve("db1.mdb"));
        when(runner.isAvailable(anyString())).thenReturn(false);

        assertThrows(ToolEnvironmentException.class, () -> ingestion.processFile(mdb));
    }
}
