package org.tabula.adapters;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceFormatException;
import org.tabula.errors.WriteException;
import org.tabula.model.Table;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class XlsxAdapterTest {

    private static final Logger LOGGER = Logger.getLogger(XlsxAdapterTest.class.getName());

    @TempDir
    Path tempDir;

    private static void write(Workbook workbook, Path path) throws IOException {
        try (workbook; OutputStream out = Files.newOutputStream(path)) {
            workbook.write(out);
        }
    }

    private static XlsxAdapter adapter(Path path) throws ConfigException {
        return new XlsxAdapter(Map.of("path", path.toString()), LOGGER);
    }

    @Test
    void testFetch_detectsHeaderBlockAboveTable() throws IOException, IngestException {
        Path file = tempDir.resolve("report.xlsx");
        Workbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Summary");
        sheet.createRow(0).createCell(1).setCellValue("Report: Q1/2024");
        sheet.createRow(1).createCell(1).setCellValue("Region North");
        Row header = sheet.createRow(2);
        header.createCell(0).setCellValue("id");
        header.createCell(1).setCellValue("name");
        header.createCell(2).setCellValue("amount");
        Row first = sheet.createRow(3);
        first.createCell(0).setCellValue(1);
        first.createCell(1).setCellValue("Ann");
        first.createCell(2).setCellValue(10.5);
        Row second = sheet.createRow(5);
        second.createCell(0).setCellValue(2);
        second.createCell(1).setCellValue("Bob");
        write(workbook, file);

        Table table = adapter(file).fetch().get(0);

        assertEquals("Summary", table.name());
        assertEquals(List.of("id", "name", "amount"), table.columns());
        assertEquals(2, table.rowCount(), "Blank rows should be dropped.");
        assertEquals(List.of(1L, "Ann", 10.5), table.records().get(0));
        assertEquals(Arrays.asList(2L, "Bob", null), table.records().get(1));
        assertEquals(2, table.metadata().get(XlsxAdapter.TABLE_START_ROW));
        assertEquals(List.of("Report: Q1/2024", "Region North"), table.headerData());
        assertEquals(XlsxAdapter.ENGINE_XSSF, table.metadata().get(XlsxAdapter.ENGINE_USED));
        assertEquals(".xlsx", table.metadata().get(Table.FILE_TYPE));
    }

    @Test
    void testFetch_withoutPreamble() throws IOException, IngestException {
        Path file = tempDir.resolve("plain.xlsx");
        Workbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Data");
        sheet.createRow(0).createCell(0).setCellValue("code");
        sheet.createRow(1).createCell(0).setCellValue("A1");
        write(workbook, file);

        Table table = adapter(file).fetch().get(0);

        assertEquals(0, table.metadata().get(XlsxAdapter.TABLE_START_ROW));
        assertTrue(table.headerData().isEmpty());
        assertEquals(List.of(List.of("A1")), table.records());
    }

    @Test
    void testFetch_blankHeaderCellsGetPositionalNames() throws IOException, IngestException {
        Path file = tempDir.resolve("gaps.xlsx");
        Workbook workbook = new XSSFWorkbook();
        Row header = workbook.createSheet("S").createRow(0);
        header.createCell(0).setCellValue("a");
        header.createCell(2).setCellValue("c");
        write(workbook, file);

        Table table = adapter(file).fetch().get(0);

        assertEquals(List.of("a", "column_2", "c"), table.columns());
        assertEquals(0, table.rowCount());
    }

    @Test
    void testFetch_selectsSheetByName() throws IOException, IngestException {
        Path file = tempDir.resolve("multi.xlsx");
        Workbook workbook = new XSSFWorkbook();
        workbook.createSheet("First").createRow(0).createCell(0).setCellValue("one");
        workbook.createSheet("Second").createRow(0).createCell(0).setCellValue("two");
        write(workbook, file);

        Table table = new XlsxAdapter(Map.of("path", file.toString(), "sheet_name", "Second"), LOGGER).fetch().get(0);
        assertEquals(List.of("two"), table.columns());

        XlsxAdapter missing = new XlsxAdapter(Map.of("path", file.toString(), "sheet_name", "Third"), LOGGER);
        assertThrows(SourceFormatException.class, missing::fetch);
    }

    @Test
    void testFetch_corruptFile() throws IOException, ConfigException {
        Path file = tempDir.resolve("fake.xlsx");
        Files.writeString(file, "not a workbook");

        assertThrows(SourceFormatException.class, () -> adapter(file).fetch());
    }

    @Test
    void testSave_thenFetchPreservesValues() throws IngestException {
        Path out = tempDir.resolve("nested/out.xlsx");
        LocalDateTime when = LocalDateTime.of(2024, 3, 1, 12, 30, 0);
        Table table = new Table("orders", List.of("id", "placed", "paid", "note"),
                List.of(Arrays.asList(7L, when, true, null), Arrays.asList(8L, when, false, "late")), ".csv");

        XlsxAdapter writer = adapter(out);
        writer.save(table, out);
        Table loaded = writer.fetch().get(0);

        assertEquals("orders", loaded.name());
        assertEquals(table.columns(), loaded.columns());
        assertEquals(Arrays.asList(7L, when, true, null), loaded.records().get(0));
        assertEquals(Arrays.asList(8L, when, false, "late"), loaded.records().get(1));
    }

    @Test
    void testSave_legacyXlsFormat() throws IOException, IngestException {
        Path out = tempDir.resolve("legacy.xls");
        Table table = new Table("t", List.of("k", "v"), List.of(List.of("a", 1.5)), ".json");

        adapter(out).save(table, out);

        try (Workbook workbook = new HSSFWorkbook(Files.newInputStream(out))) {
            assertEquals("k", workbook.getSheetAt(0).getRow(0).getCell(0).getStringCellValue());
        }
        assertEquals(XlsxAdapter.ENGINE_HSSF, adapter(out).fetch().get(0).metadata().get(XlsxAdapter.ENGINE_USED));
    }

    @Test
    void testSave_rejectsNonExcelExtension() throws ConfigException {
        Path out = tempDir.resolve("out.csv");
        Table table = new Table("t", List.of("a"), List.of(), ".csv");

        assertThrows(WriteException.class, () -> adapter(out).save(table, out));
        assertFalse(Files.exists(out));
    }
}
