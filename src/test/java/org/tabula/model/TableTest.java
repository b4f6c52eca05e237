package org.tabula.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    @Test
    void testConstruction_setsCountMetadata() {
        Table table = new Table("people", List.of("id", "name"),
                List.of(List.of(1L, "Ann"), List.of(2L, "Bob")), ".csv");

        assertEquals(2, table.rowCount());
        assertEquals(2, table.metadata().get(Table.ROW_COUNT));
        assertEquals(2, table.metadata().get(Table.COLUMN_COUNT));
        assertEquals(".csv", table.metadata().get(Table.FILE_TYPE));
    }

    @Test
    void testConstruction_rejectsWrongArity() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Table("t", List.of("a", "b"), List.of(List.of("only one")), ".csv"));
        assertTrue(e.getMessage().contains("expected 2"), "Message should name the expected arity.");
    }

    @Test
    void testExtraMetadata_cannotOverrideCounts() {
        Table table = new Table("t", List.of("a"), List.of(List.of("x")), ".xlsx",
                Map.of(Table.ROW_COUNT, 99, "sheet_name", "Data"));

        assertEquals(1, table.metadata().get(Table.ROW_COUNT));
        assertEquals("Data", table.metadata().get("sheet_name"));
    }

    @Test
    void testRecordsAreFrozen_metadataIsNot() {
        List<Object> row = new ArrayList<>(Arrays.asList("x", null));
        Table table = new Table("t", List.of("a", "b"), List.of(row), ".csv");
        row.set(0, "changed");

        assertEquals("x", table.records().get(0).get(0), "Table should hold a copy of each record.");
        assertThrows(UnsupportedOperationException.class, () -> table.records().get(0).set(0, "y"));
        table.metadata().put("source", "FileAdapter");
        assertEquals("FileAdapter", table.metadata().get("source"));
    }

    @Test
    void testAsDicts_zipsColumnsWithValues() {
        Table table = new Table("t", List.of("id", "name"), List.of(Arrays.asList(1L, null)), ".json");

        List<Map<String, Object>> rows = table.asDicts();
        assertEquals(1, rows.size());
        assertEquals(1L, rows.get(0).get("id"));
        assertTrue(rows.get(0).containsKey("name"));
        assertNull(rows.get(0).get("name"));
    }

    @Test
    void testHeaderData_nonTextLinesReadAsText() {
        Table table = new Table("t", List.of("a"), List.of(), ".xlsx",
                Map.of("header_data", Arrays.asList("Report", 2024, null)));

        assertEquals(List.of("Report", "2024", ""), table.headerData());
        assertTrue(new Table("t", List.of("a"), List.of(), ".xlsx", Map.of("header_data", "oops")).headerData().isEmpty());
    }

    @Test
    void testHeaderData_emptyWhenAbsent() {
        Table plain = new Table("t", List.of("a"), List.of(), ".csv");
        Table withHeader = new Table("t", List.of("a"), List.of(), ".xlsx",
                Map.of("header_data", List.of("Report", "Q1")));

        assertTrue(plain.headerData().isEmpty());
        assertEquals(List.of("Report", "Q1"), withHeader.headerData());
    }
}
