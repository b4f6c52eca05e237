package org.tabula.adapters;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.tabula.config.ConfigSchema;
import org.tabula.errors.ConfigException;
import org.tabula.errors.IngestException;
import org.tabula.errors.SourceFormatException;
import org.tabula.errors.WriteException;
import org.tabula.model.Table;
import org.tabula.plugin.TableWriter;
import org.tabula.util.FileUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapter for Excel workbooks. Reads one sheet into one table, recovering a free-text preamble stacked above the
 * real table, and writes tables back as single-sheet workbooks.
 */
public class XlsxAdapter extends AbstractSourceAdapter implements TableWriter {

    public static final String ENGINE_XSSF = "xssf";
    public static final String ENGINE_HSSF = "hssf";

    public static final String SHEET_NAME = "sheet_name";
    public static final String ENGINE_USED = "engine_used";
    public static final String TABLE_START_ROW = "table_start_row";
    public static final String HEADER_DATA = "header_data";

    static final ConfigSchema SCHEMA = ConfigSchema.forAdapter("XlsxAdapter")
            .require("path")
            .optional(SHEET_NAME, 0)
            .build();

    public XlsxAdapter(Map<String, ?> config, Logger logger) throws ConfigException {
        super(config, SCHEMA, logger);
    }

    /**
     * @return the POI engine for an Excel extension, or null when the extension is not an Excel one
     */
    static String engineFor(Path path) {
        switch (FileUtils.extension(path)) {
            case "xlsx":
                return ENGINE_XSSF;
            case "xls":
                return ENGINE_HSSF;
            default:
                return null;
        }
    }

    @Override
    public List<Table> fetch() throws IngestException {
        markFetchStart();
        Path path = requireFile("path");
        String engine = engineFor(path);
        if (engine == null) {
            throw new SourceFormatException("Unsupported Excel file extension: " + FileUtils.fileType(path));
        }

        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = resolveSheet(workbook, path);
            List<List<Object>> grid = readGrid(sheet);
            HeaderBlock block = detectHeaderBlock(grid);
            if (!block.headerData().isEmpty()) {
                logger.log(Level.INFO, "Found header block in {0}: {1}", new Object[]{path.getFileName(), block.headerData()});
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(SHEET_NAME, sheet.getSheetName());
            metadata.put(ENGINE_USED, engine);
            metadata.put(TABLE_START_ROW, block.tableStartRow());
            metadata.put(HEADER_DATA, block.headerData());

            Table table = buildTable(sheet.getSheetName(), grid, block.tableStartRow(), FileUtils.fileType(path), metadata);
            logger.log(Level.FINE, "Read sheet {0} of {1}: {2} rows, {3} columns",
                    new Object[]{sheet.getSheetName(), path, table.rowCount(), table.columns().size()});
            return List.of(table);
        } catch (IOException e) {
            throw new SourceFormatException("Error reading Excel file " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI reports corrupt or mislabelled files through unchecked exceptions
            throw new SourceFormatException("Error reading Excel file " + path + ": " + e.getMessage(), e);
        }
    }

    private Sheet resolveSheet(Workbook workbook, Path path) throws SourceFormatException {
        Object wanted = config.get(SHEET_NAME);
        Sheet sheet = null;
        if (wanted instanceof Number index) {
            if (index.intValue() >= 0 && index.intValue() < workbook.getNumberOfSheets()) {
                sheet = workbook.getSheetAt(index.intValue());
            }
        } else if (wanted != null) {
            sheet = workbook.getSheet(wanted.toString());
        }
        if (sheet == null) {
            throw new SourceFormatException("Sheet not found: " + wanted + " in " + path);
        }
        return sheet;
    }

    static List<List<Object>> readGrid(Sheet sheet) {
        List<List<Object>> grid = new ArrayList<>();
        int lastRow = sheet.getLastRowNum();
        for (int r = 0; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            List<Object> values = new ArrayList<>();
            if (row != null) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    values.add(cellValue(row.getCell(c)));
                }
            }
            while (!values.isEmpty() && isEmpty(values.get(values.size() - 1))) {
                values.remove(values.size() - 1);
            }
            grid.add(values);
        }
        return grid;
    }

    static Object cellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isBlank() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double number = cell.getNumericCellValue();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static Object cell(List<List<Object>> grid, int row, int col) {
        List<Object> values = grid.get(row);
        return col < values.size() ? values.get(col) : null;
    }

    static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Detects a preamble such as a report title sitting in column B above the table: while column A is empty and
     * column B is not, column B text is collected; the first row breaking the pattern is where the table starts.
     */
    static HeaderBlock detectHeaderBlock(List<List<Object>> grid) {
        List<String> headerData = new ArrayList<>();
        if (grid.isEmpty() || !isEmpty(cell(grid, 0, 0)) || isEmpty(cell(grid, 0, 1))) {
            return new HeaderBlock(0, headerData);
        }
        int row = 0;
        while (row < grid.size() && isEmpty(cell(grid, row, 0)) && !isEmpty(cell(grid, row, 1))) {
            headerData.add(text(cell(grid, row, 1)));
            row++;
        }
        return new HeaderBlock(row, headerData);
    }

    /**
     * From {@code startRow}: the first row filled across the whole width becomes the column header (falling back to
     * the first non-blank row), blank rows are dropped and every later row becomes a record.
     */
    static Table buildTable(String name, List<List<Object>> grid, int startRow, String fileType,
                            Map<String, Object> metadata) {
        int width = 0;
        for (int r = startRow; r < grid.size(); r++) {
            width = Math.max(width, grid.get(r).size());
        }

        int headerRow = -1;
        int firstNonBlank = -1;
        for (int r = startRow; r < grid.size(); r++) {
            if (grid.get(r).isEmpty()) continue;
            if (firstNonBlank < 0) firstNonBlank = r;
            if (isFilled(grid.get(r), width)) {
                headerRow = r;
                break;
            }
        }
        if (headerRow < 0) headerRow = firstNonBlank;
        if (headerRow < 0) {
            return new Table(name, List.of(), List.of(), fileType, metadata);
        }

        List<String> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Object value = cell(grid, headerRow, c);
            columns.add(isEmpty(value) ? "column_" + (c + 1) : text(value));
        }

        List<List<Object>> records = new ArrayList<>();
        for (int r = headerRow + 1; r < grid.size(); r++) {
            if (grid.get(r).isEmpty()) continue;
            List<Object> record = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                record.add(cell(grid, r, c));
            }
            records.add(record);
        }
        return new Table(name, columns, records, fileType, metadata);
    }

    private static boolean isFilled(List<Object> row, int width) {
        if (row.size() < width) return false;
        for (int c = 0; c < width; c++) {
            if (isEmpty(row.get(c))) return false;
        }
        return true;
    }

    @Override
    public void save(final Table table, final Path outputPath) throws WriteException {
        String engine = engineFor(outputPath);
        if (engine == null) {
            throw new WriteException("Unsupported Excel file extension: " + FileUtils.fileType(outputPath));
        }
        try {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            try (Workbook workbook = ENGINE_XSSF.equals(engine) ? new XSSFWorkbook() : new HSSFWorkbook()) {
                checkLimits(table, workbook.getSpreadsheetVersion(), outputPath);
                writeSheet(workbook, table);
                try (OutputStream out = Files.newOutputStream(outputPath)) {
                    workbook.write(out);
                }
            }
            logger.log(Level.INFO, "Data saved to Excel file: {0} (using engine: {1})", new Object[]{outputPath, engine});
        } catch (IOException | IllegalArgumentException e) {
            throw new WriteException("Error saving Excel file " + outputPath + ": " + e.getMessage(), e);
        }
    }

    private static void checkLimits(Table table, SpreadsheetVersion version, Path outputPath) throws WriteException {
        if (table.rowCount() + 1 > version.getMaxRows() || table.columns().size() > version.getMaxColumns()) {
            throw new WriteException("Table " + table.name() + " (" + table.rowCount() + " rows, " + table.columns().size()
                                     + " columns) exceeds the " + version.name() + " limits of " + outputPath.getFileName());
        }
    }

    private static void writeSheet(Workbook workbook, Table table) {
        String sheetName = table.name().isBlank() ? "Sheet1" : WorkbookUtil.createSafeSheetName(table.name());
        Sheet sheet = workbook.createSheet(sheetName);
        CellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

        Row header = sheet.createRow(0);
        for (int c = 0; c < table.columns().size(); c++) {
            header.createCell(c).setCellValue(table.columns().get(c));
        }
        int rowIndex = 1;
        for (List<Object> record : table.records()) {
            Row row = sheet.createRow(rowIndex++);
            for (int c = 0; c < record.size(); c++) {
                Object value = record.get(c);
                if (value != null) {
                    writeCell(row.createCell(c), value, dateStyle);
                }
            }
        }
    }

    private static void writeCell(Cell cell, Object value, CellStyle dateStyle) {
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            cell.setCellValue(value.toString());
        } else if (value instanceof Number n) {
            cell.setCellValue(n.doubleValue());
        } else if (value instanceof Boolean b) {
            cell.setCellValue(b);
        } else if (value instanceof LocalDateTime dt) {
            cell.setCellValue(dt);
            cell.setCellStyle(dateStyle);
        } else if (value instanceof LocalDate d) {
            cell.setCellValue(d);
            cell.setCellStyle(dateStyle);
        } else if (value instanceof Date d) {
            cell.setCellValue(d);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    /**
     * Preamble recovered above a sheet's table.
     *
     * @param tableStartRow first row after the preamble, 0 when there is none
     * @param headerData    preamble lines in order
     */
    record HeaderBlock(int tableStartRow, List<String> headerData) {
        HeaderBlock {
            headerData = List.copyOf(headerData);
        }
    }
}
