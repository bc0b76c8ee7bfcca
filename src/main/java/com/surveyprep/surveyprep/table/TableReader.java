package com.surveyprep.surveyprep.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Table source: parses uploaded CSV or Excel bytes into a {@link Table}.
 */
public class TableReader {

    public static final String FILE_EXT_CSV = ".csv";
    public static final String FILE_EXT_XLSX = ".xlsx";
    public static final String FILE_EXT_XLS = ".xls";

    private static final char BOM = '\uFEFF';
    private static final String UNNAMED_COLUMN_PREFIX = "Unnamed: ";

    private final int excelHeaderRow;

    /**
     * @param excelHeaderRow zero-based index of the header row in Excel sheets
     */
    public TableReader(int excelHeaderRow) {
        if (excelHeaderRow < 0) {
            throw new IllegalArgumentException("Excel header row must not be negative: " + excelHeaderRow);
        }
        this.excelHeaderRow = excelHeaderRow;
    }

    /**
     * Dispatches on the file extension.
     *
     * @throws IllegalArgumentException for unsupported or unreadable files
     */
    public Table read(String fileName, byte[] content) {
        if (fileName == null || content == null || content.length == 0) {
            throw new IllegalArgumentException("Uploaded file is missing or empty");
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(FILE_EXT_CSV)) {
            return readCsv(content);
        }
        if (lower.endsWith(FILE_EXT_XLSX) || lower.endsWith(FILE_EXT_XLS)) {
            return readExcel(content);
        }
        throw new IllegalArgumentException("Unsupported file type: " + fileName + " (expected .csv, .xlsx or .xls)");
    }

    public Table readCsv(byte[] content) {
        try (Reader reader = new BufferedReader(new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8))) {
            reader.mark(1);
            if (reader.read() != BOM) {
                reader.reset();
            }

            CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                    .setTrim(true)
                    .setIgnoreEmptyLines(true)
                    .build();

            try (CSVParser parser = csvFormat.parse(reader)) {
                List<String> columns = null;
                Table.Builder builder = null;
                for (CSVRecord record : parser) {
                    if (columns == null) {
                        List<String> header = new ArrayList<>(record.size());
                        record.forEach(header::add);
                        columns = uniqueHeaders(header);
                        builder = Table.builder(columns);
                        continue;
                    }
                    List<Object> row = new ArrayList<>(columns.size());
                    for (int i = 0; i < columns.size(); i++) {
                        String value = i < record.size() ? record.get(i) : null;
                        row.add(value == null || value.isEmpty() ? null : value);
                    }
                    builder.addRow(row);
                }
                if (builder == null) {
                    throw new IllegalArgumentException("CSV file is empty");
                }
                return builder.build();
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to parse CSV content", ex);
        }
    }

    public Table readExcel(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IllegalArgumentException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(excelHeaderRow);
            if (headerRow == null) {
                throw new IllegalArgumentException("Header row " + (excelHeaderRow + 1) + " not found in first sheet");
            }

            int width = Math.max(headerRow.getLastCellNum(), 0);
            List<String> header = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Object value = cellValue(headerRow.getCell(c));
                header.add(Cells.isBlank(value) ? null : Cells.text(value));
            }
            List<String> columns = uniqueHeaders(header);
            Table.Builder builder = Table.builder(columns);

            for (int r = excelHeaderRow + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<Object> cells = new ArrayList<>(width);
                boolean anyValue = false;
                for (int c = 0; c < width; c++) {
                    Object value = cellValue(row.getCell(c));
                    anyValue |= !Cells.isBlank(value);
                    cells.add(value);
                }
                if (anyValue) {
                    builder.addRow(cells);
                }
            }
            return builder.build();
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read Excel workbook", ex);
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isBlank() ? null : text.trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                double number = cell.getNumericCellValue();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case BOOLEAN:
                return Boolean.toString(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    /**
     * Makes header names unique the way spreadsheet tools do ({@code Q1}, {@code Q1.1}, ...) so that
     * duplicates never look like option columns of a multi-response set.
     */
    static List<String> uniqueHeaders(List<String> headers) {
        List<String> unique = new ArrayList<>(headers.size());
        Set<String> used = new HashSet<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i) == null ? "" : headers.get(i).trim();
            if (!header.isEmpty() && header.charAt(0) == BOM) {
                header = header.substring(1).trim();
            }
            if (header.isEmpty()) {
                header = UNNAMED_COLUMN_PREFIX + i;
            }
            String candidate = header;
            int count = seen.getOrDefault(header, 0);
            while (used.contains(candidate)) {
                count++;
                candidate = header + "." + count;
            }
            seen.put(header, count);
            used.add(candidate);
            unique.add(candidate);
        }
        return unique;
    }
}
