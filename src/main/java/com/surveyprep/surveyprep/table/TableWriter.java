package com.surveyprep.surveyprep.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Table sink: serializes a {@link Table} to CSV (UTF-8 with BOM, readable by spreadsheet tools) or XLSX.
 */
public class TableWriter {

    private static final String SHEET_NAME = "processed";

    public byte[] toCsv(Table table) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            writer.write('\uFEFF');
            printer.printRecord(table.columns());
            for (List<Object> row : table.rows()) {
                List<String> values = new ArrayList<>(row.size());
                for (Object cell : row) {
                    values.add(Cells.text(cell));
                }
                printer.printRecord(values);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write CSV output", ex);
        }
        return out.toByteArray();
    }

    public byte[] toXlsx(Table table) {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            Row headerRow = sheet.createRow(0);
            for (int c = 0; c < table.columnCount(); c++) {
                headerRow.createCell(c).setCellValue(table.columns().get(c));
            }

            for (int r = 0; r < table.rowCount(); r++) {
                Row row = sheet.createRow(r + 1);
                List<Object> cells = table.row(r);
                for (int c = 0; c < cells.size(); c++) {
                    Object value = cells.get(c);
                    if (Cells.isBlank(value)) {
                        continue;
                    }
                    if (value instanceof Number number) {
                        row.createCell(c).setCellValue(number.doubleValue());
                    } else {
                        row.createCell(c).setCellValue(Cells.text(value));
                    }
                }
            }

            workbook.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write Excel output", ex);
        }
    }
}
